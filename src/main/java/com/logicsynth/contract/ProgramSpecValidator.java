package com.logicsynth.contract;

import com.logicsynth.contract.SynthesisDocument.AtomSpec;
import com.logicsynth.contract.SynthesisDocument.BoundSpec;
import com.logicsynth.contract.SynthesisDocument.ClauseSpec;
import com.logicsynth.contract.SynthesisDocument.DeclSpec;
import com.logicsynth.contract.SynthesisDocument.ExprSpec;
import com.logicsynth.contract.SynthesisDocument.HeaderSpec;
import com.logicsynth.contract.SynthesisDocument.ProgramSpec;
import com.logicsynth.contract.SynthesisDocument.TermSpec;
import com.logicsynth.contract.SynthesisDocument.TransformStmtSpec;
import com.logicsynth.ir.ComparisonOp;
import com.logicsynth.ir.Lexicon;
import com.logicsynth.ir.Program;
import com.logicsynth.ir.TermKind;
import com.logicsynth.schema.SchemaRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a decoded synthesis document against the rule grammar before any IR node is built.
 *
 * The walk is recursive descent over the document, carrying the field path of the node being
 * checked; every violation is collected, not only the first. When the document is structurally
 * sound it is bound to IR and handed to {@link SemanticChecker} for the clause-level invariants.
 */
@Component
public class ProgramSpecValidator {

    private static final Set<String> BODY_KINDS = Set.of("atom", "not", "eq", "neq", "cmp");

    private final ProgramBinder binder;
    private final SemanticChecker semanticChecker;

    public ProgramSpecValidator(ProgramBinder binder, SemanticChecker semanticChecker) {
        this.binder = binder;
        this.semanticChecker = semanticChecker;
    }

    public ValidationResult validate(SynthesisDocument document, CompileOptions options, SchemaRegistry schema) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (document == null) {
            diagnostics.add(Diagnostic.schema("", "document is required"));
            return ValidationResult.rejected(diagnostics);
        }
        if (!SynthesisDocument.FORMAT_V1.equals(document.format())) {
            diagnostics.add(Diagnostic.schema("format",
                "expected \"" + SynthesisDocument.FORMAT_V1 + "\", got " + quote(document.format())));
        }
        ProgramSpec program = document.program();
        if (program == null) {
            diagnostics.add(Diagnostic.schema("program", "program is required"));
            return ValidationResult.rejected(diagnostics);
        }
        validateProgram(program, options, diagnostics);
        if (!diagnostics.isEmpty()) {
            return ValidationResult.rejected(diagnostics);
        }

        Program bound = binder.bind(program);
        diagnostics.addAll(semanticChecker.check(bound, options, schema));
        if (!diagnostics.isEmpty()) {
            return ValidationResult.rejected(diagnostics);
        }
        return ValidationResult.accepted(bound);
    }

    private void validateProgram(ProgramSpec program, CompileOptions options, List<Diagnostic> out) {
        if (program.packageSpec() == null && program.use().isEmpty()
                && program.decls().isEmpty() && program.clauses().isEmpty()) {
            out.add(Diagnostic.schema("program", "program must contain at least one clause or declaration"));
            return;
        }

        if (program.packageSpec() != null && !options.allowPackage()) {
            out.add(Diagnostic.schema("program.package", "package declarations are not allowed"));
        }
        if (!program.use().isEmpty() && !options.allowUse()) {
            out.add(Diagnostic.schema("program.use", "use declarations are not allowed"));
        }
        if (!program.decls().isEmpty() && !options.allowDecls()) {
            out.add(Diagnostic.schema("program.decls", "decl declarations are not allowed"));
        }
        if (options.requireSingleClause() && program.clauses().size() != 1) {
            out.add(Diagnostic.schema("program.clauses", "expected exactly one clause"));
        }

        if (program.packageSpec() != null) {
            validateHeader(program.packageSpec(), "program.package", "package", out);
        }
        for (int i = 0; i < program.use().size(); i++) {
            validateHeader(program.use().get(i), "program.use[" + i + "]", "use", out);
        }
        for (int i = 0; i < program.decls().size(); i++) {
            validateDecl(program.decls().get(i), "program.decls[" + i + "]", out);
        }
        for (int i = 0; i < program.clauses().size(); i++) {
            validateClause(program.clauses().get(i), "program.clauses[" + i + "]", out);
        }
    }

    private void validateHeader(HeaderSpec header, String path, String what, List<Diagnostic> out) {
        if (header == null) {
            out.add(Diagnostic.schema(path, what + " entry is missing"));
            return;
        }
        if (isBlank(header.name())) {
            out.add(Diagnostic.schema(path + ".name", what + " name is required"));
        } else if (!Lexicon.isPredicate(header.name())) {
            out.add(Diagnostic.schema(path + ".name", what + " name must be a valid NAME token"));
        }
        validateAtoms(header.atoms(), path + ".atoms", out);
    }

    private void validateDecl(DeclSpec decl, String path, List<Diagnostic> out) {
        if (decl == null) {
            out.add(Diagnostic.schema(path, "declaration is missing"));
            return;
        }
        if (decl.atom() == null) {
            out.add(Diagnostic.schema(path + ".atom", "declaration atom is required"));
        } else {
            validateAtom(decl.atom(), path + ".atom", out);
            Set<String> seen = new HashSet<>();
            for (int j = 0; j < decl.atom().args().size(); j++) {
                ExprSpec arg = decl.atom().args().get(j);
                if (arg == null || kindOf(arg) != TermKind.VAR) {
                    out.add(Diagnostic.schema(path + ".atom.args[" + j + "]",
                        "declaration arguments must be variables"));
                } else if (arg.value() != null && (arg.value().equals("_") || !seen.add(arg.value()))) {
                    out.add(Diagnostic.schema(path + ".atom.args[" + j + "].value",
                        "declaration arguments must be distinct named variables"));
                }
            }
        }
        validateAtoms(decl.descr(), path + ".descr", out);
        for (int i = 0; i < decl.bounds().size(); i++) {
            String boundPath = path + ".bounds[" + i + "]";
            BoundSpec bound = decl.bounds().get(i);
            if (bound == null || bound.terms().isEmpty()) {
                out.add(Diagnostic.schema(boundPath, "bound terms are required"));
                continue;
            }
            if (decl.atom() != null && bound.terms().size() != decl.atom().args().size()) {
                out.add(Diagnostic.schema(boundPath + ".terms", "bound has " + bound.terms().size()
                    + " terms but the declaration has arity " + decl.atom().args().size()));
            }
            for (int j = 0; j < bound.terms().size(); j++) {
                validateExpr(bound.terms().get(j), boundPath + ".terms[" + j + "]", out);
            }
        }
        validateAtoms(decl.inclusion(), path + ".inclusion", out);
    }

    private void validateClause(ClauseSpec clause, String path, List<Diagnostic> out) {
        if (clause == null) {
            out.add(Diagnostic.schema(path, "clause is missing"));
            return;
        }
        if (clause.head() == null) {
            out.add(Diagnostic.schema(path + ".head", "clause head is required"));
        } else {
            validateAtom(clause.head(), path + ".head", out);
        }
        for (int i = 0; i < clause.body().size(); i++) {
            validateBodyTerm(clause.body().get(i), path + ".body[" + i + "]", out);
        }
        if (clause.transform() != null) {
            String transformPath = path + ".transform";
            List<TransformStmtSpec> statements = clause.transform().statements();
            if (statements.isEmpty()) {
                out.add(Diagnostic.schema(transformPath + ".statements", "transform statements are required"));
            }
            if (clause.body().isEmpty()) {
                out.add(Diagnostic.schema(transformPath, "transform requires a clause body"));
            }
            for (int i = 0; i < statements.size(); i++) {
                validateTransformStmt(statements.get(i), transformPath + ".statements[" + i + "]", out);
            }
        }
    }

    private void validateTransformStmt(TransformStmtSpec stmt, String path, List<Diagnostic> out) {
        if (stmt == null) {
            out.add(Diagnostic.schema(path, "transform statement is missing"));
            return;
        }
        String kind = normalize(stmt.kind());
        if (!"do".equals(kind) && !"let".equals(kind)) {
            out.add(Diagnostic.schema(path + ".kind", "transform kind must be \"do\" or \"let\""));
        }
        if ("let".equals(kind) && (!Lexicon.isVariable(stmt.var()) || "_".equals(stmt.var()))) {
            out.add(Diagnostic.schema(path + ".var", "let transforms require a valid variable name"));
        }
        if (stmt.fn() == null) {
            out.add(Diagnostic.schema(path + ".fn", "transform function is required"));
            return;
        }
        if (kindOf(stmt.fn()) != TermKind.APPLY) {
            out.add(Diagnostic.schema(path + ".fn.kind", "transform function must be an apply expression"));
            return;
        }
        validateExpr(stmt.fn(), path + ".fn", out);
    }

    private void validateBodyTerm(TermSpec term, String path, List<Diagnostic> out) {
        if (term == null) {
            out.add(Diagnostic.schema(path, "body term is missing"));
            return;
        }
        String kind = normalize(term.kind());
        if (!BODY_KINDS.contains(kind)) {
            out.add(Diagnostic.schema(path + ".kind", "term kind must be atom, not, eq, neq, or cmp"));
            return;
        }
        switch (kind) {
            case "atom", "not" -> {
                if (term.atom() == null) {
                    out.add(Diagnostic.schema(path + ".atom",
                        ("not".equals(kind) ? "negated" : "atom") + " term requires atom"));
                } else {
                    validateAtom(term.atom(), path + ".atom", out);
                }
            }
            default -> {
                if ("cmp".equals(kind) && ComparisonOp.fromCode(term.op()).isEmpty()) {
                    out.add(Diagnostic.schema(path + ".op", "cmp op must be lt, le, gt, or ge"));
                }
                if (term.left() == null || term.right() == null) {
                    out.add(Diagnostic.schema(path, "comparison requires left and right"));
                }
                if (term.left() != null) {
                    validateExpr(term.left(), path + ".left", out);
                }
                if (term.right() != null) {
                    validateExpr(term.right(), path + ".right", out);
                }
            }
        }
    }

    private void validateAtoms(List<AtomSpec> atoms, String path, List<Diagnostic> out) {
        for (int i = 0; i < atoms.size(); i++) {
            AtomSpec atom = atoms.get(i);
            if (atom == null) {
                out.add(Diagnostic.schema(path + "[" + i + "]", "atom is missing"));
            } else {
                validateAtom(atom, path + "[" + i + "]", out);
            }
        }
    }

    private void validateAtom(AtomSpec atom, String path, List<Diagnostic> out) {
        String pred = atom.pred();
        if (isBlank(pred)) {
            out.add(Diagnostic.schema(path + ".pred", "predicate is required"));
        } else if (pred.startsWith(Lexicon.FUNCTION_PREFIX)) {
            out.add(Diagnostic.schema(path + ".pred", "predicate must not start with \"fn:\""));
        } else if (!Lexicon.isPredicate(pred)) {
            out.add(Diagnostic.schema(path + ".pred", "predicate must be a valid NAME token"));
        }
        validateExprs(atom.args(), path + ".args", out);
    }

    private void validateExprs(List<ExprSpec> exprs, String path, List<Diagnostic> out) {
        for (int i = 0; i < exprs.size(); i++) {
            validateExpr(exprs.get(i), path + "[" + i + "]", out);
        }
    }

    public void validateExpr(ExprSpec expr, String path, List<Diagnostic> out) {
        if (expr == null) {
            out.add(Diagnostic.schema(path, "expression is missing"));
            return;
        }
        TermKind kind = kindOf(expr);
        if (kind == null) {
            out.add(Diagnostic.schema(path + ".kind",
                "expr kind must be var, name, string, bytes, number, float, apply, list, map, or struct"));
            return;
        }
        switch (kind) {
            case VAR -> {
                if (!Lexicon.isVariable(expr.value())) {
                    out.add(Diagnostic.schema(path + ".value", "variable must be '_' or start with uppercase letter"));
                }
            }
            case NAME -> {
                if (expr.value() == null || !expr.value().startsWith(Lexicon.NAME_PREFIX)) {
                    out.add(Diagnostic.schema(path + ".value", "name constant must start with '/'"));
                } else if (!Lexicon.isName(expr.value())) {
                    out.add(Diagnostic.schema(path + ".value",
                        "name constant must be '/'-separated segments of letters, digits, '_', '.', '-', '~' or '%'"));
                }
            }
            case STRING, BYTES -> {
                // may be empty
            }
            case NUMBER -> validateNumber(expr, path, out);
            case FLOAT -> validateFloat(expr, path, out);
            case APPLY -> {
                if (isBlank(expr.function())) {
                    out.add(Diagnostic.schema(path + ".function", "apply function name is required"));
                } else if (!expr.function().startsWith(Lexicon.FUNCTION_PREFIX)) {
                    out.add(Diagnostic.schema(path + ".function", "apply function must start with \"fn:\""));
                } else if (!Lexicon.isFunction(expr.function())) {
                    out.add(Diagnostic.schema(path + ".function", "apply function must be a valid fn: identifier"));
                }
                validateArity(expr.arity(), expr.args().size(), path + ".arity", out);
                validateExprs(expr.args(), path + ".args", out);
            }
            case LIST, MAP, STRUCT -> {
                validateArity(expr.arity(), expr.args().size(), path + ".arity", out);
                if (kind != TermKind.LIST && expr.args().size() % 2 != 0) {
                    out.add(Diagnostic.schema(path + ".args", "map/struct require even number of args"));
                }
                validateExprs(expr.args(), path + ".args", out);
            }
        }
    }

    private void validateNumber(ExprSpec expr, String path, List<Diagnostic> out) {
        if (!isBlank(expr.number())) {
            if (parseLong(expr.number()) == null) {
                out.add(Diagnostic.schema(path + ".number", "number must be an integer"));
            }
            return;
        }
        if (!isBlank(expr.value())) {
            if (parseLong(expr.value()) == null) {
                out.add(Diagnostic.schema(path + ".value", "number value must be an integer"));
            }
            return;
        }
        out.add(Diagnostic.schema(path, "number requires number or value"));
    }

    private void validateFloat(ExprSpec expr, String path, List<Diagnostic> out) {
        String field = !isBlank(expr.floatValue()) ? "float" : "value";
        String raw = !isBlank(expr.floatValue()) ? expr.floatValue() : expr.value();
        if (isBlank(raw)) {
            out.add(Diagnostic.schema(path, "float requires float or value"));
            return;
        }
        Double parsed = parseDouble(raw);
        if (parsed == null || parsed.isNaN() || parsed.isInfinite()) {
            out.add(Diagnostic.schema(path + "." + field, "float value must be numeric"));
        }
    }

    private void validateArity(Integer arity, int argCount, String path, List<Diagnostic> out) {
        if (arity == null || arity == -1) {
            return;
        }
        if (arity != argCount) {
            out.add(Diagnostic.schema(path, "arity " + arity + " does not match args length " + argCount));
        }
    }

    static TermKind kindOf(ExprSpec expr) {
        return TermKind.fromValue(expr.kind());
    }

    static Long parseLong(String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    static Double parseDouble(String raw) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String quote(String value) {
        return value == null ? "nothing" : "\"" + value + "\"";
    }
}
