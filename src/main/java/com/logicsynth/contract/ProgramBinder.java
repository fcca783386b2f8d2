package com.logicsynth.contract;

import com.logicsynth.contract.SynthesisDocument.AtomSpec;
import com.logicsynth.contract.SynthesisDocument.ClauseSpec;
import com.logicsynth.contract.SynthesisDocument.DeclSpec;
import com.logicsynth.contract.SynthesisDocument.ExprSpec;
import com.logicsynth.contract.SynthesisDocument.HeaderSpec;
import com.logicsynth.contract.SynthesisDocument.ProgramSpec;
import com.logicsynth.contract.SynthesisDocument.TermSpec;
import com.logicsynth.contract.SynthesisDocument.TransformSpec;
import com.logicsynth.contract.SynthesisDocument.TransformStmtSpec;
import com.logicsynth.ir.Atom;
import com.logicsynth.ir.Bound;
import com.logicsynth.ir.Clause;
import com.logicsynth.ir.ComparisonOp;
import com.logicsynth.ir.CompositeKind;
import com.logicsynth.ir.Declaration;
import com.logicsynth.ir.Header;
import com.logicsynth.ir.Premise;
import com.logicsynth.ir.Program;
import com.logicsynth.ir.Term;
import com.logicsynth.ir.TermKind;
import com.logicsynth.ir.Transform;
import com.logicsynth.ir.TransformStatement;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds IR from a document that already passed the structural checks of
 * {@link ProgramSpecValidator}. Positions are preserved so diagnostics on the IR can use
 * the same field paths as the document.
 */
@Component
public class ProgramBinder {

    public Program bind(ProgramSpec spec) {
        Header pkg = spec.packageSpec() == null ? null : bindHeader(spec.packageSpec());
        return new Program(
            pkg,
            spec.use().stream().map(this::bindHeader).toList(),
            spec.decls().stream().map(this::bindDecl).toList(),
            spec.clauses().stream().map(this::bindClause).toList());
    }

    private Header bindHeader(HeaderSpec spec) {
        return new Header(spec.name().trim(), bindAtoms(spec.atoms()));
    }

    private Declaration bindDecl(DeclSpec spec) {
        return new Declaration(
            bindAtom(spec.atom()),
            bindAtoms(spec.descr()),
            spec.bounds().stream().map(b -> new Bound(bindExprs(b.terms()))).toList(),
            bindAtoms(spec.inclusion()));
    }

    private Clause bindClause(ClauseSpec spec) {
        List<Premise> body = spec.body().stream().map(this::bindPremise).toList();
        return new Clause(bindAtom(spec.head()), body, bindTransform(spec.transform()));
    }

    private Transform bindTransform(TransformSpec spec) {
        if (spec == null) {
            return null;
        }
        return new Transform(spec.statements().stream().map(this::bindStatement).toList());
    }

    private TransformStatement bindStatement(TransformStmtSpec spec) {
        Term.Apply fn = bindApply(spec.fn());
        if ("let".equalsIgnoreCase(spec.kind().trim())) {
            return TransformStatement.let(spec.var(), fn);
        }
        return TransformStatement.doing(fn);
    }

    private Premise bindPremise(TermSpec spec) {
        String kind = spec.kind().trim().toLowerCase();
        return switch (kind) {
            case "atom" -> positiveOrBuiltin(bindAtom(spec.atom()));
            case "not" -> new Premise.Negated(bindAtom(spec.atom()));
            case "eq" -> new Premise.Equality(bindExpr(spec.left()), bindExpr(spec.right()));
            case "neq" -> new Premise.Inequality(bindExpr(spec.left()), bindExpr(spec.right()));
            case "cmp" -> new Premise.Comparison(
                ComparisonOp.fromCode(spec.op()).orElseThrow(), bindExpr(spec.left()), bindExpr(spec.right()));
            default -> throw new IllegalStateException("unvalidated body kind: " + spec.kind());
        };
    }

    /** {@code :gt(X, 3)} written as an atom is the same premise as the cmp form. */
    private Premise positiveOrBuiltin(Atom atom) {
        return ComparisonOp.fromBuiltin(atom.predicate())
            .filter(op -> atom.arity() == 2)
            .<Premise>map(op -> new Premise.Comparison(op, atom.args().get(0), atom.args().get(1)))
            .orElseGet(() -> new Premise.Positive(atom));
    }

    private List<Atom> bindAtoms(List<AtomSpec> specs) {
        return specs.stream().map(this::bindAtom).toList();
    }

    private Atom bindAtom(AtomSpec spec) {
        return new Atom(spec.pred().trim(), bindExprs(spec.args()));
    }

    private List<Term> bindExprs(List<ExprSpec> specs) {
        return specs.stream().map(this::bindExpr).toList();
    }

    public Term bindExpr(ExprSpec spec) {
        TermKind kind = TermKind.fromValue(spec.kind());
        if (kind == null) {
            throw new IllegalStateException("unvalidated expr kind: " + spec.kind());
        }
        return switch (kind) {
            case VAR -> new Term.Variable(spec.value());
            case NAME -> new Term.Name(spec.value());
            case STRING -> new Term.Text(spec.value() == null ? "" : spec.value());
            case BYTES -> new Term.Bytes(spec.value() == null ? "" : spec.value());
            case NUMBER -> new Term.Number(ProgramSpecValidator.parseLong(
                spec.number() != null && !spec.number().isBlank() ? spec.number() : spec.value()));
            case FLOAT -> new Term.Float64(ProgramSpecValidator.parseDouble(
                spec.floatValue() != null && !spec.floatValue().isBlank() ? spec.floatValue() : spec.value()));
            case APPLY -> collectionLiteral(bindApply(spec));
            case LIST -> new Term.Composite(CompositeKind.LIST, bindExprs(spec.args()));
            case MAP -> new Term.Composite(CompositeKind.MAP, bindExprs(spec.args()));
            case STRUCT -> new Term.Composite(CompositeKind.STRUCT, bindExprs(spec.args()));
        };
    }

    private Term.Apply bindApply(ExprSpec spec) {
        return new Term.Apply(spec.function().trim(), bindExprs(spec.args()),
            spec.arity() == null || spec.arity() == -1 ? null : spec.arity());
    }

    /** {@code fn:list(a, b)} and {@code [a, b]} are one term; keep the literal form. */
    private static Term collectionLiteral(Term.Apply apply) {
        return CompositeKind.fromFunction(apply.function())
            .filter(k -> !k.requiresPairs() || apply.args().size() % 2 == 0)
            .<Term>map(k -> new Term.Composite(k, apply.args()))
            .orElse(apply);
    }
}
