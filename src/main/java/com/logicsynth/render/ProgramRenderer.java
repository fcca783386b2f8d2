package com.logicsynth.render;

import com.logicsynth.ir.Atom;
import com.logicsynth.ir.Bound;
import com.logicsynth.ir.Clause;
import com.logicsynth.ir.CompositeKind;
import com.logicsynth.ir.Declaration;
import com.logicsynth.ir.Header;
import com.logicsynth.ir.Premise;
import com.logicsynth.ir.Program;
import com.logicsynth.ir.Term;
import com.logicsynth.ir.Transform;
import com.logicsynth.ir.TransformStatement;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns IR into concrete rule syntax. One method per node kind; the same IR always
 * yields the same text.
 */
@Component
public class ProgramRenderer {

    public RenderedProgram render(Program program) {
        List<String> headers = new ArrayList<>();
        program.packageOpt().ifPresent(h -> headers.add(header("Package", h)));
        program.uses().forEach(h -> headers.add(header("Use", h)));

        List<String> decls = program.decls().stream().map(this::declaration).toList();
        List<String> clauses = program.clauses().stream().map(this::clause).toList();

        List<String> lines = new ArrayList<>(headers);
        lines.addAll(decls);
        lines.addAll(clauses);
        return new RenderedProgram(String.join("\n", lines), decls, clauses);
    }

    String header(String keyword, Header header) {
        StringBuilder sb = new StringBuilder(keyword).append(' ').append(header.name());
        if (!header.atoms().isEmpty()) {
            sb.append(' ').append(atomList(header.atoms()));
        }
        return sb.append('!').toString();
    }

    public String declaration(Declaration decl) {
        StringBuilder sb = new StringBuilder("Decl ").append(atom(decl.atom()));
        if (!decl.descr().isEmpty()) {
            sb.append(" descr ").append(atomList(decl.descr()));
        }
        for (Bound bound : decl.bounds()) {
            sb.append(" bound ").append(termList(bound.terms()));
        }
        if (!decl.inclusion().isEmpty()) {
            sb.append(" inclusion ").append(atomList(decl.inclusion()));
        }
        return sb.append('.').toString();
    }

    public String clause(Clause clause) {
        if (clause.isUnitFact()) {
            return atom(clause.head()) + ".";
        }
        StringBuilder sb = new StringBuilder(atom(clause.head()));
        if (!clause.body().isEmpty()) {
            sb.append(" :- ").append(clause.body().stream().map(this::premise).collect(Collectors.joining(", ")));
        }
        clause.transformOpt().ifPresent(t -> sb.append(" |> ").append(transform(t)));
        return sb.append('.').toString();
    }

    public String premise(Premise premise) {
        if (premise instanceof Premise.Positive p) {
            return atom(p.atom());
        }
        if (premise instanceof Premise.Negated n) {
            return "!" + atom(n.atom());
        }
        if (premise instanceof Premise.Equality e) {
            return term(e.left()) + " = " + term(e.right());
        }
        if (premise instanceof Premise.Inequality i) {
            return term(i.left()) + " != " + term(i.right());
        }
        Premise.Comparison c = (Premise.Comparison) premise;
        return c.op().builtin() + "(" + term(c.left()) + ", " + term(c.right()) + ")";
    }

    String transform(Transform transform) {
        return transform.statements().stream().map(this::statement).collect(Collectors.joining(", "));
    }

    private String statement(TransformStatement statement) {
        if (statement.isLet()) {
            return "let " + statement.variable() + " = " + term(statement.function());
        }
        return "do " + term(statement.function());
    }

    public String atom(Atom atom) {
        return atom.predicate() + "(" + joined(atom.args()) + ")";
    }

    public String term(Term term) {
        if (term instanceof Term.Variable v) {
            return v.name();
        }
        if (term instanceof Term.Name n) {
            return n.symbol();
        }
        if (term instanceof Term.Text t) {
            return quote(t.value());
        }
        if (term instanceof Term.Bytes b) {
            return "b" + quote(b.value());
        }
        if (term instanceof Term.Number n) {
            return Long.toString(n.value());
        }
        if (term instanceof Term.Float64 f) {
            return floatLiteral(f.value());
        }
        if (term instanceof Term.Apply a) {
            return a.function() + "(" + joined(a.args()) + ")";
        }
        Term.Composite c = (Term.Composite) term;
        if (c.args().isEmpty() && c.compositeKind() == CompositeKind.MAP) {
            // "[]" would read back as an empty list
            return CompositeKind.MAP.function() + "()";
        }
        return switch (c.compositeKind()) {
            case LIST -> "[" + joined(c.args()) + "]";
            case MAP -> "[" + pairs(c.args()) + "]";
            case STRUCT -> "{" + pairs(c.args()) + "}";
        };
    }

    private String atomList(List<Atom> atoms) {
        return "[" + atoms.stream().map(this::atom).collect(Collectors.joining(", ")) + "]";
    }

    private String termList(List<Term> terms) {
        return "[" + joined(terms) + "]";
    }

    private String joined(List<Term> terms) {
        return terms.stream().map(this::term).collect(Collectors.joining(", "));
    }

    private String pairs(List<Term> args) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i + 1 < args.size(); i += 2) {
            out.add(term(args.get(i)) + ": " + term(args.get(i + 1)));
        }
        return String.join(", ", out);
    }

    /** Always carries a decimal point so the literal reads back as a float. */
    static String floatLiteral(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("float literal must be finite: " + value);
        }
        String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }

    static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
