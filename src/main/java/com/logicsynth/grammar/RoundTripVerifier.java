package com.logicsynth.grammar;

import com.logicsynth.contract.Diagnostic;
import com.logicsynth.ir.Atom;
import com.logicsynth.ir.Clause;
import com.logicsynth.ir.Declaration;
import com.logicsynth.ir.Header;
import com.logicsynth.ir.Premise;
import com.logicsynth.ir.Program;
import com.logicsynth.ir.Term;
import com.logicsynth.ir.TransformStatement;
import com.logicsynth.render.RenderedProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads rendered text back through the parser and analyser and checks that it still has the
 * shape of the IR it was rendered from: same predicates, arities and argument kinds.
 */
@Component
public class RoundTripVerifier {

    private static final Logger log = LoggerFactory.getLogger(RoundTripVerifier.class);

    private final ProgramAnalyzer analyzer;

    public RoundTripVerifier(ProgramAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public List<Diagnostic> verify(Program expected, RenderedProgram rendered) {
        Program parsed;
        try {
            parsed = ProgramParser.parseProgram(rendered.source());
        } catch (ParseException ex) {
            log.warn("Rendered program does not parse: {}", ex.getMessage());
            return List.of(Diagnostic.grammar("source", "rendered program does not parse: " + ex.getMessage()));
        }

        List<Diagnostic> out = new ArrayList<>();
        for (AnalysisIssue issue : analyzer.analyze(parsed)) {
            out.add(Diagnostic.grammar(issue.location(), issue.message()));
        }
        compareShapes(expected, parsed, out);
        return out;
    }

    private void compareShapes(Program expected, Program parsed, List<Diagnostic> out) {
        String expectedPkg = expected.packageOpt().map(RoundTripVerifier::shape).orElse("");
        String parsedPkg = parsed.packageOpt().map(RoundTripVerifier::shape).orElse("");
        if (!expectedPkg.equals(parsedPkg)) {
            out.add(mismatch("program.package", expectedPkg, parsedPkg));
        }
        compareLists("program.use", shapes(expected.uses()), shapes(parsed.uses()), out);
        compareLists("program.decls",
            expected.decls().stream().map(RoundTripVerifier::shape).toList(),
            parsed.decls().stream().map(RoundTripVerifier::shape).toList(), out);
        compareLists("program.clauses",
            expected.clauses().stream().map(RoundTripVerifier::shape).toList(),
            parsed.clauses().stream().map(RoundTripVerifier::shape).toList(), out);
    }

    private static void compareLists(String path, List<String> expected, List<String> parsed, List<Diagnostic> out) {
        if (expected.size() != parsed.size()) {
            out.add(Diagnostic.grammar(path, "rendered text holds " + parsed.size() + " entries, expected "
                + expected.size()));
            return;
        }
        for (int i = 0; i < expected.size(); i++) {
            if (!expected.get(i).equals(parsed.get(i))) {
                out.add(mismatch(path + "[" + i + "]", expected.get(i), parsed.get(i)));
            }
        }
    }

    private static Diagnostic mismatch(String path, String expected, String parsed) {
        return Diagnostic.grammar(path, "rendered text reads back as " + parsed + ", expected " + expected);
    }

    private static List<String> shapes(List<Header> headers) {
        return headers.stream().map(RoundTripVerifier::shape).toList();
    }

    static String shape(Header header) {
        return header.name() + atoms(header.atoms());
    }

    static String shape(Declaration decl) {
        return shape(decl.atom()) + " descr" + atoms(decl.descr())
            + " bounds" + decl.bounds().stream().map(b -> terms(b.terms())).toList()
            + " inclusion" + atoms(decl.inclusion());
    }

    static String shape(Clause clause) {
        StringBuilder sb = new StringBuilder(shape(clause.head()));
        sb.append(" :- ").append(clause.body().stream().map(RoundTripVerifier::shape).collect(Collectors.joining(", ")));
        clause.transformOpt().ifPresent(t -> sb.append(" |> ")
            .append(t.statements().stream().map(RoundTripVerifier::shape).collect(Collectors.joining(", "))));
        return sb.toString();
    }

    private static String shape(Premise premise) {
        if (premise instanceof Premise.Positive p) {
            return shape(p.atom());
        }
        if (premise instanceof Premise.Negated n) {
            return "!" + shape(n.atom());
        }
        if (premise instanceof Premise.Equality e) {
            return shape(e.left()) + " = " + shape(e.right());
        }
        if (premise instanceof Premise.Inequality i) {
            return shape(i.left()) + " != " + shape(i.right());
        }
        Premise.Comparison c = (Premise.Comparison) premise;
        return c.op().builtin() + "(" + shape(c.left()) + ", " + shape(c.right()) + ")";
    }

    private static String shape(TransformStatement statement) {
        return (statement.isLet() ? "let " + statement.variable() : "do") + " " + shape(statement.function());
    }

    private static String shape(Atom atom) {
        return atom.predicate() + "/" + atom.arity() + terms(atom.args());
    }

    private static String atoms(List<Atom> atoms) {
        return atoms.stream().map(RoundTripVerifier::shape).toList().toString();
    }

    private static String terms(List<Term> terms) {
        return terms.stream().map(RoundTripVerifier::shape).collect(Collectors.joining(", ", "(", ")"));
    }

    /** Kind of the term; functions keep their name, nested terms their own shape. */
    private static String shape(Term term) {
        if (term instanceof Term.Apply apply) {
            return apply.function() + terms(apply.args());
        }
        if (term instanceof Term.Composite composite) {
            return composite.kind().getValue() + terms(composite.args());
        }
        return term.kind().getValue();
    }
}
