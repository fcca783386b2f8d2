package com.logicsynth.grammar;

import com.logicsynth.ir.Atom;
import com.logicsynth.ir.Clause;
import com.logicsynth.ir.Declaration;
import com.logicsynth.ir.Premise;
import com.logicsynth.ir.Program;
import com.logicsynth.ir.Safety;
import com.logicsynth.ir.Term;
import com.logicsynth.ir.TransformStatement;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Built-in analysis: declaration uniqueness, arity consistency, clause safety, known
 * functions and stratification.
 */
@Component
public class DefaultProgramAnalyzer implements ProgramAnalyzer {

    @Override
    public List<AnalysisIssue> analyze(Program program) {
        List<AnalysisIssue> issues = new ArrayList<>();
        Map<String, Integer> arities = new HashMap<>();

        Set<String> declared = new HashSet<>();
        for (int i = 0; i < program.decls().size(); i++) {
            Declaration decl = program.decls().get(i);
            String path = "program.decls[" + i + "]";
            if (!declared.add(decl.predicate())) {
                issues.add(new AnalysisIssue(path, "predicate " + decl.predicate() + " declared twice"));
            }
            Set<String> seen = new HashSet<>();
            for (Term arg : decl.atom().args()) {
                if (!(arg instanceof Term.Variable v) || v.isWildcard() || !seen.add(v.name())) {
                    issues.add(new AnalysisIssue(path + ".atom",
                        "declaration arguments must be distinct named variables"));
                    break;
                }
            }
            arities.putIfAbsent(decl.predicate(), decl.arity());
        }

        for (int i = 0; i < program.clauses().size(); i++) {
            Clause clause = program.clauses().get(i);
            String path = "program.clauses[" + i + "]";
            checkAtom(clause.head(), path + ".head", arities, issues);
            for (int k = 0; k < clause.body().size(); k++) {
                checkPremise(clause.body().get(k), path + ".body[" + k + "]", arities, issues);
            }
            if (clause.transform() != null) {
                List<TransformStatement> statements = clause.transform().statements();
                for (int k = 0; k < statements.size(); k++) {
                    checkTerm(statements.get(k).function(), path + ".transform.statements[" + k + "].fn", issues);
                }
            }
            for (Safety.Violation violation : Safety.check(clause)) {
                issues.add(new AnalysisIssue(path + "." + violation.location(), violation.message()));
            }
        }

        for (Set<String> component : DependencyGraph.of(program).unstratifiableComponents()) {
            issues.add(new AnalysisIssue("program",
                "program is not stratifiable: recursion through negation or aggregation among " + component));
        }
        return issues;
    }

    private void checkPremise(Premise premise, String path, Map<String, Integer> arities, List<AnalysisIssue> issues) {
        if (premise instanceof Premise.Positive p) {
            checkAtom(p.atom(), path, arities, issues);
        } else if (premise instanceof Premise.Negated n) {
            checkAtom(n.atom(), path, arities, issues);
        } else if (premise instanceof Premise.Equality e) {
            checkTerm(e.left(), path + ".left", issues);
            checkTerm(e.right(), path + ".right", issues);
        } else if (premise instanceof Premise.Inequality ne) {
            checkTerm(ne.left(), path + ".left", issues);
            checkTerm(ne.right(), path + ".right", issues);
        } else if (premise instanceof Premise.Comparison c) {
            checkTerm(c.left(), path + ".left", issues);
            checkTerm(c.right(), path + ".right", issues);
        }
    }

    private void checkAtom(Atom atom, String path, Map<String, Integer> arities, List<AnalysisIssue> issues) {
        if (atom.predicate().startsWith(":")) {
            issues.add(new AnalysisIssue(path, "unknown built-in predicate " + atom.predicate()));
            return;
        }
        Integer expected = arities.putIfAbsent(atom.predicate(), atom.arity());
        if (expected != null && expected != atom.arity()) {
            issues.add(new AnalysisIssue(path, "predicate " + atom.predicate() + " used with arity "
                + atom.arity() + " but has arity " + expected));
        }
        for (int i = 0; i < atom.args().size(); i++) {
            checkTerm(atom.args().get(i), path + ".args[" + i + "]", issues);
        }
    }

    private void checkTerm(Term term, String path, List<AnalysisIssue> issues) {
        List<Term> args;
        if (term instanceof Term.Apply apply) {
            if (!BuiltinFunctions.isKnown(apply.function())) {
                issues.add(new AnalysisIssue(path, "unknown function " + apply.function()));
            } else {
                OptionalInt fixed = BuiltinFunctions.fixedArity(apply.function());
                if (fixed.isPresent() && fixed.getAsInt() != apply.args().size()) {
                    issues.add(new AnalysisIssue(path, "function " + apply.function() + " takes "
                        + fixed.getAsInt() + " args, got " + apply.args().size()));
                }
            }
            args = apply.args();
        } else if (term instanceof Term.Composite composite) {
            args = composite.args();
        } else {
            return;
        }
        for (int i = 0; i < args.size(); i++) {
            checkTerm(args.get(i), path + ".args[" + i + "]", issues);
        }
    }
}
