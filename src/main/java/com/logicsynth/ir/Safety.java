package com.logicsynth.ir;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Range restriction of a single clause. A variable is bound by a positive premise, by an
 * equality whose other side is already bound, or (for the head only) by a {@code let}
 * statement of the transform. Every other occurrence must refer to a bound variable.
 */
public final class Safety {

    /**
     * @param location path of the offending element relative to the clause, e.g. {@code body[1]}
     */
    public record Violation(String variable, String location, String message) {}

    private Safety() {}

    public static List<Violation> check(Clause clause) {
        List<Violation> violations = new ArrayList<>();
        Atom head = clause.head();

        for (int j = 0; j < head.args().size(); j++) {
            if (containsWildcard(head.args().get(j))) {
                violations.add(new Violation(Term.WILDCARD, "head.args[" + j + "]",
                    "wildcard is not allowed in a clause head"));
            }
        }

        if (clause.isUnitFact()) {
            for (String v : head.variables()) {
                violations.add(new Violation(v, headLocation(head, v), "fact must be ground, found variable " + v));
            }
            return violations;
        }

        Set<String> bound = bodyBindings(clause.body());
        List<Premise> body = clause.body();
        for (int i = 0; i < body.size(); i++) {
            Premise premise = body.get(i);
            if (premise instanceof Premise.Positive) {
                continue;
            }
            String what = premise instanceof Premise.Negated ? "negated premise"
                : premise instanceof Premise.Comparison ? "comparison"
                : premise instanceof Premise.Inequality ? "inequality" : "equality";
            for (String v : premise.variables()) {
                if (!bound.contains(v)) {
                    violations.add(new Violation(v, "body[" + i + "]",
                        "variable " + v + " in " + what + " is not bound by a positive premise"));
                }
            }
        }

        Set<String> headBound = new HashSet<>(bound);
        if (clause.transform() != null) {
            List<TransformStatement> statements = clause.transform().statements();
            for (int i = 0; i < statements.size(); i++) {
                TransformStatement stmt = statements.get(i);
                String location = "transform.statements[" + i + "]";
                Set<String> used = new LinkedHashSet<>();
                stmt.function().collectVariables(used);
                for (String v : used) {
                    if (!headBound.contains(v)) {
                        violations.add(new Violation(v, location + ".fn",
                            "variable " + v + " in transform is not bound by the body"));
                    }
                }
                if (stmt.isLet()) {
                    if (headBound.contains(stmt.variable())) {
                        violations.add(new Violation(stmt.variable(), location + ".var",
                            "let variable " + stmt.variable() + " is already bound in the clause"));
                    }
                    headBound.add(stmt.variable());
                }
            }
        }

        for (String v : head.variables()) {
            if (!headBound.contains(v)) {
                violations.add(new Violation(v, headLocation(head, v),
                    "head variable " + v + " is not bound by the body"));
            }
        }
        return violations;
    }

    /** Variables bound by positive premises, closed under equalities. */
    public static Set<String> bodyBindings(List<Premise> body) {
        Set<String> bound = new HashSet<>();
        for (Premise premise : body) {
            if (premise instanceof Premise.Positive p) {
                bound.addAll(p.atom().variables());
            }
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Premise premise : body) {
                if (premise instanceof Premise.Equality eq) {
                    changed |= bindThrough(eq.left(), eq.right(), bound);
                    changed |= bindThrough(eq.right(), eq.left(), bound);
                }
            }
        }
        return bound;
    }

    private static boolean bindThrough(Term target, Term source, Set<String> bound) {
        if (!(target instanceof Term.Variable v) || v.isWildcard() || bound.contains(v.name())) {
            return false;
        }
        Set<String> needed = new HashSet<>();
        source.collectVariables(needed);
        if (source instanceof Term.Variable sv && sv.isWildcard()) {
            return false;
        }
        if (bound.containsAll(needed)) {
            bound.add(v.name());
            return true;
        }
        return false;
    }

    private static boolean containsWildcard(Term term) {
        if (term instanceof Term.Variable v) {
            return v.isWildcard();
        }
        if (term instanceof Term.Apply apply) {
            return apply.args().stream().anyMatch(Safety::containsWildcard);
        }
        if (term instanceof Term.Composite composite) {
            return composite.args().stream().anyMatch(Safety::containsWildcard);
        }
        return false;
    }

    private static String headLocation(Atom head, String variable) {
        for (int j = 0; j < head.args().size(); j++) {
            Set<String> vars = new HashSet<>();
            head.args().get(j).collectVariables(vars);
            if (vars.contains(variable)) {
                return "head.args[" + j + "]";
            }
        }
        return "head";
    }
}
