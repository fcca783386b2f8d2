package com.logicsynth.eval;

import com.logicsynth.ir.Atom;
import com.logicsynth.ir.Term;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One-way matching of clause terms against ground values under a variable binding.
 */
public final class Unifier {

    private Unifier() {}

    /**
     * The ground value of {@code term} under {@code bindings}, or null when a variable is
     * unbound or a function cannot be evaluated.
     */
    public static Term resolve(Term term, Map<String, Term> bindings) {
        if (term instanceof Term.Variable v) {
            return v.isWildcard() ? null : bindings.get(v.name());
        }
        if (term instanceof Term.Apply apply) {
            List<Term> args = resolveAll(apply.args(), bindings);
            return args == null ? null : FunctionEvaluator.apply(apply.function(), args).orElse(null);
        }
        if (term instanceof Term.Composite composite) {
            List<Term> args = resolveAll(composite.args(), bindings);
            return args == null ? null : new Term.Composite(composite.compositeKind(), args);
        }
        return term;
    }

    private static List<Term> resolveAll(List<Term> terms, Map<String, Term> bindings) {
        List<Term> out = new ArrayList<>(terms.size());
        for (Term t : terms) {
            Term r = resolve(t, bindings);
            if (r == null) {
                return null;
            }
            out.add(r);
        }
        return out;
    }

    /**
     * Matches {@code pattern} against the ground {@code value}, extending {@code bindings}
     * in place. Returns false on a clash; the map may then hold partial bindings.
     */
    public static boolean unify(Term pattern, Term value, Map<String, Term> bindings) {
        if (pattern instanceof Term.Variable v) {
            if (v.isWildcard()) {
                return true;
            }
            Term bound = bindings.get(v.name());
            if (bound == null) {
                bindings.put(v.name(), value);
                return true;
            }
            return bound.equals(value);
        }
        if (pattern instanceof Term.Composite composite) {
            if (!(value instanceof Term.Composite other)
                    || other.compositeKind() != composite.compositeKind()
                    || other.args().size() != composite.args().size()) {
                return false;
            }
            for (int i = 0; i < composite.args().size(); i++) {
                if (!unify(composite.args().get(i), other.args().get(i), bindings)) {
                    return false;
                }
            }
            return true;
        }
        if (pattern instanceof Term.Apply) {
            Term resolved = resolve(pattern, bindings);
            return resolved != null && resolved.equals(value);
        }
        return pattern.equals(value);
    }

    /** Matches argument lists on a copy of {@code bindings}. */
    public static Optional<Map<String, Term>> match(List<Term> patterns, List<Term> values, Map<String, Term> bindings) {
        if (patterns.size() != values.size()) {
            return Optional.empty();
        }
        Map<String, Term> extended = new HashMap<>(bindings);
        for (int i = 0; i < patterns.size(); i++) {
            if (!unify(patterns.get(i), values.get(i), extended)) {
                return Optional.empty();
            }
        }
        return Optional.of(extended);
    }

    /** Replaces every resolvable argument by its value; the rest stay as written. */
    public static Atom substitute(Atom atom, Map<String, Term> bindings) {
        List<Term> args = new ArrayList<>(atom.arity());
        for (Term arg : atom.args()) {
            Term resolved = resolve(arg, bindings);
            args.add(resolved != null ? resolved : arg);
        }
        return new Atom(atom.predicate(), args);
    }

    /** Numeric ordering across integers and floats; empty when either side is not a number. */
    public static Optional<Integer> compareNumbers(Term left, Term right) {
        if (left instanceof Term.Number a && right instanceof Term.Number b) {
            return Optional.of(Long.compare(a.value(), b.value()));
        }
        Optional<Double> a = FunctionEvaluator.asDouble(left);
        Optional<Double> b = FunctionEvaluator.asDouble(right);
        if (a.isEmpty() || b.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Double.compare(a.get(), b.get()));
    }
}
