package com.logicsynth.eval;

import com.logicsynth.ir.CompositeKind;
import com.logicsynth.ir.Term;
import com.logicsynth.ir.Transform;
import com.logicsynth.ir.TransformStatement;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies a clause's transform to the solutions of its body.
 *
 * With {@code do fn:group_by(...)} the rows are grouped by the listed variables and each
 * {@code let} is a reducer over the group. Without it, each {@code let} is computed per row.
 */
public final class Aggregation {

    private static final String GROUP_BY = "fn:group_by";

    private Aggregation() {}

    /**
     * @return the transformed rows, or empty when the transform uses a function this
     *         evaluator does not implement
     */
    public static Optional<List<Map<String, Term>>> apply(Transform transform, List<Map<String, Term>> rows) {
        Optional<TransformStatement> groupBy = transform.statements().stream()
            .filter(s -> !s.isLet() && GROUP_BY.equals(s.function().function()))
            .findFirst();
        boolean otherDo = transform.statements().stream()
            .anyMatch(s -> !s.isLet() && !GROUP_BY.equals(s.function().function()));
        if (otherDo) {
            return Optional.empty();
        }
        if (groupBy.isEmpty()) {
            return perRow(transform, rows);
        }
        return grouped(groupBy.get().function(), transform, rows);
    }

    private static Optional<List<Map<String, Term>>> perRow(Transform transform, List<Map<String, Term>> rows) {
        List<Map<String, Term>> out = new ArrayList<>();
        for (Map<String, Term> row : rows) {
            Map<String, Term> extended = new HashMap<>(row);
            boolean ok = true;
            for (TransformStatement s : transform.statements()) {
                Term value = Unifier.resolve(s.function(), extended);
                if (value == null) {
                    ok = false;
                    break;
                }
                extended.put(s.variable(), value);
            }
            if (ok) {
                out.add(extended);
            }
        }
        return Optional.of(out);
    }

    private static Optional<List<Map<String, Term>>> grouped(Term.Apply groupBy, Transform transform,
                                                            List<Map<String, Term>> rows) {
        List<String> keys = new ArrayList<>();
        for (Term arg : groupBy.args()) {
            if (!(arg instanceof Term.Variable v)) {
                return Optional.empty();
            }
            keys.add(v.name());
        }

        Map<List<Term>, List<Map<String, Term>>> groups = new LinkedHashMap<>();
        for (Map<String, Term> row : rows) {
            List<Term> key = new ArrayList<>();
            for (String k : keys) {
                key.add(row.get(k));
            }
            if (key.contains(null)) {
                continue;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }

        List<Map<String, Term>> out = new ArrayList<>();
        for (Map.Entry<List<Term>, List<Map<String, Term>>> group : groups.entrySet()) {
            Map<String, Term> result = new HashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                result.put(keys.get(i), group.getKey().get(i));
            }
            for (TransformStatement s : transform.statements()) {
                if (!s.isLet()) {
                    continue;
                }
                Optional<Term> reduced = reduce(s.function(), group.getValue());
                if (reduced.isEmpty()) {
                    return Optional.empty();
                }
                result.put(s.variable(), reduced.get());
            }
            out.add(result);
        }
        return Optional.of(out);
    }

    static Optional<Term> reduce(Term.Apply fn, List<Map<String, Term>> rows) {
        switch (fn.function()) {
            case "fn:count":
                return Optional.of(new Term.Number(rows.size()));
            case "fn:count_distinct":
                return Optional.of(new Term.Number(new LinkedHashSet<>(rows).size()));
            case "fn:sum":
            case "fn:float:sum":
                return values(fn, rows).flatMap(v -> FunctionEvaluator.apply("fn:plus", v));
            case "fn:max":
            case "fn:float:max":
                return values(fn, rows).flatMap(v -> extreme(v, 1));
            case "fn:min":
            case "fn:float:min":
                return values(fn, rows).flatMap(v -> extreme(v, -1));
            case "fn:avg":
                return values(fn, rows).flatMap(Aggregation::average);
            case "fn:collect":
                return values(fn, rows).map(v -> new Term.Composite(CompositeKind.LIST, v));
            case "fn:collect_distinct":
                return values(fn, rows).map(v -> new Term.Composite(CompositeKind.LIST, List.copyOf(new LinkedHashSet<>(v))));
            default:
                return Optional.empty();
        }
    }

    /** The reducer argument per row; several arguments are collected as a tuple. */
    private static Optional<List<Term>> values(Term.Apply fn, List<Map<String, Term>> rows) {
        if (fn.args().isEmpty()) {
            return Optional.empty();
        }
        List<Term> out = new ArrayList<>();
        for (Map<String, Term> row : rows) {
            List<Term> parts = new ArrayList<>();
            for (Term arg : fn.args()) {
                Term value = Unifier.resolve(arg, row);
                if (value == null) {
                    return Optional.empty();
                }
                parts.add(value);
            }
            out.add(parts.size() == 1 ? parts.get(0) : new Term.Composite(CompositeKind.LIST, parts));
        }
        return Optional.of(out);
    }

    private static Optional<Term> extreme(List<Term> values, int sign) {
        Term best = null;
        for (Term v : values) {
            if (best == null) {
                best = v;
                continue;
            }
            Optional<Integer> cmp = Unifier.compareNumbers(v, best);
            if (cmp.isEmpty()) {
                return Optional.empty();
            }
            if (cmp.get() * sign > 0) {
                best = v;
            }
        }
        return Optional.ofNullable(best);
    }

    private static Optional<Term> average(List<Term> values) {
        if (values.isEmpty()) {
            return Optional.empty();
        }
        double sum = 0;
        for (Term v : values) {
            Optional<Double> d = FunctionEvaluator.asDouble(v);
            if (d.isEmpty()) {
                return Optional.empty();
            }
            sum += d.get();
        }
        return Optional.of(new Term.Float64(sum / values.size()));
    }
}
