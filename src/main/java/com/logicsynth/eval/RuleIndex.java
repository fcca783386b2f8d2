package com.logicsynth.eval;

import com.logicsynth.ir.Clause;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rules of a verified program grouped by head predicate. A predicate with at least one rule
 * (a clause with a body or transform) is intensional; everything else is base data.
 * Immutable.
 */
public final class RuleIndex {

    private static final RuleIndex EMPTY = new RuleIndex(Map.of());

    private final Map<String, List<Clause>> rulesByHead;

    private RuleIndex(Map<String, List<Clause>> rulesByHead) {
        this.rulesByHead = rulesByHead;
    }

    public static RuleIndex empty() {
        return EMPTY;
    }

    public static RuleIndex of(Collection<Clause> clauses) {
        return EMPTY.with(clauses);
    }

    /** A new index holding these rules plus {@code clauses}; unit facts are skipped. */
    public RuleIndex with(Collection<Clause> clauses) {
        Map<String, List<Clause>> merged = new LinkedHashMap<>();
        rulesByHead.forEach((k, v) -> merged.put(k, new ArrayList<>(v)));
        for (Clause clause : clauses) {
            if (clause.isUnitFact()) {
                continue;
            }
            List<Clause> rules = merged.computeIfAbsent(clause.head().predicate(), k -> new ArrayList<>());
            if (!rules.contains(clause)) {
                rules.add(clause);
            }
        }
        Map<String, List<Clause>> frozen = new LinkedHashMap<>();
        merged.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return new RuleIndex(Collections.unmodifiableMap(frozen));
    }

    public List<Clause> rulesFor(String predicate) {
        return rulesByHead.getOrDefault(predicate, List.of());
    }

    public boolean isDerived(String predicate) {
        return rulesByHead.containsKey(predicate);
    }

    public Set<String> derivedPredicates() {
        return rulesByHead.keySet();
    }

    public int size() {
        return rulesByHead.values().stream().mapToInt(List::size).sum();
    }
}
