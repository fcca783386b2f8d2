package com.logicsynth.facts;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable view of the store as of one point in time. Queries and traces run against a
 * snapshot so that concurrent inserts never show up half way through.
 */
public final class FactSnapshot {

    private static final FactSnapshot EMPTY = new FactSnapshot(Map.of(), Set.of());

    private final Map<String, List<Fact>> byPredicate;
    private final Set<Fact> all;

    FactSnapshot(Map<String, List<Fact>> byPredicate, Set<Fact> all) {
        this.byPredicate = byPredicate;
        this.all = all;
    }

    public static FactSnapshot empty() {
        return EMPTY;
    }

    /** Snapshot holding exactly {@code facts}; duplicates collapse. */
    public static FactSnapshot of(List<Fact> facts) {
        InMemoryFactStore store = new InMemoryFactStore(Integer.MAX_VALUE);
        facts.forEach(store::add);
        return store.snapshot();
    }

    public List<Fact> facts(String predicate) {
        return byPredicate.getOrDefault(predicate, List.of());
    }

    public boolean contains(Fact fact) {
        return all.contains(fact);
    }

    public boolean hasPredicate(String predicate) {
        return byPredicate.containsKey(predicate);
    }

    public Set<String> predicates() {
        return byPredicate.keySet();
    }

    public int size() {
        return all.size();
    }
}
