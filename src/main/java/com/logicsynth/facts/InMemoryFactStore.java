package com.logicsynth.facts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single-writer, many-reader store. Writes take the store lock; {@link #snapshot()} hands out
 * an immutable copy that is rebuilt lazily after the next write.
 */
public class InMemoryFactStore implements FactStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFactStore.class);

    static final double WARNING_UTILIZATION = 0.85;

    private final int limit;
    private final Map<String, List<Fact>> byPredicate = new LinkedHashMap<>();
    private final Map<String, Integer> arities = new LinkedHashMap<>();
    private final Set<Fact> all = new LinkedHashSet<>();
    private boolean warned;
    private volatile FactSnapshot snapshot = FactSnapshot.empty();

    public InMemoryFactStore(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("fact limit must be positive: " + limit);
        }
        this.limit = limit;
    }

    @Override
    public synchronized boolean add(Fact fact) {
        checkShape(fact, arities);
        if (all.contains(fact)) {
            return false;
        }
        if (all.size() >= limit) {
            throw new FactLimitExceededException(limit);
        }
        insert(fact);
        return true;
    }

    @Override
    public synchronized int addAll(List<Fact> facts) {
        Map<String, Integer> pending = new LinkedHashMap<>(arities);
        Set<Fact> fresh = new LinkedHashSet<>();
        for (Fact fact : facts) {
            checkShape(fact, pending);
            pending.putIfAbsent(fact.predicate(), fact.arity());
            if (!all.contains(fact)) {
                fresh.add(fact);
            }
        }
        if (all.size() + fresh.size() > limit) {
            throw new FactLimitExceededException(limit);
        }
        fresh.forEach(this::insert);
        return fresh.size();
    }

    private static void checkShape(Fact fact, Map<String, Integer> arities) {
        if (!fact.isGround()) {
            throw new FactTypeMismatchException(fact.predicate(), "facts must be ground, got " + fact);
        }
        Integer arity = arities.get(fact.predicate());
        if (arity != null && arity != fact.arity()) {
            throw new FactTypeMismatchException(fact.predicate(),
                "expected " + arity + " args, got " + fact.arity());
        }
    }

    private void insert(Fact fact) {
        arities.putIfAbsent(fact.predicate(), fact.arity());
        byPredicate.computeIfAbsent(fact.predicate(), k -> new ArrayList<>()).add(fact);
        all.add(fact);
        snapshot = null;

        if (!warned && all.size() >= limit * WARNING_UTILIZATION) {
            warned = true;
            log.warn("Fact store at {}% of its limit ({} / {})",
                Math.round(100.0 * all.size() / limit), all.size(), limit);
        }
    }

    @Override
    public FactSnapshot snapshot() {
        FactSnapshot current = snapshot;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (snapshot == null) {
                Map<String, List<Fact>> copy = new LinkedHashMap<>();
                byPredicate.forEach((k, v) -> copy.put(k, List.copyOf(v)));
                snapshot = new FactSnapshot(Collections.unmodifiableMap(copy),
                    Collections.unmodifiableSet(new LinkedHashSet<>(all)));
            }
            return snapshot;
        }
    }

    @Override
    public synchronized int size() {
        return all.size();
    }

    @Override
    public synchronized FactStoreStats stats() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        byPredicate.forEach((k, v) -> counts.put(k, v.size()));
        return new FactStoreStats(all.size(), limit, (double) all.size() / limit, counts);
    }

    @Override
    public synchronized void clear() {
        int dropped = all.size();
        byPredicate.clear();
        arities.clear();
        all.clear();
        warned = false;
        snapshot = FactSnapshot.empty();
        log.info("Cleared fact store ({} facts dropped)", dropped);
    }
}
