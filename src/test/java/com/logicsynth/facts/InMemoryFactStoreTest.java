package com.logicsynth.facts;

import com.logicsynth.ir.Term;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryFactStoreTest {

    private InMemoryFactStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryFactStore(10);
    }

    @Test
    void addedFact_isVisibleInTheNextSnapshot() {
        Fact fact = Fact.of("edge", Term.name("/a"), Term.name("/b"));
        assertTrue(store.add(fact));
        FactSnapshot snapshot = store.snapshot();
        assertTrue(snapshot.contains(fact));
        assertEquals(1, snapshot.facts("edge").size());
    }

    @Test
    void duplicate_isIdempotent() {
        Fact fact = Fact.of("edge", Term.name("/a"), Term.name("/b"));
        assertTrue(store.add(fact));
        assertFalse(store.add(fact));
        assertEquals(1, store.size());
    }

    @Test
    void snapshot_isNotAffectedByLaterWrites() {
        store.add(Fact.of("p", Term.number(1)));
        FactSnapshot before = store.snapshot();
        store.add(Fact.of("p", Term.number(2)));
        assertEquals(1, before.size());
        assertEquals(2, store.snapshot().size());
    }

    @Test
    void arityOfFirstFact_isEnforced() {
        store.add(Fact.of("p", Term.number(1)));
        FactTypeMismatchException ex = assertThrows(FactTypeMismatchException.class,
            () -> store.add(Fact.of("p", Term.number(1), Term.number(2))));
        assertEquals("p", ex.getPredicate());
        assertEquals(1, store.size());
    }

    @Test
    void nonGroundFact_isRejected() {
        assertThrows(FactTypeMismatchException.class, () -> store.add(Fact.of("p", Term.var("X"))));
        assertEquals(0, store.size());
    }

    @Test
    void constantsOfDifferentKinds_areDistinctFacts() {
        assertTrue(store.add(Fact.of("p", Term.name("/alice"))));
        assertTrue(store.add(Fact.of("p", Term.text("alice"))));
        assertEquals(2, store.size());
    }

    @Test
    void limit_isEnforced() {
        for (int i = 0; i < 10; i++) {
            store.add(Fact.of("p", Term.number(i)));
        }
        assertThrows(FactLimitExceededException.class, () -> store.add(Fact.of("p", Term.number(99))));
        assertEquals(10, store.size());
    }

    @Test
    void addAll_countsOnlyNewFacts() {
        store.add(Fact.of("p", Term.number(1)));
        assertEquals(1, store.addAll(List.of(Fact.of("p", Term.number(1)), Fact.of("p", Term.number(2)))));
        assertEquals(2, store.size());
    }

    @Test
    void addAll_withOneBadArity_storesNothing() {
        store.add(Fact.of("p", Term.number(1)));
        assertThrows(FactTypeMismatchException.class, () -> store.addAll(List.of(
            Fact.of("q", Term.number(1)),
            Fact.of("p", Term.number(2), Term.number(3)))));
        assertEquals(1, store.size());
        assertFalse(store.snapshot().hasPredicate("q"));
    }

    @Test
    void addAll_disagreeingWithinTheBatch_storesNothing() {
        assertThrows(FactTypeMismatchException.class, () -> store.addAll(List.of(
            Fact.of("q", Term.number(1)),
            Fact.of("q", Term.number(1), Term.number(2)))));
        assertEquals(0, store.size());
    }

    @Test
    void addAll_overTheLimit_storesNothing() {
        InMemoryFactStore small = new InMemoryFactStore(2);
        small.add(Fact.of("p", Term.number(1)));
        assertThrows(FactLimitExceededException.class, () -> small.addAll(List.of(
            Fact.of("p", Term.number(2)), Fact.of("p", Term.number(3)))));
        assertEquals(1, small.size());
    }

    @Test
    void stats_reportUtilizationPerPredicate() {
        store.add(Fact.of("p", Term.number(1)));
        store.add(Fact.of("p", Term.number(2)));
        store.add(Fact.of("q", Term.number(1)));
        FactStoreStats stats = store.stats();
        assertEquals(3, stats.totalFacts());
        assertEquals(0.3, stats.utilization(), 1e-9);
        assertEquals(2, stats.byPredicate().get("p"));
    }

    @Test
    void clear_dropsFactsAndArities() {
        store.add(Fact.of("p", Term.number(1)));
        store.clear();
        assertEquals(0, store.snapshot().size());
        assertTrue(store.add(Fact.of("p", Term.number(1), Term.number(2))));
    }

    @Test
    void nonPositiveLimit_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryFactStore(0));
    }
}
