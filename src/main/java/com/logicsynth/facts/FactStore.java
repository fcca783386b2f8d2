package com.logicsynth.facts;

import java.util.List;

/**
 * Session fact storage. Writers are serialised; readers take a {@link FactSnapshot}.
 */
public interface FactStore {

    /**
     * Adds a ground fact.
     *
     * @return false when an identical fact is already stored
     * @throws FactTypeMismatchException when the arity differs from facts already stored
     *                                   under the predicate, or the fact is not ground
     * @throws FactLimitExceededException when the store is full
     */
    boolean add(Fact fact);

    /**
     * Adds every fact or none of them.
     *
     * @return the number of facts that were not stored yet
     * @throws FactTypeMismatchException when any fact fails the checks of {@link #add}
     * @throws FactLimitExceededException when the new facts do not fit
     */
    int addAll(List<Fact> facts);

    FactSnapshot snapshot();

    int size();

    FactStoreStats stats();

    void clear();
}
