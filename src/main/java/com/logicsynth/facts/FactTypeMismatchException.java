package com.logicsynth.facts;

/**
 * A fact was rejected because its shape does not fit the predicate: wrong arity, an argument
 * outside the declared bound, or a non-ground argument. The store is left untouched.
 */
public class FactTypeMismatchException extends RuntimeException {

    private final String predicate;

    public FactTypeMismatchException(String predicate, String message) {
        super(predicate + ": " + message);
        this.predicate = predicate;
    }

    public String getPredicate() {
        return predicate;
    }
}
