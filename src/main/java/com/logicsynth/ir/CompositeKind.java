package com.logicsynth.ir;

import java.util.Arrays;
import java.util.Optional;

public enum CompositeKind {
    LIST("fn:list"),
    MAP("fn:map"),
    STRUCT("fn:struct");

    private final String function;

    CompositeKind(String function) {
        this.function = function;
    }

    /** The built-in function the literal desugars to. */
    public String function() {
        return function;
    }

    public static Optional<CompositeKind> fromFunction(String function) {
        return Arrays.stream(values()).filter(k -> k.function.equals(function)).findFirst();
    }

    public boolean requiresPairs() {
        return this != LIST;
    }
}
