package com.logicsynth.schema;

import com.logicsynth.ir.Term;

import java.util.Arrays;
import java.util.Optional;

/**
 * Type hints that may appear in a declaration's {@code bound [...]} list.
 */
public enum ValueType {
    NAME("/name"),
    STRING("/string"),
    NUMBER("/number"),
    FLOAT("/float64"),
    BYTES("/bytes"),
    ANY("/any");

    private final String symbol;

    ValueType(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean accepts(Term value) {
        return switch (this) {
            case NAME -> value instanceof Term.Name;
            case STRING -> value instanceof Term.Text;
            case NUMBER -> value instanceof Term.Number;
            case FLOAT -> value instanceof Term.Float64;
            case BYTES -> value instanceof Term.Bytes;
            case ANY -> true;
        };
    }

    public static Optional<ValueType> fromBound(Term bound) {
        if (!(bound instanceof Term.Name name)) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(t -> t.symbol.equals(name.symbol())).findFirst();
    }
}
