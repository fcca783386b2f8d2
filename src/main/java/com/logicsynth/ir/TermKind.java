package com.logicsynth.ir;

import java.util.Arrays;

/**
 * Wire names of the expression kinds accepted in a synthesis document.
 */
public enum TermKind {
    VAR("var"),
    NAME("name"),
    STRING("string"),
    BYTES("bytes"),
    NUMBER("number"),
    FLOAT("float"),
    APPLY("apply"),
    LIST("list"),
    MAP("map"),
    STRUCT("struct");

    private final String value;

    TermKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TermKind fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim();
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(normalized))
            .findFirst()
            .orElse(null);
    }
}
