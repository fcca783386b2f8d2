package com.logicsynth.trace;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Classification {
    /** Supplied directly; no rule defines the predicate. */
    BASE("base"),
    /** Justified by a rule whose premises hold. */
    DERIVED("derived"),
    /** The session knows nothing that explains the fact. */
    UNKNOWN("unknown");

    private final String value;

    Classification(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
