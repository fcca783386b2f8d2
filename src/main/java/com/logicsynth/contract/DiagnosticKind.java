package com.logicsynth.contract;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which stage rejected the input. An automated repair loop uses this to decide
 * what to change before retrying.
 */
public enum DiagnosticKind {
    /** No structured document could be recovered or bound. */
    DECODE("decode"),
    /** Field-level shape or invariant violation found before rendering. */
    SCHEMA("schema"),
    /** Parse or analysis failure of the rendered text. */
    GRAMMAR("grammar");

    private final String value;

    DiagnosticKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
