package com.logicsynth.trace;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a node has no children even though it may be derived.
 */
public enum Marker {
    NONE("none"),
    CYCLE("cycle"),
    DEPTH_LIMIT("depth_limit");

    private final String value;

    Marker(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
