package com.logicsynth.extract;

public enum ExtractionFailure {
    EMPTY_INPUT("empty input"),
    NO_OBJECT_FOUND("no structured payload found");

    private final String description;

    ExtractionFailure(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
