package com.logicsynth.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Diagnostic(
    @JsonProperty("path") String path,
    @JsonProperty("message") String message,
    @JsonProperty("kind") DiagnosticKind kind
) {

    public static Diagnostic schema(String path, String message) {
        return new Diagnostic(path, message, DiagnosticKind.SCHEMA);
    }

    public static Diagnostic decode(String path, String message) {
        return new Diagnostic(path, message, DiagnosticKind.DECODE);
    }

    public static Diagnostic grammar(String path, String message) {
        return new Diagnostic(path, message, DiagnosticKind.GRAMMAR);
    }

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
