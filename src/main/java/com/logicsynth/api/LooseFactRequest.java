package com.logicsynth.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Body of {@code POST /v1/facts/loose}: plain JSON values, promoted on ingestion. */
public record LooseFactRequest(
    @JsonProperty("pred") String pred,
    @JsonProperty("args") List<Object> args
) {}
