package com.logicsynth.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.logicsynth.contract.SynthesisDocument.ExprSpec;

import java.util.List;

/** Body of {@code POST /v1/facts}: arguments use the same tagged shape as synthesis documents. */
public record FactRequest(
    @JsonProperty("pred") String pred,
    @JsonProperty("args") List<ExprSpec> args
) {}
