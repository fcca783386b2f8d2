package com.logicsynth.facts;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param added false when the fact was already stored
 */
public record IngestedFact(@JsonProperty("fact") Fact fact, @JsonProperty("added") boolean added) {}
