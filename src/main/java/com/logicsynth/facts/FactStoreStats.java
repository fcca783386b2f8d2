package com.logicsynth.facts;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record FactStoreStats(
    @JsonProperty("total_facts") int totalFacts,
    @JsonProperty("limit") int limit,
    @JsonProperty("utilization") double utilization,
    @JsonProperty("by_predicate") Map<String, Integer> byPredicate
) {}
