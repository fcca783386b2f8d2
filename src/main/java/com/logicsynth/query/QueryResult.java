package com.logicsynth.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.logicsynth.ir.Term;

import java.util.List;
import java.util.Map;

/**
 * Distinct variable bindings for one goal. {@code bindings} carries the values in rule
 * syntax ({@code /alice}, {@code "alice bob"}); {@code terms} the typed values.
 */
public record QueryResult(
    @JsonProperty("query") String query,
    @JsonProperty("bindings") List<Map<String, String>> bindings,
    @JsonIgnore List<Map<String, Term>> terms
) {

    public QueryResult {
        bindings = List.copyOf(bindings);
        terms = List.copyOf(terms);
    }

    @JsonProperty("count")
    public int count() {
        return bindings.size();
    }
}
