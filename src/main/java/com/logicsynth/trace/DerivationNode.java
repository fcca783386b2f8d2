package com.logicsynth.trace;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.logicsynth.facts.Fact;

import java.util.List;

/**
 * One fact in a derivation tree.
 *
 * @param rule head predicate of the rule that derived the fact; null unless DERIVED
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DerivationNode(
    @JsonProperty("fact") Fact fact,
    @JsonProperty("classification") Classification classification,
    @JsonProperty("rule") String rule,
    @JsonProperty("marker") Marker marker,
    @JsonProperty("depth") int depth,
    @JsonProperty("children") List<DerivationNode> children
) {

    public DerivationNode {
        children = List.copyOf(children);
    }

    static DerivationNode leaf(Fact fact, Classification classification, String rule, Marker marker, int depth) {
        return new DerivationNode(fact, classification, rule, marker, depth, List.of());
    }

    @JsonProperty("predicate")
    public String predicate() {
        return fact.predicate();
    }

    @JsonIgnore
    public boolean isLeaf() {
        return children.isEmpty();
    }
}
