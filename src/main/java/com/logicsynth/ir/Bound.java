package com.logicsynth.ir;

import java.util.List;

/**
 * One {@code bound [...]} list of a declaration: a type hint per argument position.
 */
public record Bound(List<Term> terms) {

    public Bound {
        terms = List.copyOf(terms);
    }
}
