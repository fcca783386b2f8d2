package com.logicsynth.ir;

import java.util.List;

public record Declaration(Atom atom, List<Atom> descr, List<Bound> bounds, List<Atom> inclusion) {

    public Declaration {
        descr = List.copyOf(descr);
        bounds = List.copyOf(bounds);
        inclusion = List.copyOf(inclusion);
    }

    public static Declaration of(Atom atom) {
        return new Declaration(atom, List.of(), List.of(), List.of());
    }

    public String predicate() {
        return atom.predicate();
    }

    public int arity() {
        return atom.arity();
    }
}
