package com.logicsynth.ir;

import java.util.List;
import java.util.Optional;

public record Clause(Atom head, List<Premise> body, Transform transform) {

    public Clause {
        body = List.copyOf(body);
    }

    public static Clause fact(Atom head) {
        return new Clause(head, List.of(), null);
    }

    public static Clause rule(Atom head, Premise... body) {
        return new Clause(head, List.of(body), null);
    }

    public boolean isUnitFact() {
        return body.isEmpty() && transform == null;
    }

    public Optional<Transform> transformOpt() {
        return Optional.ofNullable(transform);
    }
}
