package com.logicsynth.ir;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record Atom(String predicate, List<Term> args) {

    public Atom {
        args = List.copyOf(args);
    }

    public static Atom of(String predicate, Term... args) {
        return new Atom(predicate, List.of(args));
    }

    public int arity() {
        return args.size();
    }

    public boolean isGround() {
        return args.stream().allMatch(Term::isGround);
    }

    public Set<String> variables() {
        Set<String> out = new LinkedHashSet<>();
        args.forEach(a -> a.collectVariables(out));
        return out;
    }
}
