package com.logicsynth.facts;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.logicsynth.ir.Atom;
import com.logicsynth.ir.Term;
import com.logicsynth.render.ProgramRenderer;

import java.util.List;

/**
 * A ground atom held by the store. Equality is structural, so {@code /alice} and
 * {@code "alice"} are different arguments. Serialised as its rule text.
 */
@JsonSerialize(using = ToStringSerializer.class)
public record Fact(String predicate, List<Term> args) {

    private static final ProgramRenderer RENDERER = new ProgramRenderer();

    public Fact {
        args = List.copyOf(args);
    }

    public static Fact of(String predicate, Term... args) {
        return new Fact(predicate, List.of(args));
    }

    public static Fact of(Atom atom) {
        return new Fact(atom.predicate(), atom.args());
    }

    public int arity() {
        return args.size();
    }

    public boolean isGround() {
        return args.stream().allMatch(Term::isGround);
    }

    public Atom toAtom() {
        return new Atom(predicate, args);
    }

    @Override
    public String toString() {
        return RENDERER.atom(toAtom());
    }
}
