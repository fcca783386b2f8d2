package com.logicsynth.ir;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One element of a clause body.
 */
public sealed interface Premise {

    record Positive(Atom atom) implements Premise {}

    record Negated(Atom atom) implements Premise {}

    record Equality(Term left, Term right) implements Premise {}

    record Inequality(Term left, Term right) implements Premise {}

    record Comparison(ComparisonOp op, Term left, Term right) implements Premise {}

    default Set<String> variables() {
        Set<String> out = new LinkedHashSet<>();
        if (this instanceof Positive p) {
            out.addAll(p.atom().variables());
        } else if (this instanceof Negated n) {
            out.addAll(n.atom().variables());
        } else if (this instanceof Equality e) {
            e.left().collectVariables(out);
            e.right().collectVariables(out);
        } else if (this instanceof Inequality i) {
            i.left().collectVariables(out);
            i.right().collectVariables(out);
        } else if (this instanceof Comparison c) {
            c.left().collectVariables(out);
            c.right().collectVariables(out);
        }
        return out;
    }
}
