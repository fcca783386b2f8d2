package com.logicsynth.ir;

import java.util.List;
import java.util.Set;

/**
 * Argument of an atom or operand of a premise. Sealed interface with record variants,
 * one per term kind of the rule language.
 */
public sealed interface Term {

    String WILDCARD = "_";

    record Variable(String name) implements Term {
        public boolean isWildcard() {
            return WILDCARD.equals(name);
        }
    }

    /** Symbolic constant, always spelled with a leading '/'. */
    record Name(String symbol) implements Term {}

    record Text(String value) implements Term {}

    record Bytes(String value) implements Term {}

    record Number(long value) implements Term {}

    record Float64(double value) implements Term {}

    /**
     * Function application in the reserved {@code fn:} namespace.
     * {@code arity} is null when the function takes a variable number of arguments.
     */
    record Apply(String function, List<Term> args, Integer arity) implements Term {
        public Apply {
            args = List.copyOf(args);
        }
    }

    record Composite(CompositeKind compositeKind, List<Term> args) implements Term {
        public Composite {
            args = List.copyOf(args);
        }
    }

    static Variable var(String name) {
        return new Variable(name);
    }

    static Name name(String symbol) {
        return new Name(symbol);
    }

    static Text text(String value) {
        return new Text(value);
    }

    static Number number(long value) {
        return new Number(value);
    }

    static Float64 float64(double value) {
        return new Float64(value);
    }

    default TermKind kind() {
        if (this instanceof Variable) return TermKind.VAR;
        if (this instanceof Name) return TermKind.NAME;
        if (this instanceof Text) return TermKind.STRING;
        if (this instanceof Bytes) return TermKind.BYTES;
        if (this instanceof Number) return TermKind.NUMBER;
        if (this instanceof Float64) return TermKind.FLOAT;
        if (this instanceof Apply) return TermKind.APPLY;
        return switch (((Composite) this).compositeKind()) {
            case LIST -> TermKind.LIST;
            case MAP -> TermKind.MAP;
            case STRUCT -> TermKind.STRUCT;
        };
    }

    default boolean isConstant() {
        return this instanceof Name || this instanceof Text || this instanceof Bytes
            || this instanceof Number || this instanceof Float64;
    }

    /** True when no variable (wildcard included) occurs anywhere in the term. */
    default boolean isGround() {
        if (this instanceof Variable) {
            return false;
        }
        if (this instanceof Apply apply) {
            return apply.args().stream().allMatch(Term::isGround);
        }
        if (this instanceof Composite composite) {
            return composite.args().stream().allMatch(Term::isGround);
        }
        return true;
    }

    /** Adds every named variable of this term to {@code out}; the wildcard is skipped. */
    default void collectVariables(Set<String> out) {
        if (this instanceof Variable v) {
            if (!v.isWildcard()) {
                out.add(v.name());
            }
        } else if (this instanceof Apply apply) {
            apply.args().forEach(a -> a.collectVariables(out));
        } else if (this instanceof Composite composite) {
            composite.args().forEach(a -> a.collectVariables(out));
        }
    }
}
