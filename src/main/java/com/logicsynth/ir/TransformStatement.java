package com.logicsynth.ir;

/**
 * {@code do fn:...} when {@code variable} is null, {@code let V = fn:...} otherwise.
 */
public record TransformStatement(String variable, Term.Apply function) {

    public static TransformStatement doing(Term.Apply function) {
        return new TransformStatement(null, function);
    }

    public static TransformStatement let(String variable, Term.Apply function) {
        return new TransformStatement(variable, function);
    }

    public boolean isLet() {
        return variable != null;
    }
}
