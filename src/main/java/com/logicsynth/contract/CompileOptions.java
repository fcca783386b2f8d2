package com.logicsynth.contract;

/**
 * Which program sections a caller may submit.
 *
 * @param strictSchema reject body predicates that are neither declared in the session
 *                     schema nor defined by the submitted program
 */
public record CompileOptions(
    boolean allowPackage,
    boolean allowUse,
    boolean allowDecls,
    boolean requireSingleClause,
    boolean strictSchema
) {

    public static CompileOptions defaults() {
        return new CompileOptions(false, false, true, false, false);
    }

    public static CompileOptions permissive() {
        return new CompileOptions(true, true, true, false, false);
    }
}
