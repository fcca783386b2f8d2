package com.logicsynth.grammar;

import java.util.Map;
import java.util.OptionalInt;

import static java.util.Map.entry;

/**
 * Functions the engine evaluates. A value of -1 marks a variadic function.
 */
public final class BuiltinFunctions {

    private static final int VARIADIC = -1;

    private static final Map<String, Integer> ARITIES = Map.ofEntries(
        entry("fn:plus", VARIADIC),
        entry("fn:minus", VARIADIC),
        entry("fn:mult", VARIADIC),
        entry("fn:div", VARIADIC),
        entry("fn:float:plus", VARIADIC),
        entry("fn:float:mult", VARIADIC),
        entry("fn:float:div", VARIADIC),
        entry("fn:sqrt", 1),
        entry("fn:count", 0),
        entry("fn:count_distinct", 0),
        entry("fn:sum", 1),
        entry("fn:float:sum", 1),
        entry("fn:max", 1),
        entry("fn:min", 1),
        entry("fn:float:max", 1),
        entry("fn:float:min", 1),
        entry("fn:avg", 1),
        entry("fn:collect", VARIADIC),
        entry("fn:collect_distinct", VARIADIC),
        entry("fn:group_by", VARIADIC),
        entry("fn:list", VARIADIC),
        entry("fn:map", VARIADIC),
        entry("fn:struct", VARIADIC),
        entry("fn:tuple", VARIADIC),
        entry("fn:pair", 2),
        entry("fn:cons", 2),
        entry("fn:append", VARIADIC),
        entry("fn:len", 1),
        entry("fn:list:get", 2),
        entry("fn:list:contains", 2),
        entry("fn:map:get", 2),
        entry("fn:struct:get", 2),
        entry("fn:number:to_string", 1),
        entry("fn:string:concat", VARIADIC),
        entry("fn:name:root", 1));

    private BuiltinFunctions() {}

    public static boolean isKnown(String function) {
        return ARITIES.containsKey(function);
    }

    /** Fixed arity of {@code function}, empty when unknown or variadic. */
    public static OptionalInt fixedArity(String function) {
        Integer arity = ARITIES.get(function);
        return arity == null || arity == VARIADIC ? OptionalInt.empty() : OptionalInt.of(arity);
    }
}
