package com.logicsynth.ir;

import java.util.regex.Pattern;

/**
 * Lexical classes of the rule language shared by the validator, the parser and the fact store.
 */
public final class Lexicon {

    public static final String FUNCTION_PREFIX = "fn:";

    public static final String NAME_PREFIX = "/";

    // ':' and '.' only between word characters, as the tokenizer reads them
    private static final Pattern PREDICATE = Pattern.compile("^:?[a-z][A-Za-z0-9_]*([:.][A-Za-z0-9_]+)*$");

    private static final Pattern VARIABLE = Pattern.compile("^[A-Z][A-Za-z0-9_]*$");

    private static final Pattern NAME = Pattern.compile("^(/[A-Za-z0-9_\\-~%]+(\\.[A-Za-z0-9_\\-~%]+)*)+$");

    private static final Pattern FUNCTION = Pattern.compile("^fn:[a-z][A-Za-z0-9_]*(:[A-Za-z0-9_]+)*$");

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-z_][A-Za-z0-9_]*$");

    private Lexicon() {}

    public static boolean isPredicate(String value) {
        return value != null && !value.startsWith(FUNCTION_PREFIX) && PREDICATE.matcher(value).matches();
    }

    public static boolean isVariable(String value) {
        return Term.WILDCARD.equals(value) || (value != null && VARIABLE.matcher(value).matches());
    }

    public static boolean isName(String value) {
        return value != null && NAME.matcher(value).matches();
    }

    public static boolean isFunction(String value) {
        return value != null && FUNCTION.matcher(value).matches();
    }

    /**
     * A single bare lowercase-led word: letters, digits and underscore only, no whitespace or
     * punctuation. This is the lexical shape the loose fact path promotes to a name constant.
     */
    public static boolean isBareIdentifier(String value) {
        return value != null && IDENTIFIER.matcher(value).matches();
    }
}
