package com.logicsynth.ir;

import java.util.Arrays;
import java.util.Optional;

/**
 * Ordered comparisons. Each renders as a call to the built-in predicate of the same name.
 */
public enum ComparisonOp {
    LT("lt", ":lt"),
    LE("le", ":le"),
    GT("gt", ":gt"),
    GE("ge", ":ge");

    private final String code;
    private final String builtin;

    ComparisonOp(String code, String builtin) {
        this.code = code;
        this.builtin = builtin;
    }

    public String code() {
        return code;
    }

    public String builtin() {
        return builtin;
    }

    public boolean test(int comparison) {
        return switch (this) {
            case LT -> comparison < 0;
            case LE -> comparison <= 0;
            case GT -> comparison > 0;
            case GE -> comparison >= 0;
        };
    }

    public static Optional<ComparisonOp> fromCode(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase();
        return Arrays.stream(values()).filter(op -> op.code.equals(normalized)).findFirst();
    }

    public static Optional<ComparisonOp> fromBuiltin(String predicate) {
        return Arrays.stream(values()).filter(op -> op.builtin.equals(predicate)).findFirst();
    }
}
