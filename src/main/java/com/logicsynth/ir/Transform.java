package com.logicsynth.ir;

import java.util.List;

public record Transform(List<TransformStatement> statements) {

    public Transform {
        statements = List.copyOf(statements);
    }

    /** True when the pipeline groups or aggregates, which puts the clause in a higher stratum. */
    public boolean aggregates() {
        return statements.stream().anyMatch(s -> s.isLet() || "fn:group_by".equals(s.function().function()));
    }
}
