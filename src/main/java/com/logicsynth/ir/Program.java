package com.logicsynth.ir;

import java.util.List;
import java.util.Optional;

public record Program(Header packageHeader, List<Header> uses, List<Declaration> decls, List<Clause> clauses) {

    public Program {
        uses = List.copyOf(uses);
        decls = List.copyOf(decls);
        clauses = List.copyOf(clauses);
    }

    public static Program of(List<Declaration> decls, List<Clause> clauses) {
        return new Program(null, List.of(), decls, clauses);
    }

    public Optional<Header> packageOpt() {
        return Optional.ofNullable(packageHeader);
    }

    public boolean isEmpty() {
        return packageHeader == null && uses.isEmpty() && decls.isEmpty() && clauses.isEmpty();
    }
}
