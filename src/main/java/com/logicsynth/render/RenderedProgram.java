package com.logicsynth.render;

import java.util.List;

/**
 * Rendered rule text: the full source plus each declaration and clause on its own.
 */
public record RenderedProgram(String source, List<String> decls, List<String> clauses) {

    public RenderedProgram {
        decls = List.copyOf(decls);
        clauses = List.copyOf(clauses);
    }
}
