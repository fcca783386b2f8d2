package com.logicsynth.compile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.logicsynth.contract.Diagnostic;
import com.logicsynth.ir.Program;
import com.logicsynth.render.RenderedProgram;

import java.util.List;

/**
 * Outcome of one compile request. On failure {@code source} is null and
 * {@code diagnostics} is non-empty.
 */
public record CompileResult(
    @JsonProperty("success") boolean success,
    @JsonProperty("source") String source,
    @JsonProperty("decls") List<String> decls,
    @JsonProperty("clauses") List<String> clauses,
    @JsonProperty("diagnostics") List<Diagnostic> diagnostics,
    @JsonIgnore Program program
) {

    public CompileResult {
        decls = List.copyOf(decls);
        clauses = List.copyOf(clauses);
        diagnostics = List.copyOf(diagnostics);
    }

    static CompileResult succeeded(Program program, RenderedProgram rendered) {
        return new CompileResult(true, rendered.source(), rendered.decls(), rendered.clauses(), List.of(), program);
    }

    static CompileResult failed(List<Diagnostic> diagnostics) {
        return new CompileResult(false, null, List.of(), List.of(), diagnostics, null);
    }
}
