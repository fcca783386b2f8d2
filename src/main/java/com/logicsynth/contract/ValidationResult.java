package com.logicsynth.contract;

import com.logicsynth.ir.Program;

import java.util.List;

/**
 * Outcome of validation: the bound program when accepted, the diagnostics otherwise.
 */
public record ValidationResult(Program program, List<Diagnostic> diagnostics) {

    public ValidationResult {
        diagnostics = List.copyOf(diagnostics);
    }

    static ValidationResult accepted(Program program) {
        return new ValidationResult(program, List.of());
    }

    static ValidationResult rejected(List<Diagnostic> diagnostics) {
        return new ValidationResult(null, diagnostics);
    }

    public boolean valid() {
        return program != null && diagnostics.isEmpty();
    }
}
