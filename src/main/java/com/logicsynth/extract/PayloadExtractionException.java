package com.logicsynth.extract;

/**
 * Thrown when no structured document can be recovered from caller text.
 * Never carries a partial result.
 */
public class PayloadExtractionException extends RuntimeException {

    private final ExtractionFailure failure;

    public PayloadExtractionException(ExtractionFailure failure, String detail) {
        super(detail == null ? failure.description() : failure.description() + ": " + detail);
        this.failure = failure;
    }

    public ExtractionFailure getFailure() {
        return failure;
    }
}
