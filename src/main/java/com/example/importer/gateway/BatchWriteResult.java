package com.example.importer.gateway;

import lombok.Value;

/**
 * Typed outcome of one batch write. Failures are values so callers can tell retryable from terminal errors
 * without unwinding.
 */
@Value
public class BatchWriteResult {

    public enum Outcome {
        SUCCESS,
        TRANSIENT_ERROR,
        FATAL_ERROR
    }

    Outcome outcome;
    int rowsWritten;
    String message;

    public static BatchWriteResult success(int rowsWritten) {
        return new BatchWriteResult(Outcome.SUCCESS, rowsWritten, null);
    }

    public static BatchWriteResult transientError(String message) {
        return new BatchWriteResult(Outcome.TRANSIENT_ERROR, 0, message);
    }

    public static BatchWriteResult fatalError(String message) {
        return new BatchWriteResult(Outcome.FATAL_ERROR, 0, message);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
