package com.example.flashcards.executor;

import lombok.Getter;

/**
 * Error that escaped the per-item retry boundary while a batch was dispatched or awaited.
 */
@Getter
public class BatchInfrastructureException extends RuntimeException {

    private final int batchIndex;

    public BatchInfrastructureException(int batchIndex, Throwable cause) {
        super("Batch " + batchIndex + " failed: " + describe(cause), cause);
        this.batchIndex = batchIndex;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null
                ? cause.getClass().getSimpleName() + ": " + cause.getMessage()
                : cause.getClass().getSimpleName();
    }
}
