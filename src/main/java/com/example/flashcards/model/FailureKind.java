package com.example.flashcards.model;

/**
 * Why an item ended without a value.
 */
public enum FailureKind {

    /** Every attempt failed; the retry ceiling was reached. */
    EXHAUSTED,

    /** The item's batch raised an error outside the per-item retry boundary. */
    BATCH_FAILED,

    /** The run was cancelled before the item could finish. */
    CANCELLED
}
