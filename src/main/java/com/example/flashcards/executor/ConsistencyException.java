package com.example.flashcards.executor;

/**
 * Internal contract violation in the executor, e.g. a run completed with missing
 * outcomes. Indicates a defect, never bad input data.
 */
public class ConsistencyException extends IllegalStateException {

    public ConsistencyException(String message) {
        super(message);
    }
}
