package com.example.flashcards.executor;

import java.util.List;

/**
 * Observability hook for {@link BatchExecutor}. All methods default to no-ops.
 * Implementations are called from worker threads and must be thread-safe.
 */
public interface BatchEventListener {

    BatchEventListener NO_OP = new BatchEventListener() {};

    /**
     * A unit attempt failed. {@code attempt} is 1-based.
     */
    default void unitRetry(int itemIndex, int attempt, Throwable error) {
    }

    /**
     * An item used up all its attempts.
     */
    default void unitExhausted(int itemIndex, int attempts, Throwable error) {
    }

    /**
     * A batch raised an error outside the per-item boundary; the listed items were
     * recorded as failed.
     */
    default void batchFailed(int batchIndex, List<Integer> itemIndexes, Throwable error) {
    }

    default void runComplete(int total, int succeeded, int failed) {
    }
}
