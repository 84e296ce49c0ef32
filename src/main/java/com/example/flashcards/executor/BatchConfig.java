package com.example.flashcards.executor;

import lombok.Builder;

import java.time.Duration;
import java.util.Objects;

/**
 * Run-level settings for {@link BatchExecutor}.
 *
 * @param batchSize       items per concurrently dispatched group
 * @param maxConcurrency  simultaneous in-flight unit operations; {@code null} means same as batchSize
 * @param maxRetries      retries per item after the first attempt
 * @param backoffBase     delay before the first retry, doubled for every further retry
 * @param interBatchDelay pause between two consecutive batches
 */
@Builder(toBuilder = true)
public record BatchConfig(
        int batchSize,
        Integer maxConcurrency,
        int maxRetries,
        Duration backoffBase,
        Duration interBatchDelay
) {

    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BACKOFF_BASE = Duration.ofSeconds(1);

    public BatchConfig {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive, was " + batchSize);
        }
        if (maxConcurrency == null) {
            maxConcurrency = batchSize;
        }
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be positive, was " + maxConcurrency);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        }
        Objects.requireNonNull(backoffBase, "backoffBase");
        Objects.requireNonNull(interBatchDelay, "interBatchDelay");
        if (backoffBase.isNegative() || backoffBase.isZero()) {
            throw new IllegalArgumentException("backoffBase must be positive, was " + backoffBase);
        }
        if (interBatchDelay.isNegative()) {
            throw new IllegalArgumentException("interBatchDelay must not be negative, was " + interBatchDelay);
        }
    }

    public static BatchConfig defaults() {
        return builder().build();
    }

    /**
     * Builder with the documented defaults pre-filled.
     */
    public static class BatchConfigBuilder {
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration backoffBase = DEFAULT_BACKOFF_BASE;
        private Duration interBatchDelay = Duration.ZERO;
    }
}
