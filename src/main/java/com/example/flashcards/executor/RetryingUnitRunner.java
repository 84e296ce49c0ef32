package com.example.flashcards.executor;

import com.example.flashcards.model.FailureKind;
import com.example.flashcards.model.UnitOutcome;
import com.example.flashcards.model.WorkItem;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Runs one work item's operation with bounded retry and exponential backoff.
 *
 * Never throws for a failing operation: after {@code maxRetries + 1} failed calls the
 * item ends as an {@link FailureKind#EXHAUSTED} failure. Only {@link Exception}s are
 * retried; an {@link Error} propagates to the batch. A listener that throws is
 * logged and does not change the item's outcome.
 */
@Slf4j
public class RetryingUnitRunner {

    private enum State { ATTEMPTING, BACKOFF, EXHAUSTED, CANCELLED }

    private final int maxRetries;
    private final Duration backoffBase;
    private final Sleeper sleeper;
    private final BatchEventListener listener;
    private final RunCancellation cancellation;

    public RetryingUnitRunner(int maxRetries, Duration backoffBase, Sleeper sleeper,
                              BatchEventListener listener, RunCancellation cancellation) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.backoffBase = backoffBase;
        this.sleeper = sleeper;
        this.listener = listener;
        this.cancellation = cancellation;
    }

    public RetryingUnitRunner(BatchConfig config, Sleeper sleeper,
                              BatchEventListener listener, RunCancellation cancellation) {
        this(config.maxRetries(), config.backoffBase(), sleeper, listener, cancellation);
    }

    public <T, R> UnitOutcome<R> run(WorkItem<T> item, UnitOperation<T, R> operation) {
        int attempts = 0;
        Throwable lastError = null;
        State state = State.ATTEMPTING;

        while (true) {
            switch (state) {
                case ATTEMPTING -> {
                    try {
                        R value = operation.apply(item);
                        return UnitOutcome.success(item.index(), value, attempts + 1);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        attempts++;
                        lastError = e;
                        state = State.CANCELLED;
                    } catch (Exception e) {
                        attempts++;
                        lastError = e;
                        int failedAttempts = attempts;
                        notifyListener(() -> listener.unitRetry(item.index(), failedAttempts, e));
                        state = attempts > maxRetries ? State.EXHAUSTED : State.BACKOFF;
                    }
                }
                case BACKOFF -> {
                    // retry index is 0-based: the first retry waits backoffBase
                    Duration delay = backoffFor(attempts - 1);
                    if (cancellation.isCancelled() || !sleeper.pause(delay, cancellation)) {
                        state = State.CANCELLED;
                    } else {
                        state = State.ATTEMPTING;
                    }
                }
                case EXHAUSTED -> {
                    int totalAttempts = attempts;
                    Throwable finalError = lastError;
                    notifyListener(() -> listener.unitExhausted(item.index(), totalAttempts, finalError));
                    return UnitOutcome.failure(item.index(), FailureKind.EXHAUSTED, lastError, attempts);
                }
                case CANCELLED -> {
                    Throwable reason = lastError != null ? lastError : new CancellationException("Run cancelled");
                    return UnitOutcome.failure(item.index(), FailureKind.CANCELLED, reason, attempts);
                }
            }
        }
    }

    private void notifyListener(Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Batch event listener failed: {}", e.getMessage(), e);
        }
    }

    Duration backoffFor(int retryIndex) {
        int shift = Math.min(Math.max(retryIndex, 0), 30);
        return backoffBase.multipliedBy(1L << shift);
    }
}
