package com.example.flashcards.executor;

import java.time.Duration;

/**
 * Waits for retry backoff and inter-batch pauses.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Pause for {@code duration} unless the run is cancelled first.
     *
     * @return true if the full pause elapsed, false if it was cut short
     */
    boolean pause(Duration duration, RunCancellation cancellation);

    /**
     * Real-time sleeper that wakes up early on cancellation. An interrupt cancels the run.
     */
    static Sleeper cancellable() {
        return (duration, cancellation) -> {
            if (duration.isZero() || duration.isNegative()) {
                return !cancellation.isCancelled();
            }
            try {
                return !cancellation.await(duration);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancellation.cancel();
                return false;
            }
        };
    }
}
