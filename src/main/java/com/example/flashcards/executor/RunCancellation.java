package com.example.flashcards.executor;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * External cancellation signal for a run.
 *
 * Cancelling lets in-flight attempts finish, but no new attempts or batches are
 * started, waiting permit requests are released and pending sleeps wake up.
 */
@Slf4j
public final class RunCancellation {

    private final CountDownLatch signal = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public void cancel() {
        synchronized (signal) {
            if (signal.getCount() == 0) {
                return;
            }
            signal.countDown();
        }
        log.info("Run cancellation requested");
        callbacks.forEach(Runnable::run);
    }

    public boolean isCancelled() {
        return signal.getCount() == 0;
    }

    /**
     * Register a callback for cancellation. Runs immediately if already cancelled,
     * so callbacks must be idempotent.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled()) {
            callback.run();
        }
    }

    /**
     * Wait up to {@code timeout} for cancellation.
     *
     * @return true if the run was cancelled within the timeout
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return signal.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
