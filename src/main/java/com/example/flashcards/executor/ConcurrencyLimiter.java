package com.example.flashcards.executor;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds the number of unit operations in flight across a whole run.
 *
 * Uses a Semaphore for the permit pool. Waiting callers poll so that closing the
 * limiter (run cancellation) releases them without interrupting anyone.
 */
@Slf4j
public class ConcurrencyLimiter implements AutoCloseable {

    private static final long ADMIT_POLL_MS = 25;

    private final int maxConcurrency;
    private final Semaphore permits;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();

    public ConcurrencyLimiter(int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be positive, was " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
        this.permits = new Semaphore(maxConcurrency, true);
    }

    /**
     * Block until a slot is free.
     *
     * @return a permit, or empty if the limiter was closed or the caller interrupted while waiting
     */
    public Optional<Permit> admit() {
        try {
            while (!closed.get()) {
                if (permits.tryAcquire(ADMIT_POLL_MS, TimeUnit.MILLISECONDS)) {
                    if (closed.get()) {
                        permits.release();
                        break;
                    }
                    int current = inFlight.incrementAndGet();
                    peakInFlight.accumulateAndGet(current, Math::max);
                    return Optional.of(new Permit());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for a concurrency permit");
        }
        return Optional.empty();
    }

    /**
     * Return a permit to the pool. Releasing the same permit twice has no effect.
     */
    public void release(Permit permit) {
        if (permit.owner() != this) {
            throw new IllegalArgumentException("Permit was issued by a different limiter");
        }
        if (permit.released.compareAndSet(false, true)) {
            inFlight.decrementAndGet();
            permits.release();
        }
    }

    /**
     * Stop admitting. Callers blocked in {@link #admit()} return empty within one poll interval.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("Concurrency limiter closed with {} permits in flight", inFlight.get());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int peakInFlight() {
        return peakInFlight.get();
    }

    /**
     * A held concurrency slot. Closing it releases the slot.
     */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {
        }

        ConcurrencyLimiter owner() {
            return ConcurrencyLimiter.this;
        }

        @Override
        public void close() {
            release(this);
        }
    }
}
