package com.example.flashcards.config;

import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * ExecutorService decorator that runs every task with the MDC (runId etc.) of the
 * thread that submitted it, and clears the worker's MDC afterwards.
 *
 * submit, invokeAll and invokeAny all end up in {@link #execute(Runnable)} on the
 * submitting thread, so the context is captured in one place.
 */
public class MdcPropagatingExecutorService extends AbstractExecutorService {

    private final ExecutorService delegate;

    public MdcPropagatingExecutorService(ExecutorService delegate) {
        this.delegate = delegate;
    }

    @Override
    public void execute(Runnable command) {
        Map<String, String> submitterContext = MDC.getCopyOfContextMap();
        delegate.execute(() -> runWithContext(submitterContext, command));
    }

    private static void runWithContext(Map<String, String> context, Runnable command) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
        try {
            command.run();
        } finally {
            MDC.clear();
        }
    }

    @Override
    public void shutdown() {
        delegate.shutdown();
    }

    @Override
    public List<Runnable> shutdownNow() {
        return delegate.shutdownNow();
    }

    @Override
    public boolean isShutdown() {
        return delegate.isShutdown();
    }

    @Override
    public boolean isTerminated() {
        return delegate.isTerminated();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return delegate.awaitTermination(timeout, unit);
    }
}
