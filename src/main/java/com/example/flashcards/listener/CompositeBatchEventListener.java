package com.example.flashcards.listener;

import com.example.flashcards.executor.BatchEventListener;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans executor events out to several listeners. A failing listener is logged and
 * does not stop the others.
 */
@Slf4j
public class CompositeBatchEventListener implements BatchEventListener {

    private final List<BatchEventListener> delegates;

    public CompositeBatchEventListener(List<? extends BatchEventListener> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void unitRetry(int itemIndex, int attempt, Throwable error) {
        forEach(l -> l.unitRetry(itemIndex, attempt, error));
    }

    @Override
    public void unitExhausted(int itemIndex, int attempts, Throwable error) {
        forEach(l -> l.unitExhausted(itemIndex, attempts, error));
    }

    @Override
    public void batchFailed(int batchIndex, List<Integer> itemIndexes, Throwable error) {
        forEach(l -> l.batchFailed(batchIndex, itemIndexes, error));
    }

    @Override
    public void runComplete(int total, int succeeded, int failed) {
        forEach(l -> l.runComplete(total, succeeded, failed));
    }

    private void forEach(Consumer<BatchEventListener> call) {
        for (BatchEventListener delegate : delegates) {
            try {
                call.accept(delegate);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed: {}", delegate.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
