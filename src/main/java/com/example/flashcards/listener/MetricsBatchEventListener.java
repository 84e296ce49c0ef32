package com.example.flashcards.listener;

import com.example.flashcards.config.BatchMetrics;
import com.example.flashcards.executor.BatchEventListener;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Counts executor events in Micrometer.
 */
@Component
@RequiredArgsConstructor
public class MetricsBatchEventListener implements BatchEventListener {

    private final BatchMetrics metrics;

    @Override
    public void unitRetry(int itemIndex, int attempt, Throwable error) {
        metrics.incrementUnitRetry();
    }

    @Override
    public void unitExhausted(int itemIndex, int attempts, Throwable error) {
        metrics.incrementUnitExhausted();
    }

    @Override
    public void batchFailed(int batchIndex, List<Integer> itemIndexes, Throwable error) {
        metrics.incrementBatchFailed();
    }

    @Override
    public void runComplete(int total, int succeeded, int failed) {
        metrics.incrementRunCompleted(succeeded, failed);
    }
}
