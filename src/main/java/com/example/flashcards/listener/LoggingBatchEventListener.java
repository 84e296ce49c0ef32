package com.example.flashcards.listener;

import com.example.flashcards.executor.BatchEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs unit-level executor events. Batch failures and run summaries are logged
 * by the executor itself.
 */
@Component
@Slf4j
public class LoggingBatchEventListener implements BatchEventListener {

    @Override
    public void unitRetry(int itemIndex, int attempt, Throwable error) {
        log.warn("Item {} failed on attempt {}: {} ({})",
                itemIndex, attempt, error.getMessage(), error.getClass().getSimpleName());
    }

    @Override
    public void unitExhausted(int itemIndex, int attempts, Throwable error) {
        log.error("Item {} failed after {} attempts, giving up: {}",
                itemIndex, attempts, error != null ? error.getMessage() : "unknown error");
    }
}
