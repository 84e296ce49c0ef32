package com.example.flashcards.config;

import com.example.flashcards.executor.BatchConfig;
import com.example.flashcards.executor.BatchEventListener;
import com.example.flashcards.executor.BatchExecutor;
import com.example.flashcards.listener.CompositeBatchEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Wires the batch executor from app.batch.* properties.
 *
 * app.batch.max-concurrency=0 means "same as batch size".
 */
@Configuration
@Slf4j
public class BatchExecutorConfig {

    @Bean
    public BatchConfig batchConfig(
            @Value("${app.batch.batch-size:10}") int batchSize,
            @Value("${app.batch.max-concurrency:0}") int maxConcurrency,
            @Value("${app.batch.max-retries:3}") int maxRetries,
            @Value("${app.batch.backoff-base-ms:1000}") long backoffBaseMs,
            @Value("${app.batch.inter-batch-delay-ms:0}") long interBatchDelayMs) {
        BatchConfig config = BatchConfig.builder()
                .batchSize(batchSize)
                .maxConcurrency(maxConcurrency > 0 ? maxConcurrency : null)
                .maxRetries(maxRetries)
                .backoffBase(Duration.ofMillis(backoffBaseMs))
                .interBatchDelay(Duration.ofMillis(interBatchDelayMs))
                .build();
        log.info("Batch config: {}", config);
        return config;
    }

    @Bean
    public BatchExecutor batchExecutor(
            @Qualifier("unitWorkerExecutor") ExecutorService unitWorkerExecutor,
            List<BatchEventListener> listeners) {
        log.info("Batch executor listeners: {}",
                listeners.stream().map(l -> l.getClass().getSimpleName()).toList());
        return new BatchExecutor(unitWorkerExecutor, new CompositeBatchEventListener(listeners));
    }
}
