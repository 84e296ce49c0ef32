package com.example.flashcards.config;

import com.example.flashcards.executor.BatchConfig;
import com.example.flashcards.executor.BatchExecutor;
import com.example.flashcards.listener.LoggingBatchEventListener;
import com.example.flashcards.listener.MetricsBatchEventListener;
import com.example.flashcards.model.RunResult;
import com.example.flashcards.model.WorkItem;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.test.context.ContextConfiguration;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "app.batch.batch-size=4",
        "app.batch.max-concurrency=0",
        "app.batch.max-retries=1",
        "app.batch.backoff-base-ms=5",
        "app.batch.inter-batch-delay-ms=0"
})
@ContextConfiguration(classes = {
        ExecutorConfig.class,
        BatchExecutorConfig.class,
        BatchMetrics.class,
        MetricsBatchEventListener.class,
        LoggingBatchEventListener.class,
        BatchExecutorConfigTest.MeterRegistryConfig.class
})
class BatchExecutorConfigTest {

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Autowired
    private BatchConfig batchConfig;

    @Autowired
    private BatchExecutor batchExecutor;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void shouldBindBatchProperties() {
        assertThat(batchConfig.batchSize()).isEqualTo(4);
        assertThat(batchConfig.maxConcurrency()).isEqualTo(4);
        assertThat(batchConfig.maxRetries()).isEqualTo(1);
        assertThat(batchConfig.backoffBase()).isEqualTo(Duration.ofMillis(5));
        assertThat(batchConfig.interBatchDelay()).isZero();
    }

    @Test
    void shouldReportRunEventsToMetrics() {
        List<WorkItem<String>> items = WorkItem.indexAll(List.of("uno", "dos", "tres", "cuatro", "cinco"));

        RunResult<String> result = batchExecutor.execute(items, item -> {
            if (item.value().equals("tres")) {
                throw new IOException("503 Service Unavailable");
            }
            return item.value().toUpperCase();
        }, batchConfig);

        assertThat(result.succeeded()).isEqualTo(4);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(meterRegistry.get("unit.retry").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("unit.exhausted").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("run.items.succeeded").counter().count()).isEqualTo(4.0);
    }
}
