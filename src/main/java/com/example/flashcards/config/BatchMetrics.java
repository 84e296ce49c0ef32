package com.example.flashcards.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for enrichment runs.
 *
 * Key metrics:
 * - unit.retry            - failed unit attempts
 * - unit.exhausted        - items that used up all retries
 * - batch.failed          - batches failed outside the per-item boundary
 * - run.items.succeeded   - items with a value
 * - run.items.failed      - items recorded as failures
 * - run.completed         - finished runs
 * - enrichment.run.time   - executor run time
 * - enrichment.file.time  - whole-file time (read, run, write)
 */
@Component
@Getter
public class BatchMetrics {

    private final Timer runTimer;
    private final Timer fileTimer;

    private final Counter unitRetryCounter;
    private final Counter unitExhaustedCounter;
    private final Counter batchFailedCounter;
    private final Counter itemsSucceededCounter;
    private final Counter itemsFailedCounter;
    private final Counter runsCompletedCounter;

    public BatchMetrics(MeterRegistry registry) {
        this.runTimer = Timer.builder("enrichment.run.time")
                .description("Batch executor run time")
                .register(registry);

        this.fileTimer = Timer.builder("enrichment.file.time")
                .description("Total time to enhance one deck file")
                .register(registry);

        this.unitRetryCounter = Counter.builder("unit.retry")
                .description("Failed unit attempts")
                .register(registry);

        this.unitExhaustedCounter = Counter.builder("unit.exhausted")
                .description("Items that exhausted all retries")
                .register(registry);

        this.batchFailedCounter = Counter.builder("batch.failed")
                .description("Batches failed by an infrastructure error")
                .register(registry);

        this.itemsSucceededCounter = Counter.builder("run.items.succeeded")
                .description("Items completed with a value")
                .register(registry);

        this.itemsFailedCounter = Counter.builder("run.items.failed")
                .description("Items recorded as failures")
                .register(registry);

        this.runsCompletedCounter = Counter.builder("run.completed")
                .description("Completed executor runs")
                .register(registry);
    }

    public void recordRunTime(long millis) {
        runTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordFileTime(long millis) {
        fileTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementUnitRetry() {
        unitRetryCounter.increment();
    }

    public void incrementUnitExhausted() {
        unitExhaustedCounter.increment();
    }

    public void incrementBatchFailed() {
        batchFailedCounter.increment();
    }

    public void incrementRunCompleted(int succeeded, int failed) {
        runsCompletedCounter.increment();
        itemsSucceededCounter.increment(succeeded);
        itemsFailedCounter.increment(failed);
    }
}
