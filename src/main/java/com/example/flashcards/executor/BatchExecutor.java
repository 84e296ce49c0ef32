package com.example.flashcards.executor;

import com.example.flashcards.model.FailureKind;
import com.example.flashcards.model.RunResult;
import com.example.flashcards.model.UnitOutcome;
import com.example.flashcards.model.WorkItem;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs a list of work items in fixed-size batches.
 *
 * Batches run one after another. Inside a batch every item is dispatched to the
 * worker pool at once and goes through the {@link ConcurrencyLimiter} and the
 * {@link RetryingUnitRunner}. The next batch starts only after every item of the
 * current batch has settled.
 *
 * An error escaping the per-item boundary fails only its own batch: every item of
 * that batch without an outcome is recorded as {@link FailureKind#BATCH_FAILED} and
 * the run moves on. The returned {@link RunResult} always holds one outcome per item,
 * in input order.
 */
@Slf4j
public class BatchExecutor {

    private final ExecutorService workerPool;
    private final BatchEventListener listener;
    private final Sleeper sleeper;

    public BatchExecutor(ExecutorService workerPool, BatchEventListener listener, Sleeper sleeper) {
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public BatchExecutor(ExecutorService workerPool, BatchEventListener listener) {
        this(workerPool, listener, Sleeper.cancellable());
    }

    public <T, R> RunResult<R> execute(List<WorkItem<T>> items, UnitOperation<T, R> operation, BatchConfig config) {
        return execute(items, operation, config, new RunCancellation());
    }

    /**
     * Process all items and return one outcome per item.
     *
     * @param items        items whose identities are 0..N-1 in list order
     * @param operation    the external call made for each item
     * @param config       batching, concurrency and retry settings
     * @param cancellation signal to stop the run early; unfinished items become CANCELLED failures
     * @throws IllegalArgumentException if item identities do not match their positions
     * @throws ConsistencyException     if the executor itself broke its contract
     */
    public <T, R> RunResult<R> execute(List<WorkItem<T>> items, UnitOperation<T, R> operation,
                                       BatchConfig config, RunCancellation cancellation) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(cancellation, "cancellation");
        requireSequentialIdentities(items);

        List<List<WorkItem<T>>> batches = partition(items, config.batchSize());
        ResultAggregator<R> aggregator = new ResultAggregator<>(items.size());
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(config.maxConcurrency());
        RetryingUnitRunner runner = new RetryingUnitRunner(config, sleeper, listener, cancellation);
        cancellation.onCancel(limiter::close);

        log.info("Run start: {} items in {} batches (batchSize={}, maxConcurrency={}, maxRetries={}, backoffBase={}, interBatchDelay={})",
                items.size(), batches.size(), config.batchSize(), config.maxConcurrency(),
                config.maxRetries(), config.backoffBase(), config.interBatchDelay());
        long startTime = System.currentTimeMillis();

        try {
            for (int batchIndex = 0; batchIndex < batches.size(); batchIndex++) {
                List<WorkItem<T>> batch = batches.get(batchIndex);
                if (cancellation.isCancelled()) {
                    recordCancelled(batch, aggregator);
                    continue;
                }

                runBatch(batchIndex, batches.size(), batch, operation, runner, limiter, aggregator);

                // the pause also follows a batch that failed as a whole
                boolean lastBatch = batchIndex == batches.size() - 1;
                if (!lastBatch && !config.interBatchDelay().isZero() && !cancellation.isCancelled()) {
                    sleeper.pause(config.interBatchDelay(), cancellation);
                }
            }
        } finally {
            limiter.close();
        }

        RunResult<R> result = aggregator.complete();
        long totalTime = System.currentTimeMillis() - startTime;
        log.info("Run complete in {}ms | Total: {} | Succeeded: {} (retried: {}) | Failed: {} (cancelled: {}) | Batches failed: {} | Peak concurrency: {}",
                totalTime, result.total(), result.succeeded(), result.retriedThenSucceeded(),
                result.failed(), result.cancelled(), result.batchesFailed(), limiter.peakInFlight());
        notifyListener(() -> listener.runComplete(result.total(), result.succeeded(), result.failed()));
        return result;
    }

    private <T, R> void runBatch(int batchIndex, int batchCount, List<WorkItem<T>> batch,
                                 UnitOperation<T, R> operation, RetryingUnitRunner runner,
                                 ConcurrencyLimiter limiter, ResultAggregator<R> aggregator) {
        log.info("Batch {}/{}: dispatching items {}..{}",
                batchIndex + 1, batchCount, batch.get(0).index(), batch.get(batch.size() - 1).index());
        long batchStart = System.currentTimeMillis();
        List<CompletableFuture<Void>> dispatched = new ArrayList<>(batch.size());

        try {
            for (WorkItem<T> item : batch) {
                dispatched.add(CompletableFuture.runAsync(
                        () -> runUnit(item, operation, runner, limiter, aggregator), workerPool));
            }
            CompletableFuture.allOf(dispatched.toArray(new CompletableFuture[0])).join();
            log.info("Batch {}/{} settled in {}ms", batchIndex + 1, batchCount, System.currentTimeMillis() - batchStart);
        } catch (RuntimeException e) {
            Throwable cause = settleFailedBatch(dispatched, e);
            failUnresolved(batchIndex, batch, aggregator, new BatchInfrastructureException(batchIndex, cause));
        }
    }

    private <T, R> void runUnit(WorkItem<T> item, UnitOperation<T, R> operation, RetryingUnitRunner runner,
                                ConcurrencyLimiter limiter, ResultAggregator<R> aggregator) {
        Optional<ConcurrencyLimiter.Permit> permit = limiter.admit();
        if (permit.isEmpty()) {
            aggregator.record(UnitOutcome.failure(item.index(), FailureKind.CANCELLED,
                    new CancellationException("Run cancelled before item " + item.index() + " was started"), 0));
            return;
        }
        try (ConcurrencyLimiter.Permit ignored = permit.get()) {
            aggregator.record(runner.run(item, operation));
        }
    }

    private <T, R> void failUnresolved(int batchIndex, List<WorkItem<T>> batch, ResultAggregator<R> aggregator,
                                       BatchInfrastructureException error) {
        List<Integer> unresolved = new ArrayList<>();
        for (WorkItem<T> item : batch) {
            if (aggregator.recordIfAbsent(UnitOutcome.failure(item.index(), FailureKind.BATCH_FAILED, error, 0))) {
                unresolved.add(item.index());
            }
        }
        aggregator.markBatchFailed();
        log.error("Batch {} failed outside the per-item boundary, {} of {} items marked failed: {}",
                batchIndex + 1, unresolved.size(), batch.size(), error.getMessage(), error.getCause());
        notifyListener(() -> listener.batchFailed(batchIndex, List.copyOf(unresolved), error));
    }

    private <T, R> void recordCancelled(List<WorkItem<T>> batch, ResultAggregator<R> aggregator) {
        for (WorkItem<T> item : batch) {
            aggregator.recordIfAbsent(UnitOutcome.failure(item.index(), FailureKind.CANCELLED,
                    new CancellationException("Run cancelled before item " + item.index() + " was started"), 0));
        }
    }

    private void notifyListener(Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Batch event listener failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Wait for every dispatched unit of a failed batch, then return the root failure.
     *
     * @throws ConsistencyException if the batch failed on a broken executor contract
     */
    static Throwable settleFailedBatch(List<CompletableFuture<Void>> dispatched, RuntimeException failure) {
        awaitSettled(dispatched);
        Throwable cause = unwrap(failure);
        if (cause instanceof ConsistencyException consistency) {
            throw consistency;
        }
        return cause;
    }

    private static void awaitSettled(List<CompletableFuture<Void>> dispatched) {
        CompletableFuture.allOf(dispatched.toArray(new CompletableFuture[0]))
                .handle((ignored, error) -> null)
                .join();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static <T> void requireSequentialIdentities(List<WorkItem<T>> items) {
        for (int i = 0; i < items.size(); i++) {
            WorkItem<T> item = items.get(i);
            if (item == null || item.index() != i) {
                throw new IllegalArgumentException("Item at position " + i + " has identity "
                        + (item == null ? "null" : item.index()) + "; identities must be 0..N-1 in order");
            }
        }
    }

    static <T> List<List<WorkItem<T>>> partition(List<WorkItem<T>> items, int batchSize) {
        List<List<WorkItem<T>>> batches = new ArrayList<>();
        for (int from = 0; from < items.size(); from += batchSize) {
            batches.add(items.subList(from, Math.min(from + batchSize, items.size())));
        }
        return batches;
    }
}
