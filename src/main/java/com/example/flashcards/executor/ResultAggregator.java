package com.example.flashcards.executor;

import com.example.flashcards.model.FailureKind;
import com.example.flashcards.model.RunResult;
import com.example.flashcards.model.UnitOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Collects unit outcomes as they complete, in any order, into a slot per item index.
 * Each slot is written at most once.
 */
public class ResultAggregator<R> {

    private final AtomicReferenceArray<UnitOutcome<R>> slots;
    private final AtomicInteger recorded = new AtomicInteger();
    private final AtomicInteger batchesFailed = new AtomicInteger();

    public ResultAggregator(int expectedItems) {
        if (expectedItems < 0) {
            throw new IllegalArgumentException("expectedItems must be >= 0, was " + expectedItems);
        }
        this.slots = new AtomicReferenceArray<>(expectedItems);
    }

    /**
     * Record the final outcome of an item.
     *
     * @throws ConsistencyException if the index is unknown or already has an outcome
     */
    public void record(UnitOutcome<R> outcome) {
        if (!recordIfAbsent(outcome)) {
            throw new ConsistencyException("Outcome for item " + outcome.itemIndex() + " recorded twice");
        }
    }

    /**
     * Record the outcome unless the item already has one.
     *
     * @return true if this call filled the slot
     */
    public boolean recordIfAbsent(UnitOutcome<R> outcome) {
        int index = outcome.itemIndex();
        if (index < 0 || index >= slots.length()) {
            throw new ConsistencyException("Outcome for unknown item " + index + " (expected 0.." + (slots.length() - 1) + ")");
        }
        if (slots.compareAndSet(index, null, outcome)) {
            recorded.incrementAndGet();
            return true;
        }
        return false;
    }

    public boolean hasOutcome(int itemIndex) {
        return slots.get(itemIndex) != null;
    }

    public void markBatchFailed() {
        batchesFailed.incrementAndGet();
    }

    public int expected() {
        return slots.length();
    }

    public int recorded() {
        return recorded.get();
    }

    /**
     * Build the ordered run result.
     *
     * @throws ConsistencyException if any item is still missing an outcome
     */
    public RunResult<R> complete() {
        List<UnitOutcome<R>> outcomes = new ArrayList<>(slots.length());
        List<Integer> missing = new ArrayList<>();
        int succeeded = 0;
        int retried = 0;
        int failed = 0;
        int cancelled = 0;

        for (int i = 0; i < slots.length(); i++) {
            UnitOutcome<R> outcome = slots.get(i);
            if (outcome == null) {
                missing.add(i);
                continue;
            }
            outcomes.add(outcome);
            if (outcome instanceof UnitOutcome.Success<R> success) {
                succeeded++;
                if (success.wasRetried()) {
                    retried++;
                }
            } else {
                failed++;
                if (((UnitOutcome.Failure<R>) outcome).kind() == FailureKind.CANCELLED) {
                    cancelled++;
                }
            }
        }

        if (!missing.isEmpty()) {
            throw new ConsistencyException("Run completed with " + missing.size()
                    + " items missing an outcome: " + abbreviate(missing));
        }
        return new RunResult<>(outcomes, succeeded, retried, failed, cancelled, batchesFailed.get());
    }

    private static String abbreviate(List<Integer> indexes) {
        return indexes.size() <= 10 ? indexes.toString() : indexes.subList(0, 10) + "...";
    }
}
