package com.example.flashcards.model;

import java.util.List;

/**
 * Outcomes of a whole run in original input order, plus aggregate counts.
 */
public record RunResult<R>(
        List<UnitOutcome<R>> outcomes,
        int succeeded,
        int retriedThenSucceeded,
        int failed,
        int cancelled,
        int batchesFailed
) {

    public RunResult {
        outcomes = List.copyOf(outcomes);
    }

    public int total() {
        return outcomes.size();
    }

    public List<UnitOutcome.Success<R>> successes() {
        return outcomes.stream()
                .filter(UnitOutcome::isSuccess)
                .map(o -> (UnitOutcome.Success<R>) o)
                .toList();
    }

    public List<UnitOutcome.Failure<R>> failures() {
        return outcomes.stream()
                .filter(o -> !o.isSuccess())
                .map(o -> (UnitOutcome.Failure<R>) o)
                .toList();
    }

    public UnitOutcome<R> outcome(int itemIndex) {
        return outcomes.get(itemIndex);
    }
}
