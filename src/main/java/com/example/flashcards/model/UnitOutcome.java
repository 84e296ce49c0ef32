package com.example.flashcards.model;

import java.util.Objects;

/**
 * Final result for a single work item: either a value or a recorded failure.
 * Exactly one outcome exists per item of a run.
 *
 * @param <R> value type produced by the unit operation
 */
public interface UnitOutcome<R> {

    int itemIndex();

    int attempts();

    boolean isSuccess();

    static <R> Success<R> success(int itemIndex, R value, int attempts) {
        return new Success<>(itemIndex, value, attempts);
    }

    static <R> Failure<R> failure(int itemIndex, FailureKind kind, Throwable error, int attempts) {
        return new Failure<>(itemIndex, kind, error, attempts);
    }

    record Success<R>(int itemIndex, R value, int attempts) implements UnitOutcome<R> {

        public Success {
            if (attempts < 1) {
                throw new IllegalArgumentException("a success needs at least one attempt");
            }
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        /**
         * True when the value was only obtained after at least one failed attempt.
         */
        public boolean wasRetried() {
            return attempts > 1;
        }
    }

    record Failure<R>(int itemIndex, FailureKind kind, Throwable error, int attempts) implements UnitOutcome<R> {

        public Failure {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        public String reason() {
            if (error == null) {
                return kind.name();
            }
            return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        }
    }
}
