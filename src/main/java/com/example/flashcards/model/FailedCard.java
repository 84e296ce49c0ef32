package com.example.flashcards.model;

/**
 * Card that could not be enhanced, kept for the failures file.
 */
public record FailedCard(
    RawCard card,
    String reason,
    String exceptionType,
    int attempts
) {

    public static FailedCard from(RawCard card, UnitOutcome.Failure<?> failure) {
        Throwable error = failure.error();
        return new FailedCard(
                card,
                failure.reason(),
                error != null ? error.getClass().getSimpleName() : failure.kind().name(),
                failure.attempts()
        );
    }
}
