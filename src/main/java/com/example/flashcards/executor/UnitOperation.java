package com.example.flashcards.executor;

import com.example.flashcards.model.WorkItem;

/**
 * The external call made once per work item. Implementations may block and may
 * throw any exception; failures are retried by {@link RetryingUnitRunner}.
 */
@FunctionalInterface
public interface UnitOperation<T, R> {

    R apply(WorkItem<T> item) throws Exception;
}
