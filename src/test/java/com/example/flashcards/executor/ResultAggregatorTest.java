package com.example.flashcards.executor;

import com.example.flashcards.model.FailureKind;
import com.example.flashcards.model.RunResult;
import com.example.flashcards.model.UnitOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultAggregatorTest {

    @Test
    @DisplayName("Should rebuild input order from outcomes recorded out of order")
    void shouldRestoreInputOrder() {
        // Given
        ResultAggregator<String> aggregator = new ResultAggregator<>(4);

        // When
        aggregator.record(UnitOutcome.success(3, "d", 1));
        aggregator.record(UnitOutcome.failure(1, FailureKind.EXHAUSTED, new IOException("x"), 4));
        aggregator.record(UnitOutcome.success(0, "a", 2));
        aggregator.record(UnitOutcome.failure(2, FailureKind.CANCELLED, new CancellationException(), 0));
        aggregator.markBatchFailed();
        RunResult<String> result = aggregator.complete();

        // Then
        assertThat(result.outcomes().stream().map(o -> o.itemIndex()).toList()).containsExactly(0, 1, 2, 3);
        assertThat(result.total()).isEqualTo(4);
        assertThat(result.succeeded()).isEqualTo(2);
        assertThat(result.retriedThenSucceeded()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(2);
        assertThat(result.cancelled()).isEqualTo(1);
        assertThat(result.batchesFailed()).isEqualTo(1);
        assertThat(result.successes().stream().map(s -> s.value()).toList()).containsExactly("a", "d");
    }

    @Test
    @DisplayName("Should fail completion while outcomes are missing")
    void shouldRejectIncompleteRun() {
        ResultAggregator<String> aggregator = new ResultAggregator<>(3);
        aggregator.record(UnitOutcome.success(0, "a", 1));

        assertThatThrownBy(aggregator::complete)
                .isInstanceOf(ConsistencyException.class)
                .hasMessageContaining("2 items missing")
                .hasMessageContaining("[1, 2]");
    }

    @Test
    @DisplayName("Should reject a second outcome for the same item")
    void shouldRejectDuplicateOutcome() {
        ResultAggregator<String> aggregator = new ResultAggregator<>(2);
        aggregator.record(UnitOutcome.success(1, "b", 1));

        assertThatThrownBy(() -> aggregator.record(UnitOutcome.success(1, "again", 1)))
                .isInstanceOf(ConsistencyException.class);
        assertThat(aggregator.recordIfAbsent(UnitOutcome.success(1, "again", 1))).isFalse();
        assertThat(aggregator.recorded()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject outcomes for unknown items")
    void shouldRejectUnknownIndex() {
        ResultAggregator<String> aggregator = new ResultAggregator<>(2);

        assertThatThrownBy(() -> aggregator.record(UnitOutcome.success(2, "c", 1)))
                .isInstanceOf(ConsistencyException.class);
    }

    @Test
    @DisplayName("Should complete an empty run")
    void shouldCompleteEmptyRun() {
        RunResult<String> result = new ResultAggregator<String>(0).complete();

        assertThat(result.outcomes()).isEmpty();
        assertThat(result.succeeded()).isZero();
    }
}
