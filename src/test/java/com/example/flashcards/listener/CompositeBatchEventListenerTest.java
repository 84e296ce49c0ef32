package com.example.flashcards.listener;

import com.example.flashcards.executor.BatchEventListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CompositeBatchEventListenerTest {

    @Mock
    private BatchEventListener first;

    @Mock
    private BatchEventListener second;

    @Test
    void shouldForwardEveryEventToAllDelegates() {
        CompositeBatchEventListener composite = new CompositeBatchEventListener(List.of(first, second));
        IOException error = new IOException("boom");

        composite.unitRetry(1, 1, error);
        composite.unitExhausted(1, 4, error);
        composite.batchFailed(0, List.of(1, 2), error);
        composite.runComplete(10, 8, 2);

        for (BatchEventListener delegate : List.of(first, second)) {
            verify(delegate).unitRetry(1, 1, error);
            verify(delegate).unitExhausted(1, 4, error);
            verify(delegate).batchFailed(0, List.of(1, 2), error);
            verify(delegate).runComplete(10, 8, 2);
        }
    }

    @Test
    void shouldKeepNotifyingWhenOneDelegateFails() {
        doThrow(new IllegalStateException("registry closed")).when(first).unitRetry(anyInt(), anyInt(), any());
        CompositeBatchEventListener composite = new CompositeBatchEventListener(List.of(first, second));
        IOException error = new IOException("boom");

        assertThatCode(() -> composite.unitRetry(7, 2, error)).doesNotThrowAnyException();

        verify(second).unitRetry(7, 2, error);
    }
}
