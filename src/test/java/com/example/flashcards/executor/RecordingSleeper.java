package com.example.flashcards.executor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper for tests: records requested pauses and returns immediately.
 */
class RecordingSleeper implements Sleeper {

    private final List<Duration> pauses = new CopyOnWriteArrayList<>();

    @Override
    public boolean pause(Duration duration, RunCancellation cancellation) {
        pauses.add(duration);
        return !cancellation.isCancelled();
    }

    List<Duration> pauses() {
        return List.copyOf(pauses);
    }
}
