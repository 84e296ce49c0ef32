package com.example.flashcards.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One unit of input, identified by its position in the original sequence.
 */
public record WorkItem<T>(int index, T value) {

    public WorkItem {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, was " + index);
        }
    }

    /**
     * Wrap an ordered list of values, assigning each its list position as identity.
     */
    public static <T> List<WorkItem<T>> indexAll(List<T> values) {
        Objects.requireNonNull(values, "values");
        List<WorkItem<T>> items = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            items.add(new WorkItem<>(i, values.get(i)));
        }
        return List.copyOf(items);
    }
}
