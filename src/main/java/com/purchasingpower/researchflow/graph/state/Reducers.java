package com.purchasingpower.researchflow.graph.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Built-in reducers.
 */
public final class Reducers {

    private Reducers() {
    }

    /**
     * Replaces the old value with the new one. Empty value is {@code null}.
     */
    public static Reducer overwrite() {
        return overwrite(null);
    }

    /**
     * Replaces the old value with the new one, with an explicit empty value
     * (e.g. {@code false} for flags).
     */
    public static Reducer overwrite(Object emptyValue) {
        return new Reducer() {
            @Override
            public Object reduce(Object current, Object update) {
                return update;
            }

            @Override
            public Object emptyValue() {
                return emptyValue;
            }
        };
    }

    /**
     * Concatenates the old sequence with the new elements, preserving order and
     * keeping duplicates. A non-collection update is appended as a single element;
     * a {@code null} update leaves the sequence unchanged.
     */
    public static Reducer appendSequence() {
        return new Reducer() {
            @Override
            public Object reduce(Object current, Object update) {
                List<Object> merged = new ArrayList<>(asSequence(current));
                if (update instanceof Collection) {
                    merged.addAll((Collection<?>) update);
                } else if (update != null) {
                    merged.add(update);
                }
                return Collections.unmodifiableList(merged);
            }

            @Override
            public Object emptyValue() {
                return List.of();
            }
        };
    }

    private static Collection<?> asSequence(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection) {
            return (Collection<?>) value;
        }
        throw new IllegalArgumentException(
                "appendSequence expects a sequence but found " + value.getClass().getSimpleName());
    }
}
