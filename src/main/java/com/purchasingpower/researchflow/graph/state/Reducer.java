package com.purchasingpower.researchflow.graph.state;

/**
 * Merge function for one state field.
 *
 * <p>{@code current} is never null when called by the registry: an absent field is
 * replaced with {@link #emptyValue()} first.
 */
@FunctionalInterface
public interface Reducer {

    Object reduce(Object current, Object update);

    /**
     * Value a field takes before its first write.
     */
    default Object emptyValue() {
        return null;
    }
}
