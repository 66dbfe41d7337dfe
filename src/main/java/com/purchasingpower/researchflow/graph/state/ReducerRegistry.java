package com.purchasingpower.researchflow.graph.state;

import com.purchasingpower.researchflow.exception.GraphDefinitionException;
import com.purchasingpower.researchflow.exception.UnknownFieldException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-field merge functions. Every state field has exactly one reducer.
 */
public class ReducerRegistry {

    private final Map<String, Reducer> reducers = new LinkedHashMap<>();

    public ReducerRegistry() {
    }

    public ReducerRegistry(ReducerRegistry other) {
        reducers.putAll(other.reducers);
    }

    public ReducerRegistry register(String field, Reducer reducer) {
        if (field == null || field.isBlank()) {
            throw new GraphDefinitionException("State field name must not be blank");
        }
        if (reducer == null) {
            throw new GraphDefinitionException("Reducer for field '" + field + "' must not be null");
        }
        if (reducers.putIfAbsent(field, reducer) != null) {
            throw new GraphDefinitionException("Field '" + field + "' already has a reducer");
        }
        return this;
    }

    public Set<String> fields() {
        return Collections.unmodifiableSet(reducers.keySet());
    }

    /**
     * State with every registered field at its empty value.
     */
    public SessionState initialState() {
        Map<String, Object> data = new LinkedHashMap<>();
        reducers.forEach((field, reducer) -> data.put(field, reducer.emptyValue()));
        return new SessionState(data);
    }

    /**
     * Merges a partial update into the state.
     *
     * <p>All fields are checked before any reducer runs, so an update naming an
     * unregistered field is rejected as a whole.
     *
     * @throws UnknownFieldException if the update touches a field with no reducer
     */
    public SessionState apply(SessionState state, Map<String, Object> update) {
        for (String field : update.keySet()) {
            if (!reducers.containsKey(field)) {
                throw new UnknownFieldException(field);
            }
        }

        Map<String, Object> merged = new LinkedHashMap<>(state.toMap());
        update.forEach((field, value) -> {
            Reducer reducer = reducers.get(field);
            Object current = merged.get(field);
            if (current == null) {
                current = reducer.emptyValue();
            }
            merged.put(field, reducer.reduce(current, value));
        });
        return new SessionState(merged);
    }
}
