package com.purchasingpower.researchflow.graph.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, ordered snapshot of a thread's state.
 *
 * <p>Nodes receive a SessionState as a read-only view; every merge produces a new
 * instance through {@link ReducerRegistry#apply(SessionState, Map)}. Values held
 * by the engine are JSON-compatible (maps, lists, strings, numbers, booleans, null)
 * so a snapshot survives a round trip through the checkpoint store unchanged.
 */
public final class SessionState {

    private static final SessionState EMPTY = new SessionState(Map.of());

    private final Map<String, Object> data;

    public SessionState(Map<String, Object> data) {
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static SessionState empty() {
        return EMPTY;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> value(String field) {
        return Optional.ofNullable((T) data.get(field));
    }

    public boolean has(String field) {
        return data.containsKey(field);
    }

    public Set<String> fields() {
        return data.keySet();
    }

    public Map<String, Object> toMap() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SessionState)) {
            return false;
        }
        return data.equals(((SessionState) o).data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(data);
    }

    @Override
    public String toString() {
        return "SessionState" + data;
    }
}
