package com.purchasingpower.researchflow.graph.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON conversions for state values.
 *
 * <p>Node updates are normalized to plain JSON structures before they are merged,
 * which keeps in-memory state identical to what a store reads back.
 */
public class StateCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public StateCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        return objectMapper.convertValue(value, Object.class);
    }

    /**
     * Normalizes each value of a partial update, keeping field order and null values.
     */
    public Map<String, Object> normalize(Map<String, Object> update) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (update != null) {
            update.forEach((field, value) -> normalized.put(field, normalize(value)));
        }
        return normalized;
    }

    public String writeState(SessionState state) {
        return write(state.toMap());
    }

    public SessionState readState(String json) {
        return new SessionState(readMap(json));
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize state value", e);
        }
    }

    public <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    public Map<String, Object> readMap(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize state snapshot", e);
        }
    }
}
