package com.purchasingpower.researchflow.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a node invocation: either a partial state update or a request to
 * suspend the run until an external decision arrives.
 */
public interface NodeResult {

    static NodeResult update(Map<String, Object> fields) {
        return new Update(fields);
    }

    static NodeResult suspend(String reason, Map<String, Object> data) {
        return new Suspend(reason, data);
    }

    /**
     * Partial update touching a subset of state fields.
     */
    record Update(Map<String, Object> fields) implements NodeResult {

        public Update {
            fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }
    }

    /**
     * Suspension request. Nothing from the invocation is merged.
     */
    record Suspend(String reason, Map<String, Object> data) implements NodeResult {

        public Suspend {
            data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }
    }
}
