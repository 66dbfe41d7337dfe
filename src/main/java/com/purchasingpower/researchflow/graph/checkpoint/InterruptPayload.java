package com.purchasingpower.researchflow.graph.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Data a suspended node hands to the caller, plus the node to re-enter on resume.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterruptPayload {

    /**
     * Reason recorded when a run is cancelled between supersteps.
     */
    public static final String REASON_CANCELLED = "cancelled";

    /**
     * Node that suspended (or, for a cancellation, the node that would have run next).
     */
    private String node;

    /**
     * Why the run stopped, e.g. "approval_request".
     */
    private String reason;

    /**
     * Opaque payload produced by the node (topic, message, ...).
     */
    private Map<String, Object> data;

    @JsonIgnore
    public boolean isCancellation() {
        return REASON_CANCELLED.equals(reason);
    }
}
