package com.purchasingpower.researchflow.graph;

import com.purchasingpower.researchflow.graph.checkpoint.InterruptPayload;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Invocation metadata handed to a node next to the state.
 */
@Value
@Builder
public class NodeContext {

    String threadId;

    String nodeName;

    /**
     * Sequence number of the last persisted checkpoint for the thread.
     */
    long stepSequence;

    /**
     * Interrupt this invocation resumes from, or null for a regular step.
     */
    InterruptPayload resumedFrom;

    /**
     * Decision supplied by the caller on resume, or null for a regular step.
     */
    Map<String, Object> decision;

    public boolean isResuming() {
        return decision != null;
    }

    public Optional<Map<String, Object>> getDecision() {
        return Optional.ofNullable(decision);
    }
}
