package com.purchasingpower.researchflow.graph.engine;

import com.purchasingpower.researchflow.graph.checkpoint.CheckpointError;
import com.purchasingpower.researchflow.graph.checkpoint.InterruptPayload;
import com.purchasingpower.researchflow.graph.state.SessionState;
import com.purchasingpower.researchflow.model.RunStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Emitted once per persisted checkpoint.
 */
@Value
@Builder
public class StepEvent {

    String threadId;

    long stepSequence;

    RunStatus status;

    /**
     * Node that just ran.
     */
    String node;

    /**
     * Node scheduled next; for a suspended run the node a resume re-enters.
     * Null once the run completed or failed.
     */
    String nextNode;

    SessionState state;

    InterruptPayload interrupt;

    CheckpointError error;
}
