package com.purchasingpower.researchflow.graph.checkpoint;

import com.purchasingpower.researchflow.graph.state.SessionState;
import com.purchasingpower.researchflow.model.RunStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Durable snapshot of one thread. A later checkpoint supersedes the earlier one.
 */
@Value
@Builder(toBuilder = true)
public class Checkpoint {

    String threadId;

    /**
     * Strictly increasing per thread.
     */
    long stepSequence;

    SessionState state;

    RunStatus status;

    /**
     * Last node whose update was merged, null before the first merge.
     */
    String lastCompletedNode;

    /**
     * Node to run next while RUNNING or SUSPENDED, null otherwise.
     */
    String nextNode;

    InterruptPayload pendingInterrupt;

    CheckpointError error;

    public boolean hasPendingInterrupt() {
        return pendingInterrupt != null;
    }
}
