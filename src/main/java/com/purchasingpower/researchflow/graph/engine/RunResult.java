package com.purchasingpower.researchflow.graph.engine;

import com.purchasingpower.researchflow.exception.ErrorType;
import com.purchasingpower.researchflow.graph.checkpoint.InterruptPayload;
import com.purchasingpower.researchflow.graph.state.SessionState;
import com.purchasingpower.researchflow.model.RunStatus;

/**
 * What a {@code run} or {@code resume} call returns to the caller.
 */
public interface RunResult {

    String threadId();

    long stepSequence();

    RunStatus status();

    /**
     * The run reached END.
     */
    record Completed(String threadId, long stepSequence, SessionState finalState) implements RunResult {

        @Override
        public RunStatus status() {
            return RunStatus.COMPLETED;
        }
    }

    /**
     * The run is paused until {@code resume} is called with a decision.
     */
    record Suspended(String threadId, long stepSequence, InterruptPayload interrupt, SessionState state)
            implements RunResult {

        @Override
        public RunStatus status() {
            return RunStatus.SUSPENDED;
        }
    }

    /**
     * The run aborted. {@code lastCompletedNode} is the last node whose update was merged.
     */
    record Failed(String threadId, long stepSequence, ErrorType errorType, String message,
                  String lastCompletedNode) implements RunResult {

        @Override
        public RunStatus status() {
            return RunStatus.FAILED;
        }
    }
}
