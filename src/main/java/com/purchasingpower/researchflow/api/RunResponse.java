package com.purchasingpower.researchflow.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.researchflow.exception.ErrorType;
import com.purchasingpower.researchflow.graph.checkpoint.Checkpoint;
import com.purchasingpower.researchflow.graph.checkpoint.InterruptPayload;
import com.purchasingpower.researchflow.graph.engine.RunResult;
import com.purchasingpower.researchflow.graph.state.SessionState;
import com.purchasingpower.researchflow.model.RunStatus;
import com.purchasingpower.researchflow.workflow.state.Message;
import com.purchasingpower.researchflow.workflow.state.ResearchState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response of the research endpoints: the outcome of a run, resume or lookup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunResponse {

    private boolean success;
    private String threadId;
    private RunStatus status;
    private Long stepSequence;

    /**
     * Human-readable note, e.g. for async submissions.
     */
    private String message;

    /**
     * Set when the run is suspended: reason, suspending node and payload.
     */
    private InterruptPayload interrupt;

    private String researchQuery;
    private String summary;
    private String lastMessage;
    private List<String> progress;
    private List<String> sources;

    private String nextNode;
    private String lastCompletedNode;
    private ErrorType errorType;
    private String error;

    public static RunResponse from(RunResult result) {
        RunResponse.RunResponseBuilder response = RunResponse.builder()
                .success(!(result instanceof RunResult.Failed))
                .threadId(result.threadId())
                .status(result.status())
                .stepSequence(result.stepSequence());

        if (result instanceof RunResult.Completed completed) {
            withState(response, completed.finalState());
        } else if (result instanceof RunResult.Suspended suspended) {
            withState(response, suspended.state());
            response.interrupt(suspended.interrupt()).nextNode(suspended.interrupt().getNode());
        } else if (result instanceof RunResult.Failed failed) {
            response.errorType(failed.errorType())
                    .error(failed.message())
                    .lastCompletedNode(failed.lastCompletedNode());
        }
        return response.build();
    }

    public static RunResponse from(Checkpoint checkpoint) {
        RunResponse.RunResponseBuilder response = RunResponse.builder()
                .success(true)
                .threadId(checkpoint.getThreadId())
                .status(checkpoint.getStatus())
                .stepSequence(checkpoint.getStepSequence())
                .interrupt(checkpoint.getPendingInterrupt())
                .nextNode(checkpoint.getNextNode())
                .lastCompletedNode(checkpoint.getLastCompletedNode());
        withState(response, checkpoint.getState());
        if (checkpoint.getError() != null) {
            response.errorType(checkpoint.getError().getType()).error(checkpoint.getError().getMessage());
        }
        return response.build();
    }

    public static RunResponse accepted(String threadId, String message) {
        return RunResponse.builder()
                .success(true)
                .threadId(threadId)
                .status(RunStatus.RUNNING)
                .message(message)
                .build();
    }

    public static RunResponse error(String threadId, ErrorType errorType, String error) {
        return RunResponse.builder()
                .success(false)
                .threadId(threadId)
                .errorType(errorType)
                .error(error)
                .build();
    }

    private static void withState(RunResponse.RunResponseBuilder response, SessionState sessionState) {
        if (sessionState == null) {
            return;
        }
        ResearchState state = new ResearchState(sessionState);
        Message last = state.getLastMessage();
        response.researchQuery(state.getResearchQuery())
                .summary(state.getSummary())
                .lastMessage(last != null ? last.getContent() : null)
                .progress(state.getResearchProgress())
                .sources(state.getSourcesFound());
    }
}
