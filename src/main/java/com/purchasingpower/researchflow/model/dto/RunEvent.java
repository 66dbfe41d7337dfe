package com.purchasingpower.researchflow.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.researchflow.graph.checkpoint.InterruptPayload;
import com.purchasingpower.researchflow.model.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Server-Sent Event payload describing one superstep of a research run.
 *
 * <pre>
 * RunEvent event = RunEvent.builder()
 *     .threadId("thread-1")
 *     .status(RunStatus.RUNNING)
 *     .node("agent")
 *     .nextNode("tools")
 *     .message("⚙️ agent finished, next: tools")
 *     .build();
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunEvent {

    private String threadId;

    private RunStatus status;

    private Long stepSequence;

    /**
     * Node that just ran.
     */
    private String node;

    private String nextNode;

    /**
     * Human-readable status line, e.g. "⏸️ Waiting for approval: approval_request".
     */
    private String message;

    /**
     * Research progress log after the step.
     */
    private List<String> progress;

    /**
     * Set when status = SUSPENDED.
     */
    private InterruptPayload interrupt;

    /**
     * Set when status = FAILED.
     */
    private String error;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public static RunEvent connected(String threadId) {
        return RunEvent.builder()
                .threadId(threadId)
                .message("🔗 Connected to research stream")
                .build();
    }
}
