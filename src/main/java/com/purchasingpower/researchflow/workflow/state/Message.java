package com.purchasingpower.researchflow.workflow.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Single message in the research conversation.
 *
 * <p>Assistant messages may carry pending tool calls; tool-result messages
 * reference the call they answer through {@code toolCallId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Message {

    private MessageRole role;

    private String content;

    @Builder.Default
    private List<ToolCall> toolCalls = new ArrayList<>();

    /**
     * Only set on tool-result messages.
     */
    private String toolCallId;

    /**
     * Only set on tool-result messages.
     */
    private String toolName;

    public static Message system(String content) {
        return Message.builder().role(MessageRole.SYSTEM).content(content).build();
    }

    public static Message human(String content) {
        return Message.builder().role(MessageRole.HUMAN).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(MessageRole.ASSISTANT).content(content).build();
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return Message.builder()
                .role(MessageRole.ASSISTANT)
                .content(content)
                .toolCalls(new ArrayList<>(toolCalls))
                .build();
    }

    public static Message toolResult(ToolCall call, String content) {
        return Message.builder()
                .role(MessageRole.TOOL_RESULT)
                .content(content)
                .toolCallId(call.getId())
                .toolName(call.getName())
                .build();
    }

    @JsonIgnore
    public boolean hasPendingToolCalls() {
        return role == MessageRole.ASSISTANT && toolCalls != null && !toolCalls.isEmpty();
    }

    @JsonIgnore
    public boolean requestsTool(String toolName) {
        return hasPendingToolCalls() && toolCalls.stream().anyMatch(call -> toolName.equals(call.getName()));
    }
}
