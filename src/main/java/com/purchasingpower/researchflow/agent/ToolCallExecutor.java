package com.purchasingpower.researchflow.agent;

import com.purchasingpower.researchflow.workflow.state.Message;
import com.purchasingpower.researchflow.workflow.state.ToolCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a batch of tool calls and collects what they contribute to the state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolCallExecutor {

    private final ToolRegistry toolRegistry;

    public Outcome execute(List<ToolCall> calls) {
        List<Message> messages = new ArrayList<>();
        List<String> sources = new ArrayList<>();
        List<String> progress = new ArrayList<>();

        for (ToolCall call : calls) {
            log.info("🔧 Executing tool: {} (call {})", call.getName(), call.getId());
            ToolResult result = toolRegistry.invoke(call.getName(), call.getArguments());

            messages.add(Message.toolResult(call, result.output()));
            if (result.success() && result.source() != null && !sources.contains(result.source())) {
                sources.add(result.source());
            }
            progress.add("Used tool: " + call.getName());
        }
        return new Outcome(messages, sources, progress);
    }

    /**
     * One tool-result message per call, in call order.
     */
    public record Outcome(List<Message> messages, List<String> sources, List<String> progress) {
    }
}
