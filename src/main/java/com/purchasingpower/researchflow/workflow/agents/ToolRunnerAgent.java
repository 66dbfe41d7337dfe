package com.purchasingpower.researchflow.workflow.agents;

import com.purchasingpower.researchflow.agent.ToolCallExecutor;
import com.purchasingpower.researchflow.graph.Node;
import com.purchasingpower.researchflow.graph.NodeContext;
import com.purchasingpower.researchflow.graph.NodeResult;
import com.purchasingpower.researchflow.graph.state.SessionState;
import com.purchasingpower.researchflow.workflow.state.Message;
import com.purchasingpower.researchflow.workflow.state.ResearchState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * "tools" node: executes the pending tool calls of the last assistant message.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolRunnerAgent implements Node {

    public static final String NAME = "tools";

    private final ToolCallExecutor toolCallExecutor;

    @Override
    public NodeResult execute(SessionState sessionState, NodeContext context) {
        ResearchState state = new ResearchState(sessionState);
        Message last = state.getLastMessage();

        if (last == null || !last.hasPendingToolCalls()) {
            log.info("🔧 No pending tool calls: thread={}", context.getThreadId());
            return NodeResult.update(Map.of(ResearchState.RESEARCH_PROGRESS, List.of("No pending tool calls")));
        }

        ToolCallExecutor.Outcome outcome = toolCallExecutor.execute(last.getToolCalls());

        List<String> known = state.getSourcesFound();
        List<String> newSources = outcome.sources().stream()
                .filter(source -> !known.contains(source))
                .collect(Collectors.toList());

        Map<String, Object> update = new LinkedHashMap<>();
        update.put(ResearchState.MESSAGES, outcome.messages());
        update.put(ResearchState.SOURCES_FOUND, newSources);
        update.put(ResearchState.RESEARCH_PROGRESS, outcome.progress());
        return NodeResult.update(update);
    }
}
