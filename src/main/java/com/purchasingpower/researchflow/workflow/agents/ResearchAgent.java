package com.purchasingpower.researchflow.workflow.agents;

import com.purchasingpower.researchflow.agent.ToolRegistry;
import com.purchasingpower.researchflow.client.ModelClient;
import com.purchasingpower.researchflow.configuration.ResearchProperties;
import com.purchasingpower.researchflow.graph.Node;
import com.purchasingpower.researchflow.graph.NodeContext;
import com.purchasingpower.researchflow.graph.NodeResult;
import com.purchasingpower.researchflow.graph.state.SessionState;
import com.purchasingpower.researchflow.service.PromptLibraryService;
import com.purchasingpower.researchflow.workflow.state.Message;
import com.purchasingpower.researchflow.workflow.state.MessageRole;
import com.purchasingpower.researchflow.workflow.state.MessageWindow;
import com.purchasingpower.researchflow.workflow.state.ResearchState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * "agent" node: one model call over the conversation so far.
 *
 * <p>A system prompt describing the current progress is prepended when the
 * history has none. Only the copy sent to the model is windowed; the prompt is
 * not stored in the state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResearchAgent implements Node {

    public static final String NAME = "agent";

    private final ModelClient modelClient;
    private final ToolRegistry toolRegistry;
    private final PromptLibraryService promptLibrary;
    private final ResearchProperties properties;

    @Override
    public NodeResult execute(SessionState sessionState, NodeContext context) {
        ResearchState state = new ResearchState(sessionState);
        log.info("🤖 Research agent thinking: thread={}, query={}", context.getThreadId(), state.getResearchQuery());

        List<Message> history = new ArrayList<>(state.getMessages());
        boolean hasSystemPrompt = history.stream().anyMatch(message -> message.getRole() == MessageRole.SYSTEM);
        if (!hasSystemPrompt) {
            history.add(0, Message.system(promptLibrary.render("research-agent", Map.of(
                    "progress", String.join(", ", state.getResearchProgress()),
                    "sources", String.join(", ", state.getSourcesFound())))));
        }

        List<Message> window = MessageWindow.apply(history, properties.getMaxHistoryMessages() + 1);
        if (window.size() < history.size()) {
            log.debug("History windowed for model call: {} of {} messages", window.size(), history.size());
        }

        Message response = modelClient.complete(window, toolRegistry.getTools());
        if (response == null) {
            throw new IllegalStateException("Model returned no message");
        }
        if (response.hasPendingToolCalls()) {
            log.info("🤖 Agent requested {} tool call(s)", response.getToolCalls().size());
        }

        Map<String, Object> update = new LinkedHashMap<>();
        update.put(ResearchState.MESSAGES, List.of(response));
        update.put(ResearchState.RESEARCH_QUERY, state.getResearchQueryOrDefault());
        update.put(ResearchState.RESEARCH_PROGRESS, List.of("Agent response generated"));
        return NodeResult.update(update);
    }
}
