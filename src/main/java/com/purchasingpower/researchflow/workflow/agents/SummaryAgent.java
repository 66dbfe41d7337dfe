package com.purchasingpower.researchflow.workflow.agents;

import com.purchasingpower.researchflow.client.ModelClient;
import com.purchasingpower.researchflow.configuration.ResearchProperties;
import com.purchasingpower.researchflow.graph.Node;
import com.purchasingpower.researchflow.graph.NodeContext;
import com.purchasingpower.researchflow.graph.NodeResult;
import com.purchasingpower.researchflow.graph.state.SessionState;
import com.purchasingpower.researchflow.service.PromptLibraryService;
import com.purchasingpower.researchflow.workflow.state.Message;
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
 * "summarize" node: asks the model for a final write-up of the research.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SummaryAgent implements Node {

    public static final String NAME = "summarize";

    private final ModelClient modelClient;
    private final PromptLibraryService promptLibrary;
    private final ResearchProperties properties;

    @Override
    public NodeResult execute(SessionState sessionState, NodeContext context) {
        ResearchState state = new ResearchState(sessionState);
        log.info("📝 Summarizing research: thread={}, query={}", context.getThreadId(), state.getResearchQuery());

        String prompt = promptLibrary.render("research-summary", Map.of(
                "query", state.getResearchQuery() != null ? state.getResearchQuery() : "Not specified",
                "progress", String.join(", ", state.getResearchProgress()),
                "sources", String.join(", ", state.getSourcesFound())));

        List<Message> history = new ArrayList<>(state.getMessages());
        history.add(Message.human(prompt));

        Message response = modelClient.complete(MessageWindow.apply(history, properties.getMaxHistoryMessages()));
        if (response == null) {
            throw new IllegalStateException("Model returned no summary");
        }

        String summary = response.getContent();
        if (summary == null || summary.isBlank()) {
            log.warn("⚠️ Model returned an empty summary: thread={}", context.getThreadId());
            summary = "No summary available for: " + state.getResearchQueryOrDefault();
        }

        Map<String, Object> update = new LinkedHashMap<>();
        update.put(ResearchState.MESSAGES, List.of(Message.assistant(summary)));
        update.put(ResearchState.SUMMARY, summary);
        update.put(ResearchState.RESEARCH_PROGRESS, List.of("Research summarized"));
        return NodeResult.update(update);
    }
}
