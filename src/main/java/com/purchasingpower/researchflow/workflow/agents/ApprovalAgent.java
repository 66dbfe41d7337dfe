package com.purchasingpower.researchflow.workflow.agents;

import com.purchasingpower.researchflow.agent.ToolCallExecutor;
import com.purchasingpower.researchflow.agent.tools.HumanApprovalTool;
import com.purchasingpower.researchflow.graph.Node;
import com.purchasingpower.researchflow.graph.NodeContext;
import com.purchasingpower.researchflow.graph.NodeResult;
import com.purchasingpower.researchflow.graph.state.SessionState;
import com.purchasingpower.researchflow.workflow.state.Message;
import com.purchasingpower.researchflow.workflow.state.ResearchState;
import com.purchasingpower.researchflow.workflow.state.ToolCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * "approval" node: asks a human before researching a sensitive topic.
 *
 * <p>First entry suspends the run with an {@code approval_request}. On resume the
 * node is invoked again with the decision and answers every pending call of the
 * last assistant message: approval calls report the decision, other calls run
 * only when approved.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApprovalAgent implements Node {

    public static final String NAME = "approval";
    public static final String REASON = "approval_request";

    private final ToolCallExecutor toolCallExecutor;

    @Override
    public NodeResult execute(SessionState sessionState, NodeContext context) {
        ResearchState state = new ResearchState(sessionState);
        Message last = state.getLastMessage();
        List<ToolCall> calls = last != null && last.hasPendingToolCalls() ? last.getToolCalls() : List.of();
        String topic = topicOf(calls, state.getResearchQueryOrDefault());

        if (!context.isResuming()) {
            log.info("✋ Approval required: thread={}, topic={}", context.getThreadId(), topic);
            Map<String, Object> request = new LinkedHashMap<>();
            request.put("type", REASON);
            request.put("topic", topic);
            request.put("message", "The topic '" + topic + "' requires human approval before proceeding with research.");
            return NodeResult.suspend(REASON, request);
        }

        boolean approved = isApproved(context.getDecision().orElse(Map.of()));
        log.info("✋ Approval {}: thread={}, topic={}", approved ? "granted" : "denied", context.getThreadId(), topic);

        List<Message> results = new ArrayList<>();
        List<String> sources = new ArrayList<>();
        List<String> progress = new ArrayList<>();
        progress.add("Approval requested");
        progress.add(approved ? "Approval granted" : "Approval denied");

        for (ToolCall call : calls) {
            if (HumanApprovalTool.NAME.equals(call.getName())) {
                String callTopic = call.stringArgument("topic", topic);
                results.add(Message.toolResult(call,
                        "Human approval " + (approved ? "granted" : "denied") + " for topic: " + callTopic));
            } else if (approved) {
                ToolCallExecutor.Outcome outcome = toolCallExecutor.execute(List.of(call));
                results.addAll(outcome.messages());
                outcome.sources().stream().filter(source -> !sources.contains(source)).forEach(sources::add);
                progress.addAll(outcome.progress());
            } else {
                results.add(Message.toolResult(call, "Not executed: human approval denied for topic: " + topic));
            }
        }

        List<String> known = state.getSourcesFound();
        sources.removeIf(known::contains);

        Map<String, Object> update = new LinkedHashMap<>();
        update.put(ResearchState.MESSAGES, results);
        update.put(ResearchState.SOURCES_FOUND, sources);
        update.put(ResearchState.REQUIRES_APPROVAL, true);
        update.put(ResearchState.APPROVED_BY_HUMAN, approved);
        update.put(ResearchState.RESEARCH_PROGRESS, progress);
        return NodeResult.update(update);
    }

    private static String topicOf(List<ToolCall> calls, String fallback) {
        return calls.stream()
                .filter(call -> HumanApprovalTool.NAME.equals(call.getName()))
                .map(call -> call.stringArgument("topic", null))
                .filter(topic -> topic != null && !topic.isBlank())
                .findFirst()
                .orElse(fallback);
    }

    private static boolean isApproved(Map<String, Object> decision) {
        Object approved = decision.get("approved");
        if (approved instanceof Boolean) {
            return (Boolean) approved;
        }
        return approved != null && Boolean.parseBoolean(approved.toString());
    }
}
