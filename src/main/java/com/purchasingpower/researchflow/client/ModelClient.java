package com.purchasingpower.researchflow.client;

import com.purchasingpower.researchflow.agent.Tool;
import com.purchasingpower.researchflow.workflow.state.Message;

import java.util.List;

/**
 * Chat model used by the research graph.
 *
 * <p>Implementations are synchronous. The returned assistant message may carry
 * pending tool calls for any of the offered tools.
 */
public interface ModelClient {

    Message complete(List<Message> history, List<Tool> tools);

    default Message complete(List<Message> history) {
        return complete(history, List.of());
    }
}
