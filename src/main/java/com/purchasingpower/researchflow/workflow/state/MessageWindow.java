package com.purchasingpower.researchflow.workflow.state;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounds the history handed to the model.
 *
 * <p>The leading system message is always kept. Of the rest only the last
 * {@code maxMessages} survive, and the window never opens on a tool result whose
 * assistant call was cut off. The session state itself is never truncated.
 */
public final class MessageWindow {

    private MessageWindow() {
    }

    public static List<Message> apply(List<Message> history, int maxMessages) {
        if (maxMessages < 1 || history.size() <= maxMessages) {
            return new ArrayList<>(history);
        }

        Message system = null;
        List<Message> rest = history;
        if (!history.isEmpty() && history.get(0).getRole() == MessageRole.SYSTEM) {
            system = history.get(0);
            rest = history.subList(1, history.size());
        }

        int budget = system != null ? maxMessages - 1 : maxMessages;
        int start = Math.max(0, rest.size() - Math.max(budget, 1));
        while (start < rest.size() && rest.get(start).getRole() == MessageRole.TOOL_RESULT) {
            start++;
        }

        List<Message> window = new ArrayList<>();
        if (system != null) {
            window.add(system);
        }
        window.addAll(rest.subList(start, rest.size()));
        return window;
    }
}
