package com.purchasingpower.researchflow.agent.tools;

import com.purchasingpower.researchflow.agent.Tool;
import com.purchasingpower.researchflow.agent.ToolResult;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Advertises human approval to the model. Calls to it are answered by the
 * approval node, which suspends the run; executing it directly is an error.
 */
@Component
public class HumanApprovalTool implements Tool {

    public static final String NAME = "request_human_approval";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Request human approval for sensitive research topics " +
               "(politics, controversies, personal information) before researching them.";
    }

    @Override
    public Map<String, String> getParameters() {
        return Map.of("topic", "the sensitive topic that needs approval");
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.CONTROL;
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments) {
        return ToolResult.failure("request_human_approval must be answered by a human decision");
    }
}
