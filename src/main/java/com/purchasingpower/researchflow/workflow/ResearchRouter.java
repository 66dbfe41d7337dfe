package com.purchasingpower.researchflow.workflow;

import com.purchasingpower.researchflow.agent.tools.HumanApprovalTool;
import com.purchasingpower.researchflow.graph.RoutingFunction;
import com.purchasingpower.researchflow.graph.state.SessionState;
import com.purchasingpower.researchflow.workflow.state.Message;
import com.purchasingpower.researchflow.workflow.state.ResearchState;

/**
 * Decides where the run goes after the agent node. A pure function of the state.
 *
 * <ul>
 *   <li>last message requests human approval → {@value #APPROVAL}</li>
 *   <li>last message requests any other tool → {@value #TOOLS}</li>
 *   <li>no tool calls and progress beyond the threshold → {@value #SUMMARIZE}</li>
 *   <li>otherwise → {@value #TOOLS}</li>
 * </ul>
 */
public class ResearchRouter implements RoutingFunction {

    public static final String TOOLS = "tools";
    public static final String APPROVAL = "approval";
    public static final String SUMMARIZE = "summarize";

    private final int progressThreshold;

    public ResearchRouter(int progressThreshold) {
        this.progressThreshold = progressThreshold;
    }

    @Override
    public String route(SessionState sessionState) {
        ResearchState state = new ResearchState(sessionState);
        Message last = state.getLastMessage();

        if (last != null && last.hasPendingToolCalls()) {
            return last.requestsTool(HumanApprovalTool.NAME) ? APPROVAL : TOOLS;
        }
        if (state.getResearchProgress().size() > progressThreshold) {
            return SUMMARIZE;
        }
        return TOOLS;
    }
}
