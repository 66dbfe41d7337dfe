package com.purchasingpower.researchflow.workflow;

import com.purchasingpower.researchflow.configuration.ResearchProperties;
import com.purchasingpower.researchflow.graph.GraphDefinition;
import com.purchasingpower.researchflow.graph.StateGraph;
import com.purchasingpower.researchflow.workflow.agents.ApprovalAgent;
import com.purchasingpower.researchflow.workflow.agents.ResearchAgent;
import com.purchasingpower.researchflow.workflow.agents.SummaryAgent;
import com.purchasingpower.researchflow.workflow.agents.ToolRunnerAgent;
import com.purchasingpower.researchflow.workflow.state.ResearchState;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.purchasingpower.researchflow.graph.StateGraph.END;
import static com.purchasingpower.researchflow.graph.StateGraph.START;

/**
 * The research assistant graph.
 *
 * <pre>
 * START → agent ─┬─ tools ─────→ agent
 *                ├─ approval ──→ agent
 *                └─ summarize ─→ END
 * </pre>
 */
@Slf4j
@Component
public class ResearchWorkflow {

    private final ResearchAgent researchAgent;
    private final ToolRunnerAgent toolRunner;
    private final ApprovalAgent approvalAgent;
    private final SummaryAgent summaryAgent;
    private final ResearchProperties properties;

    private GraphDefinition graph;

    public ResearchWorkflow(
            ResearchAgent researchAgent,
            ToolRunnerAgent toolRunner,
            ApprovalAgent approvalAgent,
            SummaryAgent summaryAgent,
            ResearchProperties properties
    ) {
        this.researchAgent = researchAgent;
        this.toolRunner = toolRunner;
        this.approvalAgent = approvalAgent;
        this.summaryAgent = summaryAgent;
        this.properties = properties;
    }

    @PostConstruct
    public void initialize() {
        log.info("🚀 Initializing research workflow graph...");

        StateGraph builder = ResearchState.registerReducers(new StateGraph());

        builder.addNode(ResearchAgent.NAME, researchAgent);
        builder.addNode(ToolRunnerAgent.NAME, toolRunner);
        builder.addNode(ApprovalAgent.NAME, approvalAgent);
        builder.addNode(SummaryAgent.NAME, summaryAgent);

        builder.addEdge(START, ResearchAgent.NAME);
        builder.addConditionalEdges(ResearchAgent.NAME,
                new ResearchRouter(properties.getProgressThreshold()),
                Map.of(
                        ResearchRouter.TOOLS, ToolRunnerAgent.NAME,
                        ResearchRouter.APPROVAL, ApprovalAgent.NAME,
                        ResearchRouter.SUMMARIZE, SummaryAgent.NAME));
        builder.addEdge(ToolRunnerAgent.NAME, ResearchAgent.NAME);
        builder.addEdge(ApprovalAgent.NAME, ResearchAgent.NAME);
        builder.addEdge(SummaryAgent.NAME, END);

        graph = builder.compile();
        log.info("✅ Research workflow compiled: nodes={}, progress threshold={}",
                graph.getNodeNames(), properties.getProgressThreshold());
    }

    public GraphDefinition getGraph() {
        return graph;
    }
}
