package com.purchasingpower.researchflow.support;

import com.purchasingpower.researchflow.agent.ToolCallExecutor;
import com.purchasingpower.researchflow.agent.ToolRegistry;
import com.purchasingpower.researchflow.agent.tools.CalculateStatsTool;
import com.purchasingpower.researchflow.agent.tools.DocumentLookupTool;
import com.purchasingpower.researchflow.agent.tools.HumanApprovalTool;
import com.purchasingpower.researchflow.agent.tools.WebSearchTool;
import com.purchasingpower.researchflow.client.ModelClient;
import com.purchasingpower.researchflow.configuration.ResearchProperties;
import com.purchasingpower.researchflow.service.PromptLibraryService;
import com.purchasingpower.researchflow.workflow.ResearchWorkflow;
import com.purchasingpower.researchflow.workflow.agents.ApprovalAgent;
import com.purchasingpower.researchflow.workflow.agents.ResearchAgent;
import com.purchasingpower.researchflow.workflow.agents.SummaryAgent;
import com.purchasingpower.researchflow.workflow.agents.ToolRunnerAgent;

import java.util.List;

/**
 * Wires the research graph by hand, without a Spring context.
 */
public final class ResearchFixtures {

    public static final String CLIMATE_TEXT = "Recent studies show accelerating ice loss in polar regions.";
    public static final String DOC_001_TEXT = "Internal research on renewable energy adoption rates: 45% increase in 2024";

    private ResearchFixtures() {
    }

    public static ResearchProperties properties() {
        ResearchProperties properties = new ResearchProperties();
        properties.setProgressThreshold(3);
        properties.setMaxSupersteps(25);
        properties.setMaxHistoryMessages(40);
        properties.setSearchResults(List.of(
                new ResearchProperties.SearchResult("climate change", CLIMATE_TEXT),
                new ResearchProperties.SearchResult("elections", "Turnout reached record levels in several regions.")));
        properties.setDocuments(List.of(
                new ResearchProperties.Document("DOC-001", DOC_001_TEXT)));
        return properties;
    }

    public static ToolRegistry toolRegistry(ResearchProperties properties) {
        return new ToolRegistry(List.of(
                new WebSearchTool(properties),
                new DocumentLookupTool(properties),
                new CalculateStatsTool(),
                new HumanApprovalTool()));
    }

    public static PromptLibraryService promptLibrary() {
        PromptLibraryService library = new PromptLibraryService();
        library.loadPrompts();
        return library;
    }

    public static ResearchWorkflow workflow(ModelClient modelClient, ResearchProperties properties) {
        ToolRegistry registry = toolRegistry(properties);
        ToolCallExecutor executor = new ToolCallExecutor(registry);
        PromptLibraryService prompts = promptLibrary();

        ResearchWorkflow workflow = new ResearchWorkflow(
                new ResearchAgent(modelClient, registry, prompts, properties),
                new ToolRunnerAgent(executor),
                new ApprovalAgent(executor),
                new SummaryAgent(modelClient, prompts, properties),
                properties);
        workflow.initialize();
        return workflow;
    }
}
