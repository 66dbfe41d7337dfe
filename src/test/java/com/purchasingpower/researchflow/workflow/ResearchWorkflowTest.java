package com.purchasingpower.researchflow.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.purchasingpower.researchflow.agent.tools.CalculateStatsTool;
import com.purchasingpower.researchflow.agent.tools.DocumentLookupTool;
import com.purchasingpower.researchflow.agent.tools.HumanApprovalTool;
import com.purchasingpower.researchflow.agent.tools.WebSearchTool;
import com.purchasingpower.researchflow.configuration.ResearchProperties;
import com.purchasingpower.researchflow.graph.checkpoint.Checkpoint;
import com.purchasingpower.researchflow.graph.checkpoint.InMemoryCheckpointStore;
import com.purchasingpower.researchflow.graph.engine.GraphEngine;
import com.purchasingpower.researchflow.graph.engine.RunResult;
import com.purchasingpower.researchflow.graph.state.StateCodec;
import com.purchasingpower.researchflow.model.RunStatus;
import com.purchasingpower.researchflow.support.ResearchFixtures;
import com.purchasingpower.researchflow.support.ScriptedModelClient;
import com.purchasingpower.researchflow.workflow.agents.ApprovalAgent;
import com.purchasingpower.researchflow.workflow.state.Message;
import com.purchasingpower.researchflow.workflow.state.MessageRole;
import com.purchasingpower.researchflow.workflow.state.ResearchState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the research graph end to end with a scripted model.
 */
class ResearchWorkflowTest {

    private static final String THREAD = "research-1";

    private ScriptedModelClient model;
    private InMemoryCheckpointStore store;
    private GraphEngine engine;
    private ResearchWorkflow workflow;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        ResearchProperties properties = ResearchFixtures.properties();
        model = new ScriptedModelClient();
        store = new InMemoryCheckpointStore();
        engine = new GraphEngine(store, new StateCodec(mapper));
        workflow = ResearchFixtures.workflow(model, properties);
    }

    private RunResult start(String query) {
        return engine.run(workflow.getGraph(), THREAD, ResearchState.initialInput(query));
    }

    private ResearchState stored() {
        return new ResearchState(store.get(THREAD).orElseThrow().getState());
    }

    @Test
    @DisplayName("graph exposes the four research nodes")
    void graphShape() {
        assertThat(workflow.getGraph().getNodeNames())
                .containsExactlyInAnyOrder("agent", "tools", "approval", "summarize");
        assertThat(workflow.getGraph().getEntryNode()).isEqualTo("agent");
    }

    @Test
    @DisplayName("plain answers loop through tools until the progress threshold, then summarize")
    void plainAnswers() {
        // Given
        model.reply("Here is what I know about bees.")
                .reply("Nothing more to add.")
                .reply("Bees pollinate crops.");

        // When
        RunResult result = start("Tell me about bees");

        // Then
        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
        ResearchState state = stored();
        assertThat(state.getResearchProgress()).containsExactly(
                "Research started",
                "Agent response generated",
                "No pending tool calls",
                "Agent response generated",
                "Research summarized");
        assertThat(state.getSummary()).isEqualTo("Bees pollinate crops.");
        assertThat(state.getSourcesFound()).isEmpty();
        assertThat(state.getLastMessage().getContent()).isEqualTo("Bees pollinate crops.");
        assertThat(model.remaining()).isZero();
    }

    @Test
    @DisplayName("web search results are appended and recorded as a source")
    void webSearch() {
        // Given
        model.callTool("c1", WebSearchTool.NAME, Map.of("query", "latest climate change studies"))
                .reply("Polar ice is melting faster.")
                .reply("Summary: ice loss is accelerating.");

        // When
        RunResult result = start("Research climate change");

        // Then
        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
        ResearchState state = stored();
        assertThat(state.getSourcesFound()).containsExactly("web:climate change");
        assertThat(state.getResearchProgress()).containsSubsequence(
                "Agent response generated", "Used tool: web_search", "Agent response generated", "Research summarized");

        Message toolResult = state.getMessages().stream()
                .filter(message -> message.getRole() == MessageRole.TOOL_RESULT)
                .findFirst()
                .orElseThrow();
        assertThat(toolResult.getToolCallId()).isEqualTo("c1");
        assertThat(toolResult.getContent()).contains(ResearchFixtures.CLIMATE_TEXT);

        // the agent saw the tool result on its second call, with the tools offered
        assertThat(model.history(1)).extracting(Message::getRole).contains(MessageRole.TOOL_RESULT);
        assertThat(model.history(1).get(0).getRole()).isEqualTo(MessageRole.SYSTEM);
        assertThat(model.offeredTools(0)).contains(WebSearchTool.NAME, HumanApprovalTool.NAME);
        assertThat(model.offeredTools(2)).isEmpty();
    }

    @Test
    @DisplayName("a missing document is reported to the model, not raised")
    void missingDocument() {
        // Given
        model.callTool("c1", DocumentLookupTool.NAME, Map.of("document_id", "DOC-999"))
                .reply("That document does not exist.")
                .reply("No findings.");

        // When
        RunResult result = start("Check DOC-999");

        // Then
        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(stored().getMessages()).extracting(Message::getContent)
                .contains("Document DOC-999 not found in database");
        assertThat(stored().getSourcesFound()).isEmpty();
    }

    @Test
    @DisplayName("a calculation the evaluator rejects is reported to the model and the run completes")
    void rejectedCalculation() {
        // Given
        model.callTool("c1", CalculateStatsTool.NAME, Map.of("expression", "-".repeat(200_000) + "1"))
                .reply("The expression could not be evaluated.")
                .reply("No result.");

        // When
        RunResult result = start("Compute something odd");

        // Then
        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(store.get(THREAD).orElseThrow().getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(stored().getMessages()).extracting(Message::getContent)
                .anyMatch(content -> content != null && content.startsWith("Error in calculation: expression nested too deeply"));
    }

    @Test
    @DisplayName("a failing model call fails the run and keeps the last good state")
    void modelFailure() {
        // Given no scripted responses

        // When
        RunResult result = start("Anything");

        // Then
        assertThat(result).isInstanceOf(RunResult.Failed.class);
        RunResult.Failed failed = (RunResult.Failed) result;
        assertThat(failed.message()).contains("No scripted model response left");
        Checkpoint checkpoint = store.get(THREAD).orElseThrow();
        assertThat(checkpoint.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(new ResearchState(checkpoint.getState()).getResearchProgress())
                .containsExactly("Research started");
    }

    @Nested
    @DisplayName("Human approval")
    class HumanApproval {

        @BeforeEach
        void requestApproval() {
            model.callTool("c1", HumanApprovalTool.NAME, Map.of("topic", "elections"));
        }

        @Test
        @DisplayName("suspends at the approval node with the topic")
        void suspends() {
            // When
            RunResult result = start("Research the elections");

            // Then
            assertThat(result).isInstanceOf(RunResult.Suspended.class);
            RunResult.Suspended suspended = (RunResult.Suspended) result;
            assertThat(suspended.interrupt().getNode()).isEqualTo(ApprovalAgent.NAME);
            assertThat(suspended.interrupt().getReason()).isEqualTo(ApprovalAgent.REASON);
            assertThat(suspended.interrupt().getData())
                    .containsEntry("topic", "elections")
                    .containsEntry("message",
                            "The topic 'elections' requires human approval before proceeding with research.");
            assertThat(store.get(THREAD).orElseThrow().getStatus()).isEqualTo(RunStatus.SUSPENDED);
        }

        @Test
        @DisplayName("approved: research continues and completes with a summary")
        void approved() {
            // Given
            start("Research the elections");
            model.callTool("c2", WebSearchTool.NAME, Map.of("query", "elections 2024"))
                    .reply("Turnout was high.")
                    .reply("Summary: record turnout.");

            // When
            RunResult result = engine.resume(workflow.getGraph(), THREAD, Map.of("approved", true));

            // Then
            assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
            ResearchState state = stored();
            assertThat(state.isRequiresApproval()).isTrue();
            assertThat(state.isApprovedByHuman()).isTrue();
            assertThat(state.getSourcesFound()).containsExactly("web:elections");
            assertThat(state.getSummary()).isEqualTo("Summary: record turnout.");
            assertThat(state.getResearchProgress()).containsSubsequence(
                    "Approval requested", "Approval granted", "Used tool: web_search", "Research summarized");
            assertThat(state.getMessages()).extracting(Message::getContent)
                    .contains("Human approval granted for topic: elections");
        }

        @Test
        @DisplayName("denied: the agent is told and the run still completes")
        void denied() {
            // Given
            start("Research the elections");
            model.reply("I cannot research that topic.")
                    .reply("Summary: research declined.");

            // When
            RunResult result = engine.resume(workflow.getGraph(), THREAD, Map.of("approved", false));

            // Then
            assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
            ResearchState state = stored();
            assertThat(state.isApprovedByHuman()).isFalse();
            assertThat(state.getSourcesFound()).isEmpty();
            assertThat(state.getMessages()).extracting(Message::getContent)
                    .contains("Human approval denied for topic: elections");
            assertThat(state.getResearchProgress()).contains("Approval denied");
        }
    }
}
