package com.purchasingpower.researchflow.graph;

import com.purchasingpower.researchflow.exception.GraphDefinitionException;
import com.purchasingpower.researchflow.exception.UnknownRoutingLabelException;
import com.purchasingpower.researchflow.graph.state.Reducers;
import com.purchasingpower.researchflow.graph.state.SessionState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateGraphTest {

    private static final Node NOOP = (state, context) -> NodeResult.update(Map.of());

    @Test
    @DisplayName("compiles a valid graph and exposes its nodes")
    void compilesValidGraph() {
        GraphDefinition graph = new StateGraph()
                .reducer("log", Reducers.appendSequence())
                .addNode("a", NOOP)
                .addNode("b", NOOP)
                .addEdge(StateGraph.START, "a")
                .addConditionalEdges("a", state -> "next", Map.of("next", "b", "stop", StateGraph.END))
                .addEdge("b", StateGraph.END)
                .compile();

        assertThat(graph.getEntryNode()).isEqualTo("a");
        assertThat(graph.getNodeNames()).containsExactly("a", "b");
        assertThat(graph.initialState().toMap()).containsEntry("log", List.of());
        assertThat(graph.next("a", graph.initialState())).isEqualTo("b");
        assertThat(graph.next("b", graph.initialState())).isEqualTo(StateGraph.END);
    }

    @Test
    @DisplayName("requires an entry point")
    void missingEntry() {
        StateGraph builder = new StateGraph().addNode("a", NOOP).addEdge("a", StateGraph.END);

        assertThatThrownBy(builder::compile)
                .isInstanceOf(GraphDefinitionException.class)
                .hasMessageContaining("entry");
    }

    @Test
    @DisplayName("rejects an edge to an unknown node")
    void danglingTarget() {
        StateGraph builder = new StateGraph()
                .addNode("a", NOOP)
                .addEdge(StateGraph.START, "a")
                .addConditionalEdges("a", state -> "x", Map.of("x", "ghost"));

        assertThatThrownBy(builder::compile)
                .isInstanceOf(GraphDefinitionException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    @DisplayName("rejects a node without an outgoing edge")
    void nodeWithoutEdge() {
        StateGraph builder = new StateGraph()
                .addNode("a", NOOP)
                .addNode("b", NOOP)
                .addEdge(StateGraph.START, "a")
                .addEdge("a", StateGraph.END);

        assertThatThrownBy(builder::compile)
                .isInstanceOf(GraphDefinitionException.class)
                .hasMessageContaining("'b'");
    }

    @Test
    @DisplayName("rejects duplicate and reserved node names")
    void duplicateAndReservedNames() {
        StateGraph builder = new StateGraph().addNode("a", NOOP);

        assertThatThrownBy(() -> builder.addNode("a", NOOP)).isInstanceOf(GraphDefinitionException.class);
        assertThatThrownBy(() -> builder.addNode(StateGraph.END, NOOP)).isInstanceOf(GraphDefinitionException.class);
    }

    @Test
    @DisplayName("an unmapped routing label always raises UnknownRoutingLabelException")
    void unmappedLabel() {
        GraphDefinition graph = new StateGraph()
                .addNode("a", NOOP)
                .addEdge(StateGraph.START, "a")
                .addConditionalEdges("a", state -> "nowhere", Map.of("done", StateGraph.END))
                .compile();
        SessionState state = graph.initialState();

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> graph.next("a", state))
                    .isInstanceOf(UnknownRoutingLabelException.class)
                    .hasMessageContaining("nowhere");
        }
    }
}
