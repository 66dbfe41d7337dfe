package com.purchasingpower.researchflow.graph;

import com.purchasingpower.researchflow.exception.GraphDefinitionException;
import com.purchasingpower.researchflow.graph.state.Reducer;
import com.purchasingpower.researchflow.graph.state.ReducerRegistry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable builder for a {@link GraphDefinition}.
 *
 * <pre>
 * GraphDefinition graph = new StateGraph()
 *         .reducer("messages", Reducers.appendSequence())
 *         .addNode("agent", agent)
 *         .addNode("tools", tools)
 *         .addEdge(StateGraph.START, "agent")
 *         .addConditionalEdges("agent", router, Map.of("tools", "tools", "done", StateGraph.END))
 *         .addEdge("tools", "agent")
 *         .compile();
 * </pre>
 */
public class StateGraph {

    public static final String START = "__start__";
    public static final String END = "__end__";

    private final ReducerRegistry reducers = new ReducerRegistry();
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Edge> edges = new LinkedHashMap<>();
    private String entryNode;

    public StateGraph reducer(String field, Reducer reducer) {
        reducers.register(field, reducer);
        return this;
    }

    public StateGraph addNode(String name, Node node) {
        if (name == null || name.isBlank()) {
            throw new GraphDefinitionException("Node name must not be blank");
        }
        if (START.equals(name) || END.equals(name)) {
            throw new GraphDefinitionException("Node name '" + name + "' is reserved");
        }
        if (node == null) {
            throw new GraphDefinitionException("Node '" + name + "' must not be null");
        }
        if (nodes.putIfAbsent(name, node) != null) {
            throw new GraphDefinitionException("Node '" + name + "' is already defined");
        }
        return this;
    }

    public StateGraph addEdge(String from, String to) {
        if (START.equals(from)) {
            if (entryNode != null) {
                throw new GraphDefinitionException("Entry point already set to '" + entryNode + "'");
            }
            entryNode = to;
            return this;
        }
        putEdge(Edge.direct(from, to));
        return this;
    }

    public StateGraph addConditionalEdges(String from, RoutingFunction router, Map<String, String> labels) {
        if (router == null) {
            throw new GraphDefinitionException("Router of node '" + from + "' must not be null");
        }
        if (labels == null || labels.isEmpty()) {
            throw new GraphDefinitionException("Conditional edges of node '" + from + "' need at least one label");
        }
        putEdge(Edge.conditional(from, router, labels));
        return this;
    }

    /**
     * Validates the graph and freezes it.
     *
     * @throws GraphDefinitionException if the entry point is missing, an edge points at an
     *                                  unknown node, or a node has no outgoing edge
     */
    public GraphDefinition compile() {
        if (entryNode == null) {
            throw new GraphDefinitionException("Missing entry point: add an edge from START");
        }
        if (!nodes.containsKey(entryNode)) {
            throw new GraphDefinitionException("Entry point '" + entryNode + "' is not a node");
        }
        for (Edge edge : edges.values()) {
            if (!nodes.containsKey(edge.getFrom())) {
                throw new GraphDefinitionException("Edge starts at unknown node '" + edge.getFrom() + "'");
            }
            for (String target : edge.targets()) {
                if (!END.equals(target) && !nodes.containsKey(target)) {
                    throw new GraphDefinitionException(
                            "Edge from '" + edge.getFrom() + "' points at unknown node '" + target + "'");
                }
            }
        }
        for (String name : nodes.keySet()) {
            if (!edges.containsKey(name)) {
                throw new GraphDefinitionException("Node '" + name + "' has no outgoing edge");
            }
        }
        return new GraphDefinition(entryNode, nodes, edges, new ReducerRegistry(reducers));
    }

    private void putEdge(Edge edge) {
        if (END.equals(edge.getFrom())) {
            throw new GraphDefinitionException("END cannot have outgoing edges");
        }
        if (edges.putIfAbsent(edge.getFrom(), edge) != null) {
            throw new GraphDefinitionException("Node '" + edge.getFrom() + "' already has an outgoing edge");
        }
    }
}
