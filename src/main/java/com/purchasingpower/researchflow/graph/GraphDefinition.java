package com.purchasingpower.researchflow.graph;

import com.purchasingpower.researchflow.graph.state.ReducerRegistry;
import com.purchasingpower.researchflow.graph.state.SessionState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, validated graph: nodes, one outgoing edge per node, and the state's reducers.
 * Built once through {@link StateGraph#compile()} and shared by all threads.
 */
public final class GraphDefinition {

    private final String entryNode;
    private final Map<String, Node> nodes;
    private final Map<String, Edge> edges;
    private final ReducerRegistry reducers;

    GraphDefinition(String entryNode, Map<String, Node> nodes, Map<String, Edge> edges, ReducerRegistry reducers) {
        this.entryNode = entryNode;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));
        this.reducers = reducers;
    }

    public String getEntryNode() {
        return entryNode;
    }

    public Set<String> getNodeNames() {
        return nodes.keySet();
    }

    public boolean hasNode(String name) {
        return nodes.containsKey(name);
    }

    public Optional<Node> node(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    public SessionState initialState() {
        return reducers.initialState();
    }

    public SessionState merge(SessionState state, Map<String, Object> update) {
        return reducers.apply(state, update);
    }

    /**
     * Successor of {@code from} for the post-merge state; {@link StateGraph#END} terminates the run.
     */
    public String next(String from, SessionState state) {
        return edges.get(from).next(state);
    }
}
