package com.purchasingpower.researchflow.graph;

import com.purchasingpower.researchflow.graph.state.SessionState;

/**
 * A named step of a graph.
 *
 * <p>Nodes are stateless across invocations. A node either returns a partial update
 * or asks the engine to suspend; it never mutates the state it is given. A node that
 * suspended is re-invoked from scratch on resume, with the same state and the
 * caller's decision available through {@link NodeContext#getDecision()}.
 */
@FunctionalInterface
public interface Node {

    NodeResult execute(SessionState state, NodeContext context);
}
