package com.purchasingpower.researchflow.graph;

import com.purchasingpower.researchflow.graph.state.SessionState;

/**
 * Picks a routing label from the post-merge state. Must be a pure function of the state.
 */
@FunctionalInterface
public interface RoutingFunction {

    String route(SessionState state);
}
