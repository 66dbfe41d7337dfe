package com.purchasingpower.researchflow.graph;

import com.purchasingpower.researchflow.exception.UnknownRoutingLabelException;
import com.purchasingpower.researchflow.graph.state.SessionState;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outgoing edge of a node: either a fixed successor or a router whose label is
 * resolved against a static label-to-node mapping.
 */
public abstract class Edge {

    private final String from;

    protected Edge(String from) {
        this.from = from;
    }

    public String getFrom() {
        return from;
    }

    /**
     * Successor for the given post-merge state.
     *
     * @throws UnknownRoutingLabelException if a conditional router returns an unmapped label
     */
    public abstract String next(SessionState state);

    /**
     * Every node this edge can lead to.
     */
    public abstract Collection<String> targets();

    public static Edge direct(String from, String to) {
        return new Direct(from, to);
    }

    public static Edge conditional(String from, RoutingFunction router, Map<String, String> labels) {
        return new Conditional(from, router, labels);
    }

    static final class Direct extends Edge {

        private final String to;

        Direct(String from, String to) {
            super(from);
            this.to = to;
        }

        @Override
        public String next(SessionState state) {
            return to;
        }

        @Override
        public Collection<String> targets() {
            return List.of(to);
        }
    }

    static final class Conditional extends Edge {

        private final RoutingFunction router;
        private final Map<String, String> labels;

        Conditional(String from, RoutingFunction router, Map<String, String> labels) {
            super(from);
            this.router = router;
            this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        }

        @Override
        public String next(SessionState state) {
            String label = router.route(state);
            String target = label == null ? null : labels.get(label);
            if (target == null) {
                throw new UnknownRoutingLabelException(getFrom(), label);
            }
            return target;
        }

        @Override
        public Collection<String> targets() {
            return labels.values();
        }
    }
}
