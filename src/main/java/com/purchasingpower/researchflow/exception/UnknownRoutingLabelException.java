package com.purchasingpower.researchflow.exception;

import lombok.Getter;

@Getter
public class UnknownRoutingLabelException extends GraphException {

    private final String fromNode;
    private final String label;

    public UnknownRoutingLabelException(String fromNode, String label) {
        super(ErrorType.UNKNOWN_ROUTING_LABEL,
                "Router of node '" + fromNode + "' returned unmapped label '" + label + "'");
        this.fromNode = fromNode;
        this.label = label;
    }
}
