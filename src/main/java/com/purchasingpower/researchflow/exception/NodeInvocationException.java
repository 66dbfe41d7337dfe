package com.purchasingpower.researchflow.exception;

import lombok.Getter;

@Getter
public class NodeInvocationException extends GraphException {

    private final String node;

    public NodeInvocationException(String node, String message) {
        super(ErrorType.NODE_INVOCATION, "Node '" + node + "' failed: " + message);
        this.node = node;
    }

    public NodeInvocationException(String node, Throwable cause) {
        super(ErrorType.NODE_INVOCATION, "Node '" + node + "' failed: " + cause.getMessage(), cause);
        this.node = node;
    }
}
