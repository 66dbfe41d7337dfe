package com.purchasingpower.researchflow.exception;

/**
 * Raised while building a graph, before any thread runs on it.
 */
public class GraphDefinitionException extends RuntimeException {

    public GraphDefinitionException(String message) {
        super(message);
    }
}
