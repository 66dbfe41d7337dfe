package com.purchasingpower.researchflow.exception;

import lombok.Getter;

/**
 * Base class for every failure raised by the graph engine.
 */
@Getter
public class GraphException extends RuntimeException {

    private final ErrorType errorType;

    public GraphException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public GraphException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }
}
