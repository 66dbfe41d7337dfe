package com.purchasingpower.researchflow.exception;

/**
 * Classification of graph execution failures.
 *
 * <p>Configuration errors ({@link #UNKNOWN_FIELD}, {@link #UNKNOWN_ROUTING_LABEL},
 * {@link #RESUME_MISMATCH}) are fatal and never retried. {@link #NODE_INVOCATION}
 * is raised when a node lets an exception escape. {@link #STORE_UNAVAILABLE} aborts
 * the current superstep and leaves the previous checkpoint intact.
 */
public enum ErrorType {

    /** Partial update touched a field with no registered reducer. */
    UNKNOWN_FIELD,

    /** Router returned a label that has no mapped successor. */
    UNKNOWN_ROUTING_LABEL,

    /** A node failed while executing. */
    NODE_INVOCATION,

    /** Resume requested on a thread without a resumable interrupt. */
    RESUME_MISMATCH,

    /** Checkpoint persistence failed. */
    STORE_UNAVAILABLE,

    /** A single invocation exceeded the configured number of supersteps. */
    STEP_LIMIT_EXCEEDED,

    /** Run requested on a thread that is suspended and must be resumed instead. */
    RUN_CONFLICT;

    /**
     * Whether the error points at a broken graph definition or caller misuse
     * rather than a runtime fault.
     */
    public boolean isConfigurationError() {
        return this == UNKNOWN_FIELD || this == UNKNOWN_ROUTING_LABEL || this == RESUME_MISMATCH;
    }
}
