package com.purchasingpower.researchflow.model;

/**
 * Lifecycle of a thread's run.
 *
 * <pre>
 * RUNNING → COMPLETED
 *           ↓  ↑
 *        SUSPENDED
 *           ↓
 *         FAILED
 * </pre>
 *
 * <p>SUSPENDED is a durable pause, not a terminal state: it is read back from the
 * checkpoint after a restart and accepts exactly one transition, a resume.
 */
public enum RunStatus {

    /**
     * Supersteps are executing; the checkpoint records the next node to run.
     */
    RUNNING,

    /**
     * Waiting for an external decision (or cancelled between supersteps).
     */
    SUSPENDED,

    /**
     * Reached END. Terminal for the invocation.
     */
    COMPLETED,

    /**
     * Aborted by an error; the checkpoint holds the last good state and the error.
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean isResumable() {
        return this == SUSPENDED;
    }
}
