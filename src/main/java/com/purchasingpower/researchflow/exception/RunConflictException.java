package com.purchasingpower.researchflow.exception;

import lombok.Getter;

@Getter
public class RunConflictException extends GraphException {

    private final String threadId;

    public RunConflictException(String threadId, String reason) {
        super(ErrorType.RUN_CONFLICT, "Cannot start a run on thread '" + threadId + "': " + reason);
        this.threadId = threadId;
    }
}
