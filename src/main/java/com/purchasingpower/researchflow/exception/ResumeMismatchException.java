package com.purchasingpower.researchflow.exception;

import lombok.Getter;

@Getter
public class ResumeMismatchException extends GraphException {

    private final String threadId;

    public ResumeMismatchException(String threadId, String reason) {
        super(ErrorType.RESUME_MISMATCH, "Cannot resume thread '" + threadId + "': " + reason);
        this.threadId = threadId;
    }
}
