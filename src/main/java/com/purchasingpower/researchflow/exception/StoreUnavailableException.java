package com.purchasingpower.researchflow.exception;

import lombok.Getter;

@Getter
public class StoreUnavailableException extends GraphException {

    private final String threadId;

    public StoreUnavailableException(String threadId, Throwable cause) {
        super(ErrorType.STORE_UNAVAILABLE,
                "Checkpoint store unavailable for thread '" + threadId + "': " + cause.getMessage(), cause);
        this.threadId = threadId;
    }
}
