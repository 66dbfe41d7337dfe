package com.purchasingpower.researchflow.exception;

public class StepLimitExceededException extends GraphException {

    public StepLimitExceededException(String threadId, int limit) {
        super(ErrorType.STEP_LIMIT_EXCEEDED,
                "Thread '" + threadId + "' exceeded the limit of " + limit + " supersteps per invocation");
    }
}
