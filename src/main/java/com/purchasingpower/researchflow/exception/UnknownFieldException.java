package com.purchasingpower.researchflow.exception;

import lombok.Getter;

@Getter
public class UnknownFieldException extends GraphException {

    private final String field;

    public UnknownFieldException(String field) {
        super(ErrorType.UNKNOWN_FIELD, "No reducer registered for state field '" + field + "'");
        this.field = field;
    }
}
