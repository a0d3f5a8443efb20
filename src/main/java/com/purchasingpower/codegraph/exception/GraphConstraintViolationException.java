package com.purchasingpower.codegraph.exception;

import lombok.Getter;

/**
 * A record would break a node identity constraint, e.g. a Method without a signature.
 */
@Getter
public class GraphConstraintViolationException extends RuntimeException {

    private final String constraintName;

    public GraphConstraintViolationException(String constraintName, String message) {
        super(message);
        this.constraintName = constraintName;
    }
}
