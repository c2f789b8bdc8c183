package com.challenges.eql.ast;

/**
 * Base class for errors raised while building, expanding or optimizing syntax trees.
 */
public class EqlException extends RuntimeException {

    public EqlException(String message) {
        super(message);
    }

    public EqlException(String message, Throwable cause) {
        super(message, cause);
    }
}
