package com.lintmux.child;

/**
 * Thrown when a child cannot be started, or its connection broke.
 */
public class ChildConnectionException extends RuntimeException {
    public ChildConnectionException(String message) {
        super(message);
    }

    public ChildConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
