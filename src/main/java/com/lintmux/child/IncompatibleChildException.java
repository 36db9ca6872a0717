package com.lintmux.child;

/**
 * Thrown when a child's handshake reports a version outside the accepted range.
 */
public class IncompatibleChildException extends RuntimeException {
    public IncompatibleChildException(String message) {
        super(message);
    }
}
