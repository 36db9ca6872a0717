package com.lintmux.child;

/**
 * A child answered a request with an error. Carries the child's own trace.
 */
public class ChildRequestException extends RuntimeException {

    private final String childStackTrace;

    public ChildRequestException(String message, String childStackTrace) {
        super(message);
        this.childStackTrace = childStackTrace;
    }

    public String childStackTrace() {
        return childStackTrace;
    }
}
