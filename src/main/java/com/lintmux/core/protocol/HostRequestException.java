package com.lintmux.core.protocol;

/**
 * Fails a single host request with a typed error. Other requests are unaffected.
 */
public class HostRequestException extends RuntimeException {

    private final ErrorCode code;

    public HostRequestException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public HostRequestException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
