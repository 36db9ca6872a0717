package com.lintmux.core.protocol;

/**
 * Error codes of failed host requests.
 */
public enum ErrorCode {
    INVALID_PARAMETER,
    UNKNOWN_REQUEST,
    SERVER_ERROR,
    SHUT_DOWN
}
