package com.lintmux.core.model;

/**
 * Lifecycle state of a child link.
 */
public enum LinkState {
    STARTING,
    READY,
    FAILED,   // handshake failed, excluded from fan-out until the identity cycles
    DISPOSED
}
