package com.lintmux.child;

/**
 * Notified by {@link LinkManager} on the orchestrator loop.
 */
public interface LinkListener {

    /**
     * The link's connection is open and its handshake is about to begin. The
     * child may emit notifications from here on.
     */
    default void linkStarted(ChildLink link) {}

    /** The link finished its handshake and may receive requests. */
    void linkReady(ChildLink link);

    /** The handshake failed; the link stays FAILED until its identity cycles. */
    default void linkFailed(ChildLink link) {}

    /** The link's identity left the active set; its connection is already closed. */
    default void linkDisposed(ChildLink link) {}
}
