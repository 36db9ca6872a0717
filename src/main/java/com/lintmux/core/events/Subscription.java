package com.lintmux.core.events;

/**
 * Handle for cancelling a subscription. Cancelling twice is a no-op.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
