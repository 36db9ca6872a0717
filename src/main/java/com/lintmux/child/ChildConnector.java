package com.lintmux.child;

import com.lintmux.core.model.ChildSpec;

/**
 * Starts children. Implementations: {@link ProcessChildConnector}.
 */
public interface ChildConnector {

    /**
     * Starts the child described by {@code spec} and connects to it.
     *
     * @throws ChildConnectionException when the child cannot be started
     */
    ChildConnection connect(ChildSpec spec);
}
