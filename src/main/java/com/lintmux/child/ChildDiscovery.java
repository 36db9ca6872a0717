package com.lintmux.child;

import com.lintmux.core.model.ChildSpec;
import com.lintmux.core.model.WorkspaceRoot;

import java.util.List;

/**
 * Finds the children a workspace root asks for.
 */
public interface ChildDiscovery {

    /**
     * @return the children declared under {@code root}, empty when none
     */
    List<ChildSpec> discover(WorkspaceRoot root);
}
