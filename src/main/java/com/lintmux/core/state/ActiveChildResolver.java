package com.lintmux.core.state;

import com.lintmux.child.ChildDiscovery;
import com.lintmux.core.model.ChildIdentity;
import com.lintmux.core.model.ChildSpec;
import com.lintmux.core.model.WorkspaceRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Derives the active child set from the workspace roots.
 *
 * <p>Memoized on the roots: calling it again with equal roots returns the
 * identical {@link ActiveChildren} instance, so re-applying a root set never
 * looks like a change to listeners.
 */
@Component
public class ActiveChildResolver {

    private static final Logger log = LoggerFactory.getLogger(ActiveChildResolver.class);

    private final ChildDiscovery discovery;

    private List<WorkspaceRoot> lastRoots;
    private ActiveChildren lastResult;

    public ActiveChildResolver(ChildDiscovery discovery) {
        this.discovery = discovery;
    }

    public ActiveChildren deriveActiveChildSet(List<WorkspaceRoot> roots) {
        if (lastResult != null && Objects.equals(lastRoots, roots)) {
            return lastResult;
        }

        var specs = new LinkedHashMap<ChildIdentity, ChildSpec>();
        var rootsByChild = new LinkedHashMap<ChildIdentity, List<WorkspaceRoot>>();
        for (WorkspaceRoot root : roots) {
            for (ChildSpec spec : discovery.discover(root)) {
                specs.putIfAbsent(spec.identity(), spec);
                rootsByChild.computeIfAbsent(spec.identity(), k -> new ArrayList<>()).add(root);
            }
        }

        var result = new ActiveChildren(specs, rootsByChild);
        log.debug("Derived {} active children from {} roots", specs.size(), roots.size());
        lastRoots = List.copyOf(roots);
        lastResult = result;
        return result;
    }
}
