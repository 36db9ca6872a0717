package com.lintmux.core.state;

import com.lintmux.core.model.ChildIdentity;
import com.lintmux.core.model.ChildSpec;
import com.lintmux.core.model.WorkspaceRoot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The children that must be running for the current workspace roots.
 *
 * @param specs start information per identity, in discovery order
 * @param roots workspace roots each child applies to
 */
public record ActiveChildren(
    Map<ChildIdentity, ChildSpec> specs,
    Map<ChildIdentity, List<WorkspaceRoot>> roots
) {
    public static final ActiveChildren EMPTY = new ActiveChildren(Map.of(), Map.of());

    public ActiveChildren {
        specs = Collections.unmodifiableMap(new LinkedHashMap<>(specs));
        var copy = new LinkedHashMap<ChildIdentity, List<WorkspaceRoot>>();
        roots.forEach((id, list) -> copy.put(id, List.copyOf(list)));
        roots = Collections.unmodifiableMap(copy);
    }

    public Set<ChildIdentity> identities() {
        return specs.keySet();
    }

    public List<WorkspaceRoot> rootsFor(ChildIdentity identity) {
        return roots.getOrDefault(identity, List.of());
    }
}
