package com.lintmux.child;

import com.lintmux.core.model.ChildIdentity;
import com.lintmux.core.model.ChildSpec;
import com.lintmux.core.model.WorkspaceRoot;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Discovery backed by a fixed root to plugins table.
 */
public class MapChildDiscovery implements ChildDiscovery {

    private final Map<String, List<ChildSpec>> byRoot = new LinkedHashMap<>();
    private int calls;

    public static ChildSpec spec(String root, String name) {
        return new ChildSpec(ChildIdentity.of(root + "/.lintmux.json", name), name,
                List.of("fake-" + name), Path.of(root));
    }

    public MapChildDiscovery declare(String root, String... names) {
        for (String name : names) {
            declare(root, spec(root, name));
        }
        return this;
    }

    public MapChildDiscovery declare(String root, ChildSpec spec) {
        byRoot.computeIfAbsent(root, k -> new ArrayList<>()).add(spec);
        return this;
    }

    @Override
    public List<ChildSpec> discover(WorkspaceRoot root) {
        calls++;
        return byRoot.getOrDefault(root.root(), List.of());
    }

    public int calls() {
        return calls;
    }
}
