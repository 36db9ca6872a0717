package com.lintmux.core.state;

import com.lintmux.core.model.VersionCheckParams;
import com.lintmux.core.model.WorkspaceRoot;

import java.util.List;
import java.util.Map;

/**
 * Keys of the orchestrator's inputs and derived values.
 */
public final class StateKeys {

    private StateKeys() {}

    public static final StateKey<List<WorkspaceRoot>> CONTEXT_ROOTS = new StateKey<>("contextRoots");
    public static final StateKey<List<String>> PRIORITY_FILES = new StateKey<>("priorityFiles");
    public static final StateKey<Map<String, List<String>>> SUBSCRIPTIONS = new StateKey<>("subscriptions");
    public static final StateKey<VersionCheckParams> VERSION_CHECK = new StateKey<>("versionCheck");

    public static final StateKey<ActiveChildren> ACTIVE_CHILDREN = new StateKey<>("activeChildren");

    /**
     * Builds a store with every input at its empty value and the active child set
     * derived from {@link #CONTEXT_ROOTS}.
     */
    public static ReactiveStore newStore(ActiveChildResolver resolver, VersionCheckParams defaultVersionCheck) {
        var store = new ReactiveStore();
        store.defineInput(CONTEXT_ROOTS, List.of());
        store.defineInput(PRIORITY_FILES, List.of());
        store.defineInput(SUBSCRIPTIONS, Map.of());
        store.defineInput(VERSION_CHECK, defaultVersionCheck);
        store.defineDerived(ACTIVE_CHILDREN,
                s -> resolver.deriveActiveChildSet(s.read(CONTEXT_ROOTS)),
                CONTEXT_ROOTS);
        return store;
    }
}
