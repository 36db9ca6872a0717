package com.lintmux.core.protocol;

/**
 * Wire method names shared by the host-facing and child-facing protocols.
 */
public final class Methods {

    private Methods() {}

    public static final String SET_CONTEXT_ROOTS = "analysis.setContextRoots";
    public static final String SET_PRIORITY_FILES = "analysis.setPriorityFiles";
    public static final String SET_SUBSCRIPTIONS = "analysis.setSubscriptions";
    public static final String UPDATE_CONTENT = "analysis.updateContent";
    public static final String HANDLE_WATCH_EVENTS = "analysis.handleWatchEvents";
    public static final String GET_NAVIGATION = "analysis.getNavigation";
    public static final String GET_DIAGNOSTICS = "lintmux.getDiagnostics";
    public static final String GET_FIXES = "edit.getFixes";
    public static final String GET_ASSISTS = "edit.getAssists";
    public static final String GET_AVAILABLE_REFACTORINGS = "edit.getAvailableRefactorings";
    public static final String GET_REFACTORING = "edit.getRefactoring";
    public static final String GET_COMPLETIONS = "completion.getSuggestions";
    public static final String GET_KYTHE_ENTRIES = "kythe.getKytheEntries";
    public static final String VERSION_CHECK = "plugin.versionCheck";
    public static final String SHUTDOWN = "plugin.shutdown";
}
