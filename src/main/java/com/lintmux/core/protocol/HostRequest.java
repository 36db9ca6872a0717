package com.lintmux.core.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.lintmux.core.model.WorkspaceRoot;

import java.util.List;
import java.util.Map;

/**
 * Every request kind the host may send. Handlers implement {@link Visitor}, so
 * adding a kind fails compilation until every handler covers it.
 */
public sealed interface HostRequest {

    @JsonIgnore
    String method();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visit(SetContextRoots request);
        R visit(SetPriorityFiles request);
        R visit(SetSubscriptions request);
        R visit(UpdateContent request);
        R visit(HandleWatchEvents request);
        R visit(GetDiagnostics request);
        R visit(GetFixes request);
        R visit(GetAssists request);
        R visit(GetAvailableRefactorings request);
        R visit(GetRefactoring request);
        R visit(GetNavigation request);
        R visit(GetCompletions request);
        R visit(GetKytheEntries request);
        R visit(VersionCheck request);
        R visit(Shutdown request);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SetContextRoots(List<WorkspaceRoot> roots) implements HostRequest {
        public String method() { return Methods.SET_CONTEXT_ROOTS; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SetPriorityFiles(List<String> files) implements HostRequest {
        public String method() { return Methods.SET_PRIORITY_FILES; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    /**
     * @param subscriptions analysis service name to the files subscribed to it
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SetSubscriptions(Map<String, List<String>> subscriptions) implements HostRequest {
        public String method() { return Methods.SET_SUBSCRIPTIONS; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    /**
     * @param files path to an opaque content overlay (add, change or remove)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record UpdateContent(Map<String, JsonNode> files) implements HostRequest {
        public String method() { return Methods.UPDATE_CONTENT; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record HandleWatchEvents(List<JsonNode> events) implements HostRequest {
        public String method() { return Methods.HANDLE_WATCH_EVENTS; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    /**
     * @param files files to report; empty asks for every analyzed file
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GetDiagnostics(List<String> files) implements HostRequest {
        public String method() { return Methods.GET_DIAGNOSTICS; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GetFixes(String file, int offset) implements HostRequest {
        public String method() { return Methods.GET_FIXES; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GetAssists(String file, int offset, int length) implements HostRequest {
        public String method() { return Methods.GET_ASSISTS; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GetAvailableRefactorings(String file, int offset, int length) implements HostRequest {
        public String method() { return Methods.GET_AVAILABLE_REFACTORINGS; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GetRefactoring(String kind, String file, int offset, int length,
                          boolean validateOnly, JsonNode options) implements HostRequest {
        public String method() { return Methods.GET_REFACTORING; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GetNavigation(String file, int offset, int length) implements HostRequest {
        public String method() { return Methods.GET_NAVIGATION; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GetCompletions(String file, int offset) implements HostRequest {
        public String method() { return Methods.GET_COMPLETIONS; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GetKytheEntries(String file) implements HostRequest {
        public String method() { return Methods.GET_KYTHE_ENTRIES; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record VersionCheck(String byteStorePath, String sdkPath, String version) implements HostRequest {
        public String method() { return Methods.VERSION_CHECK; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Shutdown() implements HostRequest {
        public String method() { return Methods.SHUTDOWN; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }
}
