package com.lintmux.core.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.lintmux.core.model.ChildIdentity;
import com.lintmux.core.model.Diagnostic;

import java.util.List;

/**
 * A notification sent from the orchestrator to the host.
 */
public sealed interface HostNotification {

    String DIAGNOSTICS_METHOD = "analysis.errors";
    String PLUGIN_ERROR_METHOD = "plugin.error";
    String PRINT_METHOD = "lintmux.print";

    /** Wire method name of this notification. */
    @JsonIgnore
    String method();

    /**
     * The merged diagnostics of {@code file} changed.
     */
    record DiagnosticsChanged(String file, List<Diagnostic> errors) implements HostNotification {
        public DiagnosticsChanged {
            errors = List.copyOf(errors);
        }

        @Override
        public String method() {
            return DIAGNOSTICS_METHOD;
        }
    }

    /**
     * A child failed: handshake, request or internal error.
     *
     * @param child      the failing child, null when it cannot be attributed
     * @param message    human readable description
     * @param stackTrace trace captured where the failure happened
     */
    record PluginError(ChildIdentity child, String message, String stackTrace) implements HostNotification {
        @Override
        public String method() {
            return PLUGIN_ERROR_METHOD;
        }

        /** Children never take the orchestrator down. */
        public boolean isFatal() {
            return false;
        }
    }

    /**
     * Informational output, already labelled with the child's name.
     */
    record Print(String message) implements HostNotification {
        @Override
        public String method() {
            return PRINT_METHOD;
        }
    }

    /**
     * A child notification of a kind the orchestrator does not interpret.
     */
    record Passthrough(String method, JsonNode params) implements HostNotification {}
}
