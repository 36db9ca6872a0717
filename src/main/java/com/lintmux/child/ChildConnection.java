package com.lintmux.child;

import com.fasterxml.jackson.databind.JsonNode;
import com.lintmux.core.events.Subscription;
import com.lintmux.core.model.AnalysisErrors;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A bidirectional connection to one running child.
 *
 * <p>Listeners are invoked on the connection's own threads, in emission order.
 * After {@link #close()} pending requests complete exceptionally with a
 * {@link ChildConnectionException} and no listener is invoked again.
 */
public interface ChildConnection {

    /**
     * Sends a request. The future fails when the child answers with an error,
     * the connection closes or the request times out.
     */
    CompletableFuture<JsonNode> sendRequest(String method, JsonNode params);

    /** Diagnostics the child reports for one file. */
    Subscription onDiagnostics(Consumer<AnalysisErrors> listener);

    /** Free-form log output, possibly several lines at once. */
    Subscription onLog(Consumer<String> listener);

    /** Errors raised inside the child. */
    Subscription onError(Consumer<ChildFailure> listener);

    /**
     * Every notification the child sends, including the kinds also delivered to
     * {@link #onDiagnostics} and {@link #onLog}.
     */
    Subscription onNotification(Consumer<ChildNotification> listener);

    void close();
}
