package com.lintmux.child;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lintmux.core.events.HostNotification;
import com.lintmux.core.events.Subscription;
import com.lintmux.core.model.AnalysisErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * JSON-lines connection to a child process.
 *
 * <p>Outgoing requests: {@code {"id":"1","method":"...","params":{...}}}.
 * Incoming responses carry the request id with either {@code result} or
 * {@code error}; anything else with an {@code event} is a notification.
 * {@code plugin.error} notifications are routed to the error stream only, and
 * the child's stderr is treated as log output.
 */
public class ProcessChildConnection implements ChildConnection {

    private static final Logger log = LoggerFactory.getLogger(ProcessChildConnection.class);

    private final String name;
    private final Process process;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final BufferedWriter writer;

    private final AtomicLong nextId = new AtomicLong(1);
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Map<String, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();

    private final List<Consumer<AnalysisErrors>> diagnosticsListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<String>> logListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<ChildFailure>> errorListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<ChildNotification>> notificationListeners = new CopyOnWriteArrayList<>();

    ProcessChildConnection(String name, Process process, ObjectMapper objectMapper, Duration requestTimeout) {
        this.name = name;
        this.process = process;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    }

    void startReading() {
        daemon("lintmux-child-" + name, () -> readMessages(process.getInputStream()));
        daemon("lintmux-child-" + name + "-stderr", () -> readStderr(process.getErrorStream()));
    }

    @Override
    public CompletableFuture<JsonNode> sendRequest(String method, JsonNode params) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(
                    new ChildConnectionException("Connection to plugin " + name + " is closed"));
        }
        String id = String.valueOf(nextId.getAndIncrement());
        var future = new CompletableFuture<JsonNode>();
        pending.put(id, future);

        ObjectNode message = objectMapper.createObjectNode();
        message.put("id", id);
        message.put("method", method);
        message.set("params", params != null ? params : objectMapper.createObjectNode());
        try {
            write(objectMapper.writeValueAsString(message));
        } catch (IOException e) {
            pending.remove(id);
            return CompletableFuture.failedFuture(
                    new ChildConnectionException("Failed to send " + method + " to plugin " + name, e));
        }

        return future
                .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((value, error) -> {
                    pending.remove(id);
                    if (error instanceof TimeoutException) {
                        log.warn("Plugin {} did not answer {} within {}s", name, method, requestTimeout.toSeconds());
                    }
                });
    }

    @Override
    public Subscription onDiagnostics(Consumer<AnalysisErrors> listener) {
        return register(diagnosticsListeners, listener);
    }

    @Override
    public Subscription onLog(Consumer<String> listener) {
        return register(logListeners, listener);
    }

    @Override
    public Subscription onError(Consumer<ChildFailure> listener) {
        return register(errorListeners, listener);
    }

    @Override
    public Subscription onNotification(Consumer<ChildNotification> listener) {
        return register(notificationListeners, listener);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        var error = new ChildConnectionException("Connection to plugin " + name + " closed");
        pending.values().forEach(f -> f.completeExceptionally(error));
        pending.clear();
        diagnosticsListeners.clear();
        logListeners.clear();
        errorListeners.clear();
        notificationListeners.clear();
        try {
            writer.close();
        } catch (IOException e) {
            log.debug("Could not close stdin of plugin {}: {}", name, e.getMessage());
        }
        process.destroy();
        log.debug("Closed connection to plugin {}", name);
    }

    private void readMessages(InputStream stdout) {
        try (var reader = new BufferedReader(new InputStreamReader(stdout, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    handleLine(line);
                }
            }
        } catch (IOException e) {
            if (!closed.get()) {
                log.warn("Lost connection to plugin {}: {}", name, e.getMessage());
            }
        }
        if (!closed.get()) {
            log.warn("Plugin {} exited", name);
            emit(errorListeners, new ChildFailure("The plugin " + name + " exited unexpectedly", ""));
            close();
        }
    }

    private void readStderr(InputStream stderr) {
        try (var reader = new BufferedReader(new InputStreamReader(stderr, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                emit(logListeners, line);
            }
        } catch (IOException e) {
            log.debug("Stopped reading stderr of plugin {}: {}", name, e.getMessage());
        }
    }

    void handleLine(String line) {
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            emit(errorListeners, new ChildFailure("Malformed message from plugin " + name + ": " + line,
                    ChildFailure.stackTraceOf(e)));
            return;
        }

        if (message.hasNonNull("id") && (message.has("result") || message.has("error"))) {
            completeRequest(message);
            return;
        }

        String event = message.path("event").asText(null);
        if (event == null) {
            emit(errorListeners, new ChildFailure("Unrecognized message from plugin " + name + ": " + line, ""));
            return;
        }
        JsonNode params = message.path("params");
        switch (event) {
            case HostNotification.PLUGIN_ERROR_METHOD -> {
                emit(errorListeners, new ChildFailure(params.path("message").asText(""),
                        params.path("stackTrace").asText("")));
                return;
            }
            case HostNotification.DIAGNOSTICS_METHOD -> {
                try {
                    emit(diagnosticsListeners, objectMapper.treeToValue(params, AnalysisErrors.class));
                } catch (JsonProcessingException e) {
                    emit(errorListeners, new ChildFailure("Malformed diagnostics from plugin " + name
                            + ": " + e.getOriginalMessage(), ChildFailure.stackTraceOf(e)));
                }
            }
            case HostNotification.PRINT_METHOD -> emit(logListeners, params.path("message").asText(""));
            default -> { }
        }
        emit(notificationListeners, new ChildNotification(event, params));
    }

    private void completeRequest(JsonNode message) {
        String id = message.get("id").asText();
        CompletableFuture<JsonNode> future = pending.remove(id);
        if (future == null) {
            log.debug("Plugin {} answered unknown or expired request {}", name, id);
            return;
        }
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            future.completeExceptionally(new ChildRequestException(
                    error.path("message").asText("Unknown error"),
                    error.path("stackTrace").asText("")));
        } else {
            future.complete(message.get("result"));
        }
    }

    private synchronized void write(String line) throws IOException {
        writer.write(line);
        writer.newLine();
        writer.flush();
    }

    private <T> Subscription register(List<Consumer<T>> listeners, Consumer<T> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private <T> void emit(List<Consumer<T>> listeners, T value) {
        for (Consumer<T> listener : listeners) {
            try {
                listener.accept(value);
            } catch (Exception e) {
                log.warn("Listener of plugin {} threw exception: {}", name, e.getMessage(), e);
            }
        }
    }

    private static void daemon(String threadName, Runnable body) {
        Thread thread = new Thread(body, threadName);
        thread.setDaemon(true);
        thread.start();
    }
}
