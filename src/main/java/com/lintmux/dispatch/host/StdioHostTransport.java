package com.lintmux.dispatch.host;

import com.lintmux.child.ChildFailure;
import com.lintmux.core.engine.PluginOrchestrator;
import com.lintmux.core.events.NotificationBus;
import com.lintmux.core.events.Subscription;
import com.lintmux.core.protocol.ErrorCode;
import com.lintmux.core.protocol.HostRequest;
import com.lintmux.core.protocol.HostRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Serves the host over JSON lines: requests on one stream, responses and
 * notifications on the other.
 *
 * <p>Requests are handed to the orchestrator in arrival order; responses are
 * written as they complete. Serving ends after a {@code plugin.shutdown}
 * request has been answered, or at end of input, which shuts the children
 * down as well.
 */
@Component
public class StdioHostTransport {

    private static final Logger log = LoggerFactory.getLogger(StdioHostTransport.class);

    private final PluginOrchestrator orchestrator;
    private final NotificationBus notificationBus;
    private final HostMessageCodec codec;

    public StdioHostTransport(PluginOrchestrator orchestrator, NotificationBus notificationBus,
                              HostMessageCodec codec) {
        this.orchestrator = orchestrator;
        this.notificationBus = notificationBus;
        this.codec = codec;
    }

    /**
     * Blocks until the host shuts the orchestrator down or closes {@code in}.
     */
    public void serve(InputStream in, PrintStream out) throws IOException {
        var writer = new LineWriter(out);
        Subscription notifications = notificationBus.subscribeAll(
                notification -> writer.write(codec.encodeNotification(notification)));
        try {
            orchestrator.start().join();
            log.info("Serving host requests");

            try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) continue;
                    if (handleLine(line, writer)) {
                        log.info("Host requested shutdown");
                        return;
                    }
                }
            }

            log.info("Host closed the connection, shutting plugins down");
            orchestrator.handle(new HostRequest.Shutdown())
                    .exceptionally(error -> {
                        log.warn("Shutdown after end of input failed: {}", error.getMessage());
                        return null;
                    })
                    .join();
        } finally {
            notifications.unsubscribe();
        }
    }

    /**
     * Dispatches one line. Shutdown requests are awaited before returning.
     *
     * @return true when the line was a shutdown request
     */
    boolean handleLine(String line, LineWriter writer) {
        HostMessage message;
        try {
            message = codec.parse(line);
        } catch (HostRequestException e) {
            log.warn("Dropping unreadable host message: {}", e.getMessage());
            writer.write(codec.encodeError(null, e.code(), e.getMessage(), null));
            return false;
        }

        HostRequest request;
        try {
            request = codec.toRequest(message);
        } catch (HostRequestException e) {
            log.warn("Rejected {}: {}", message.method(), e.getMessage());
            writer.write(codec.encodeError(message.id(), e.code(), e.getMessage(), null));
            return false;
        }

        CompletableFuture<Void> handled = orchestrator.handle(request).handle((result, error) -> {
            if (error == null) {
                writer.write(codec.encodeResponse(message.id(), result));
            } else {
                writer.write(errorResponse(message, ChildFailure.unwrap(error)));
            }
            return null;
        });
        if (request instanceof HostRequest.Shutdown) {
            handled.join();
            return true;
        }
        return false;
    }

    private String errorResponse(HostMessage message, Throwable error) {
        if (error instanceof HostRequestException requestError) {
            log.warn("Request {} failed: {}", message.method(), requestError.getMessage());
            return codec.encodeError(message.id(), requestError.code(), requestError.getMessage(), null);
        }
        log.error("Request {} failed unexpectedly: {}", message.method(), error.getMessage(), error);
        return codec.encodeError(message.id(), ErrorCode.SERVER_ERROR,
                String.valueOf(error.getMessage()), ChildFailure.stackTraceOf(error));
    }

    /**
     * Serializes writes from the reader thread, the loop and connection threads.
     */
    static final class LineWriter {

        private final PrintStream out;

        LineWriter(PrintStream out) {
            this.out = out;
        }

        synchronized void write(String line) {
            out.println(line);
            out.flush();
        }
    }
}
