package com.lintmux.child;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lintmux.core.model.ChildSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * Starts each child as a local process speaking JSON lines on stdin/stdout.
 */
public class ProcessChildConnector implements ChildConnector {

    private static final Logger log = LoggerFactory.getLogger(ProcessChildConnector.class);

    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public ProcessChildConnector(ObjectMapper objectMapper, Duration requestTimeout) {
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public ChildConnection connect(ChildSpec spec) {
        if (spec.command().isEmpty()) {
            throw new ChildConnectionException("Plugin " + spec.name() + " has no command");
        }
        var builder = new ProcessBuilder(spec.command());
        if (spec.directory() != null) {
            builder.directory(spec.directory().toFile());
        }
        try {
            Process process = builder.start();
            log.info("Started plugin {} (pid {}): {}", spec.name(), process.pid(), String.join(" ", spec.command()));
            var connection = new ProcessChildConnection(spec.name(), process, objectMapper, requestTimeout);
            connection.startReading();
            return connection;
        } catch (IOException e) {
            throw new ChildConnectionException("Failed to start plugin " + spec.name() + ": " + e.getMessage(), e);
        }
    }
}
