package com.lintmux.child;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * An error raised inside a child, or a failure talking to it, with its trace.
 */
public record ChildFailure(String message, String stackTrace) {

    public static ChildFailure from(Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (error instanceof ChildRequestException requestError
                && requestError.childStackTrace() != null && !requestError.childStackTrace().isBlank()) {
            return new ChildFailure(message, requestError.childStackTrace());
        }
        return new ChildFailure(message, stackTraceOf(error));
    }

    public static String stackTraceOf(Throwable error) {
        var writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    /**
     * Strips the wrappers {@link java.util.concurrent.CompletableFuture} adds around a failure.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
