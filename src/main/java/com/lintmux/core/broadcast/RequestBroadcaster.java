package com.lintmux.core.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.lintmux.child.ChildFailure;
import com.lintmux.child.ChildLink;
import com.lintmux.child.LinkManager;
import com.lintmux.core.events.HostNotification;
import com.lintmux.core.events.NotificationBus;
import com.lintmux.core.metrics.LintmuxMetrics;
import com.lintmux.core.scheduler.OrchestratorLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Sends one request to every READY child and collects the answers.
 *
 * <p>Each child's outcome is captured on its own: a failing child is reported
 * to the host as a plugin error and left out of the result, the others are
 * unaffected. The returned future never completes exceptionally. Must be
 * called on the orchestrator loop.
 */
@Service
public class RequestBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(RequestBroadcaster.class);

    private final LinkManager linkManager;
    private final OrchestratorLoop loop;
    private final NotificationBus notificationBus;
    private final LintmuxMetrics metrics;

    public RequestBroadcaster(LinkManager linkManager, OrchestratorLoop loop, NotificationBus notificationBus,
                              @Autowired(required = false) LintmuxMetrics metrics) {
        this.linkManager = linkManager;
        this.loop = loop;
        this.notificationBus = notificationBus;
        this.metrics = metrics;
    }

    /**
     * Sends the same request to every READY child.
     *
     * @return successful answers in link order; empty when no child is READY
     */
    public CompletableFuture<List<ChildResponse>> broadcast(String method, JsonNode params) {
        return broadcastEach(method, link -> params);
    }

    /**
     * Sends a per-child request to every READY child.
     *
     * @param paramsFor params for a child, or {@code null} to leave that child out
     */
    public CompletableFuture<List<ChildResponse>> broadcastEach(String method, Function<ChildLink, JsonNode> paramsFor) {
        var targets = new ArrayList<ChildLink>();
        var params = new ArrayList<JsonNode>();
        for (ChildLink link : linkManager.readyLinks()) {
            JsonNode linkParams = paramsFor.apply(link);
            if (linkParams != null) {
                targets.add(link);
                params.add(linkParams);
            }
        }

        var pending = new PendingBroadcast(method, targets);
        long startMs = System.currentTimeMillis();
        log.debug("Broadcasting {} to {} plugins", method, targets.size());

        for (int i = 0; i < targets.size(); i++) {
            final int index = i;
            ChildLink link = targets.get(i);
            send(link, method, params.get(i))
                    .thenAcceptAsync(outcome -> pending.record(index, outcome), loop);
        }

        return pending.completion().thenApplyAsync(outcomes -> {
            var responses = new ArrayList<ChildResponse>();
            for (Outcome<JsonNode> outcome : outcomes) {
                if (outcome instanceof Outcome.Success<JsonNode> success) {
                    responses.add(new ChildResponse(success.link().identity(), success.link().name(),
                            success.value()));
                } else if (outcome instanceof Outcome.Failure<JsonNode> failure) {
                    reportFailure(method, failure);
                }
            }
            if (metrics != null) {
                metrics.recordBroadcast(method, System.currentTimeMillis() - startMs, targets.size());
            }
            return responses;
        }, loop);
    }

    private CompletableFuture<Outcome<JsonNode>> send(ChildLink link, String method, JsonNode params) {
        CompletableFuture<JsonNode> request;
        try {
            request = link.connection().sendRequest(method, params);
        } catch (RuntimeException e) {
            request = CompletableFuture.failedFuture(e);
        }
        return request.handle((value, error) -> error == null
                ? Outcome.success(link, value)
                : Outcome.failure(link, ChildFailure.from(ChildFailure.unwrap(error))));
    }

    private void reportFailure(String method, Outcome.Failure<JsonNode> failure) {
        ChildLink link = failure.link();
        if (metrics != null) {
            metrics.recordChildRequestFailure(method);
        }
        if (link.isDisposed()) {
            log.debug("Plugin {} was disposed while handling {}", link.name(), method);
            return;
        }
        log.warn("Plugin {} failed handling {}: {}", link.name(), method, failure.failure().message());
        notificationBus.publish(new HostNotification.PluginError(link.identity(),
                "The plugin " + link.name() + " failed with the error " + method + ":\n"
                        + failure.failure().message(),
                failure.failure().stackTrace()));
    }
}
