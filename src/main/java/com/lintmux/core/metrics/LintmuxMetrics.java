package com.lintmux.core.metrics;

import com.lintmux.core.model.LinkState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for request fan-out and child lifecycle.
 */
@Service
public class LintmuxMetrics {

    private final MeterRegistry registry;

    public LintmuxMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one completed broadcast.
     *
     * @param method   request method
     * @param ms       time until every targeted child answered
     * @param targets  number of READY children the request went to
     */
    public void recordBroadcast(String method, long ms, int targets) {
        Timer.builder("lintmux.broadcast.duration")
                .tag("method", method)
                .register(registry)
                .record(Duration.ofMillis(ms));

        DistributionSummary.builder("lintmux.broadcast.targets")
                .description("Children targeted per broadcast")
                .tag("method", method)
                .register(registry)
                .record(targets);
    }

    public void recordChildRequestFailure(String method) {
        Counter.builder("lintmux.broadcast.failures")
                .description("Per-child request failures isolated during broadcasts")
                .tag("method", method)
                .register(registry)
                .increment();
    }

    public void recordLinkTransition(LinkState state) {
        Counter.builder("lintmux.links.transitions")
                .tag("state", state.name())
                .register(registry)
                .increment();
    }

    /**
     * @param emitted true when a diagnostics notification went to the host,
     *                false when it was suppressed as unchanged
     */
    public void recordDiagnosticsUpdate(boolean emitted) {
        Counter.builder("lintmux.diagnostics.updates")
                .tag("result", emitted ? "emitted" : "suppressed")
                .register(registry)
                .increment();
    }

    public void recordRelayedNotification(String kind) {
        Counter.builder("lintmux.relay.notifications")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
