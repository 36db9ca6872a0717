package com.lintmux.core.metrics;

import com.lintmux.core.model.LinkState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LintmuxMetricsTest {

    private SimpleMeterRegistry registry;
    private LintmuxMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new LintmuxMetrics(registry);
    }

    @Test
    @DisplayName("recordBroadcast creates a timer and a target summary per method")
    void recordBroadcast() {
        metrics.recordBroadcast("edit.getFixes", 120, 3);

        var timer = registry.find("lintmux.broadcast.duration").tag("method", "edit.getFixes").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(3.0, registry.find("lintmux.broadcast.targets").summary().totalAmount());
    }

    @Test
    @DisplayName("recordLinkTransition counts by state")
    void recordLinkTransition() {
        metrics.recordLinkTransition(LinkState.READY);
        metrics.recordLinkTransition(LinkState.READY);
        metrics.recordLinkTransition(LinkState.FAILED);

        assertEquals(2.0, registry.find("lintmux.links.transitions").tag("state", "READY").counter().count());
        assertEquals(1.0, registry.find("lintmux.links.transitions").tag("state", "FAILED").counter().count());
    }

    @Test
    @DisplayName("recordDiagnosticsUpdate separates emitted and suppressed")
    void recordDiagnosticsUpdate() {
        metrics.recordDiagnosticsUpdate(true);
        metrics.recordDiagnosticsUpdate(false);
        metrics.recordDiagnosticsUpdate(false);

        assertEquals(1.0, registry.find("lintmux.diagnostics.updates").tag("result", "emitted").counter().count());
        assertEquals(2.0, registry.find("lintmux.diagnostics.updates").tag("result", "suppressed").counter().count());
    }

    @Test
    @DisplayName("recordRelayedNotification and recordChildRequestFailure count by tag")
    void counters() {
        metrics.recordRelayedNotification("print");
        metrics.recordChildRequestFailure("edit.getFixes");

        assertEquals(1.0, registry.find("lintmux.relay.notifications").tag("kind", "print").counter().count());
        assertEquals(1.0, registry.find("lintmux.broadcast.failures").tag("method", "edit.getFixes").counter().count());
    }
}
