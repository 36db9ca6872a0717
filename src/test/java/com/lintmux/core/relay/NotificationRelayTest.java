package com.lintmux.core.relay;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lintmux.child.ChildFailure;
import com.lintmux.child.ChildLink;
import com.lintmux.child.FakeChildConnection;
import com.lintmux.child.LinkFixtures;
import com.lintmux.core.events.HostNotification;
import com.lintmux.core.events.NotificationBus;
import com.lintmux.core.metrics.LintmuxMetrics;
import com.lintmux.core.model.AnalysisErrors;
import com.lintmux.core.model.Diagnostic;
import com.lintmux.core.scheduler.OrchestratorLoop;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NotificationRelayTest {

    private static final String F = "/ws/a/lib/f.dart";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Diagnostic err1 = Diagnostic.of(F, "avoid_print", "Avoid print");
    private final Diagnostic err2 = Diagnostic.of(F, "prefer_final", "Prefer final");

    private List<HostNotification> sent;
    private SimpleMeterRegistry registry;
    private NotificationRelay relay;
    private FakeChildConnection aConnection;
    private FakeChildConnection bConnection;
    private ChildLink a;
    private ChildLink b;

    @BeforeEach
    void setUp() {
        var bus = new NotificationBus();
        sent = new ArrayList<>();
        bus.subscribeAll(sent::add);
        registry = new SimpleMeterRegistry();
        relay = new NotificationRelay(new OrchestratorLoop(Runnable::run), bus, new LintmuxMetrics(registry));

        aConnection = new FakeChildConnection();
        bConnection = new FakeChildConnection();
        a = LinkFixtures.ready("/ws/a", "naming", aConnection);
        b = LinkFixtures.ready("/ws/a", "imports", bConnection);
        relay.linkStarted(a);
        relay.linkReady(a);
        relay.linkStarted(b);
        relay.linkReady(b);
    }

    private <T extends HostNotification> List<T> sent(Class<T> type) {
        return sent.stream().filter(type::isInstance).map(type::cast).toList();
    }

    @Nested
    @DisplayName("diagnostics")
    class DiagnosticsTests {

        @Test
        @DisplayName("equal consecutive reports are sent once")
        void diffSuppression() {
            aConnection.emitDiagnostics(new AnalysisErrors(F, List.of(err1)));
            aConnection.emitDiagnostics(new AnalysisErrors(F, List.of(err1)));
            aConnection.emitDiagnostics(new AnalysisErrors(F, List.of(err1, err2)));

            var changes = sent(HostNotification.DiagnosticsChanged.class);
            assertEquals(2, changes.size());
            assertEquals(List.of(err1), changes.get(0).errors());
            assertEquals(List.of(err1, err2), changes.get(1).errors());
            assertEquals(1.0, registry.find("lintmux.diagnostics.updates").tag("result", "suppressed")
                    .counter().count());
        }

        @Test
        @DisplayName("children are merged without accumulating repeats")
        void mergedAcrossChildren() {
            aConnection.emitDiagnostics(new AnalysisErrors(F, List.of(err1)));
            bConnection.emitDiagnostics(new AnalysisErrors(F, List.of(err2)));
            aConnection.emitDiagnostics(new AnalysisErrors(F, List.of(err1)));

            var changes = sent(HostNotification.DiagnosticsChanged.class);
            assertEquals(2, changes.size());
            assertEquals(List.of(err1, err2), changes.get(1).errors());
            assertEquals(List.of(err1, err2), relay.mergedDiagnostics(F));
        }

        @Test
        @DisplayName("a disposed child's diagnostics are withdrawn")
        void withdrawnOnDispose() {
            aConnection.emitDiagnostics(new AnalysisErrors(F, List.of(err1)));
            bConnection.emitDiagnostics(new AnalysisErrors(F, List.of(err2)));

            LinkFixtures.dispose(a);
            relay.linkDisposed(a);

            var changes = sent(HostNotification.DiagnosticsChanged.class);
            assertEquals(List.of(err2), changes.get(changes.size() - 1).errors());
        }
    }

    @Nested
    @DisplayName("during the handshake")
    class HandshakeTests {

        private FakeChildConnection connection;
        private ChildLink starting;

        @BeforeEach
        void startLink() {
            connection = new FakeChildConnection();
            starting = LinkFixtures.starting("/ws/a", "early", connection);
            relay.linkStarted(starting);
        }

        @Test
        @DisplayName("events are held until the child is ready, then replayed in order")
        void replayedOnReady() {
            connection.emitDiagnostics(new AnalysisErrors(F, List.of(err1)));
            connection.emitLog("indexing");
            assertTrue(sent.isEmpty());

            LinkFixtures.markReady(starting);
            relay.linkReady(starting);

            assertEquals(2, sent.size());
            var change = assertInstanceOf(HostNotification.DiagnosticsChanged.class, sent.get(0));
            assertEquals(List.of(err1), change.errors());
            assertEquals("[early] indexing", assertInstanceOf(HostNotification.Print.class, sent.get(1)).message());
            assertEquals(List.of(err1), relay.mergedDiagnostics(F));
        }

        @Test
        @DisplayName("events of a failed handshake are discarded")
        void discardedOnFailure() {
            connection.emitDiagnostics(new AnalysisErrors(F, List.of(err1)));

            LinkFixtures.markFailed(starting, "incompatible");
            relay.linkFailed(starting);
            connection.emitDiagnostics(new AnalysisErrors(F, List.of(err2)));

            assertTrue(sent.isEmpty());
            assertTrue(relay.mergedDiagnostics(F).isEmpty());
        }
    }

    @Test
    @DisplayName("log lines are labelled with the child's name")
    void logs() {
        aConnection.emitLog("first\n\nthird");

        var prints = sent(HostNotification.Print.class);
        assertEquals(1, prints.size());
        assertEquals("[naming] first\n[naming]\n[naming] third", prints.get(0).message());
        assertTrue(sent(HostNotification.DiagnosticsChanged.class).isEmpty());
    }

    @Test
    @DisplayName("internal errors become plugin errors")
    void errors() {
        bConnection.emitError(new ChildFailure("Null check operator", "#0 main"));

        var errors = sent(HostNotification.PluginError.class);
        assertEquals(1, errors.size());
        assertEquals(b.identity(), errors.get(0).child());
        assertTrue(errors.get(0).message().contains("Null check operator"));
        assertEquals("#0 main", errors.get(0).stackTrace());
        assertFalse(errors.get(0).isFatal());
    }

    @Test
    @DisplayName("unknown notifications pass through, handled kinds do not")
    void passthrough() {
        var params = objectMapper.createObjectNode().put("done", 3);
        aConnection.emitNotification("custom.progress", params);
        aConnection.emitNotification(HostNotification.DIAGNOSTICS_METHOD, objectMapper.createObjectNode());
        aConnection.emitNotification(HostNotification.PRINT_METHOD, objectMapper.createObjectNode());

        var passthrough = sent(HostNotification.Passthrough.class);
        assertEquals(1, passthrough.size());
        assertEquals("custom.progress", passthrough.get(0).method());
        assertSame(params, passthrough.get(0).params());
    }

    @Test
    @DisplayName("disposal cancels the four subscriptions")
    void subscriptionsCancelled() {
        assertEquals(4, aConnection.listenerCount());

        LinkFixtures.dispose(a);

        assertEquals(0, aConnection.listenerCount());
    }

    @Test
    @DisplayName("events queued before disposal are dropped")
    void queuedEventsDropped() {
        var queued = new ArrayList<Runnable>();
        var bus = new NotificationBus();
        var received = new ArrayList<HostNotification>();
        bus.subscribeAll(received::add);
        var deferredRelay = new NotificationRelay(new OrchestratorLoop(queued::add), bus, null);
        var connection = new FakeChildConnection();
        var link = LinkFixtures.ready("/ws/c", "late", connection);
        deferredRelay.linkStarted(link);
        deferredRelay.linkReady(link);

        connection.emitLog("hello");
        LinkFixtures.dispose(link);
        queued.forEach(Runnable::run);

        assertTrue(received.isEmpty());
    }
}
