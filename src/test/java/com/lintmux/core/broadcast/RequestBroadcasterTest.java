package com.lintmux.core.broadcast;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lintmux.child.ChildLink;
import com.lintmux.child.FakeChildConnection;
import com.lintmux.child.LinkManager;
import com.lintmux.child.LinkFixtures;
import com.lintmux.core.events.HostNotification;
import com.lintmux.core.events.NotificationBus;
import com.lintmux.core.metrics.LintmuxMetrics;
import com.lintmux.core.protocol.Methods;
import com.lintmux.core.scheduler.OrchestratorLoop;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RequestBroadcasterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private LinkManager linkManager;
    private List<HostNotification> pluginErrors;
    private SimpleMeterRegistry registry;
    private RequestBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        linkManager = mock(LinkManager.class);
        var bus = new NotificationBus();
        pluginErrors = new ArrayList<>();
        bus.subscribe(HostNotification.PLUGIN_ERROR_METHOD, pluginErrors::add);
        registry = new SimpleMeterRegistry();
        broadcaster = new RequestBroadcaster(linkManager, new OrchestratorLoop(Runnable::run), bus,
                new LintmuxMetrics(registry));
    }

    private ChildLink ready(String name, FakeChildConnection connection) {
        return LinkFixtures.ready("/ws/" + name, name, connection);
    }

    @Test
    @DisplayName("zero READY links resolves to an empty result")
    void emptyFanOut() {
        when(linkManager.readyLinks()).thenReturn(List.of());

        var responses = broadcaster.broadcast(Methods.GET_FIXES, objectMapper.createObjectNode()).join();

        assertTrue(responses.isEmpty());
        assertTrue(pluginErrors.isEmpty());
    }

    @Test
    @DisplayName("one failing child is reported and the others still answer")
    void failureIsolation() {
        var a = ready("a", new FakeChildConnection().respond(Methods.GET_FIXES, "{\"fixes\":[1]}"));
        var b = ready("b", new FakeChildConnection().fail(Methods.GET_FIXES, "index out of range"));
        var c = ready("c", new FakeChildConnection().respond(Methods.GET_FIXES, "{\"fixes\":[3]}"));
        when(linkManager.readyLinks()).thenReturn(List.of(a, b, c));

        var responses = broadcaster.broadcast(Methods.GET_FIXES, objectMapper.createObjectNode()).join();

        assertEquals(List.of("a", "c"), responses.stream().map(ChildResponse::name).toList());
        assertEquals(1, pluginErrors.size());
        var error = (HostNotification.PluginError) pluginErrors.get(0);
        assertEquals(b.identity(), error.child());
        assertEquals("The plugin b failed with the error edit.getFixes:\nindex out of range", error.message());
        assertEquals("at fake.Child.handle(child.dart:1)", error.stackTrace());
        assertEquals(1.0, registry.find("lintmux.broadcast.failures").counter().count());
    }

    @Test
    @DisplayName("resolves only once every child answered, keeping link order")
    void waitsForEveryChild() {
        var slow = new FakeChildConnection().hold(Methods.GET_FIXES)
                .respond(Methods.GET_FIXES, "{\"fixes\":[\"slow\"]}");
        var a = ready("a", slow);
        var b = ready("b", new FakeChildConnection());
        when(linkManager.readyLinks()).thenReturn(List.of(a, b));

        var future = broadcaster.broadcast(Methods.GET_FIXES, objectMapper.createObjectNode());
        assertFalse(future.isDone());

        slow.release(Methods.GET_FIXES);

        assertEquals(List.of("a", "b"), future.join().stream().map(ChildResponse::name).toList());
    }

    @Test
    @DisplayName("a child disposed mid-request fails alone and is not reported")
    void disposedMidRequest() {
        var held = new FakeChildConnection().hold(Methods.GET_FIXES);
        var a = ready("a", held);
        var b = ready("b", new FakeChildConnection());
        when(linkManager.readyLinks()).thenReturn(List.of(a, b));

        var future = broadcaster.broadcast(Methods.GET_FIXES, objectMapper.createObjectNode());
        LinkFixtures.dispose(a);

        assertEquals(List.of("b"), future.join().stream().map(ChildResponse::name).toList());
        assertTrue(pluginErrors.isEmpty());
    }

    @Test
    @DisplayName("broadcastEach skips children without params")
    void perChildParams() {
        var aConnection = new FakeChildConnection();
        var bConnection = new FakeChildConnection();
        var a = ready("a", aConnection);
        var b = ready("b", bConnection);
        when(linkManager.readyLinks()).thenReturn(List.of(a, b));

        var responses = broadcaster.broadcastEach(Methods.UPDATE_CONTENT,
                link -> link == a ? objectMapper.createObjectNode().put("only", "a") : null).join();

        assertEquals(1, responses.size());
        assertEquals("a", aConnection.requests(Methods.UPDATE_CONTENT).get(0).params().get("only").asText());
        assertTrue(bConnection.requests().isEmpty());
    }

    @Test
    @DisplayName("records duration and target count")
    void metrics() {
        when(linkManager.readyLinks()).thenReturn(List.of(ready("a", new FakeChildConnection())));

        broadcaster.broadcast(Methods.GET_ASSISTS, objectMapper.createObjectNode()).join();

        assertEquals(1, registry.find("lintmux.broadcast.duration").tag("method", Methods.GET_ASSISTS).timer().count());
        assertEquals(1.0, registry.find("lintmux.broadcast.targets").summary().totalAmount());
    }
}
