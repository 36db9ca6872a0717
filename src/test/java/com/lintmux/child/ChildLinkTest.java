package com.lintmux.child;

import com.lintmux.core.model.LinkState;
import com.lintmux.core.model.WorkspaceRoot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChildLinkTest {

    private ChildLink link;

    @BeforeEach
    void setUp() {
        link = new ChildLink(MapChildDiscovery.spec("/ws/app", "naming"),
                List.of(new WorkspaceRoot("/ws/app", List.of("/ws/app/build"))));
    }

    @Test
    void startsInStarting() {
        assertEquals(LinkState.STARTING, link.state());
        assertFalse(link.isReady());
        assertNull(link.failure());
    }

    @Test
    void readyIsFinal() {
        link.markReady();

        assertTrue(link.isReady());
        assertThrows(IllegalStateException.class, () -> link.markFailed(new ChildFailure("x", "")));
        assertThrows(IllegalStateException.class, link::markReady);
    }

    @Test
    void failedNeverBecomesReady() {
        link.markFailed(new ChildFailure("incompatible", "trace"));

        assertEquals(LinkState.FAILED, link.state());
        assertEquals("incompatible", link.failure().message());
        assertThrows(IllegalStateException.class, link::markReady);
    }

    @Test
    void anyStateCanBeDisposed() {
        var connection = new FakeChildConnection();
        link.attach(connection);
        link.markFailed(new ChildFailure("x", ""));

        link.dispose();
        link.dispose();

        assertTrue(link.isDisposed());
        assertTrue(connection.isClosed());
    }

    @Test
    void ownAfterDisposeCancelsImmediately() {
        var connection = new FakeChildConnection();
        link.attach(connection);
        link.dispose();

        link.own(connection.onLog(line -> { }));

        assertEquals(0, connection.listenerCount());
    }

    @Test
    void coversFilesUnderItsRootsOnly() {
        assertTrue(link.covers("/ws/app/lib/main.dart"));
        assertFalse(link.covers("/ws/app/build/gen.dart"));
        assertFalse(link.covers("/ws/other/lib/main.dart"));
        assertEquals(List.of("/ws/app/a.dart"),
                link.coveredFiles(List.of("/ws/app/a.dart", "/elsewhere/b.dart")));
    }
}
