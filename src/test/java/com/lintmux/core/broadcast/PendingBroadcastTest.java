package com.lintmux.core.broadcast;

import com.fasterxml.jackson.databind.node.IntNode;
import com.lintmux.child.ChildFailure;
import com.lintmux.child.ChildLink;
import com.lintmux.child.FakeChildConnection;
import com.lintmux.child.LinkFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PendingBroadcastTest {

    private final ChildLink a = LinkFixtures.ready("/ws/a", "a", new FakeChildConnection());
    private final ChildLink b = LinkFixtures.ready("/ws/b", "b", new FakeChildConnection());

    @Test
    void completesImmediatelyWithoutTargets() {
        var pending = new PendingBroadcast("edit.getFixes", List.of());

        assertTrue(pending.completion().isDone());
        assertTrue(pending.completion().join().isEmpty());
    }

    @Test
    void completesInTargetOrderOnceAllOutcomesAreKnown() {
        var pending = new PendingBroadcast("edit.getFixes", List.of(a, b));

        pending.record(1, Outcome.failure(b, new ChildFailure("down", "")));
        assertFalse(pending.completion().isDone());
        assertEquals(1, pending.remaining());

        pending.record(0, Outcome.success(a, IntNode.valueOf(1)));

        var outcomes = pending.completion().join();
        assertInstanceOf(Outcome.Success.class, outcomes.get(0));
        assertInstanceOf(Outcome.Failure.class, outcomes.get(1));
        assertSame(b, outcomes.get(1).link());
    }

    @Test
    void ignoresSecondOutcomeForTheSameTarget() {
        var pending = new PendingBroadcast("edit.getFixes", List.of(a, b));

        pending.record(0, Outcome.success(a, IntNode.valueOf(1)));
        pending.record(0, Outcome.failure(a, new ChildFailure("late", "")));

        assertEquals(1, pending.remaining());
        assertEquals(List.of(a, b), pending.targets());
        assertEquals("edit.getFixes", pending.method());
    }
}
