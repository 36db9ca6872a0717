package com.lintmux.core.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.lintmux.child.ChildLink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Correlates one outgoing request with the children it went to and the
 * outcomes collected so far. Completes once every target answered or failed.
 * Mutated on the orchestrator loop only.
 */
final class PendingBroadcast {

    private final String method;
    private final List<ChildLink> targets;
    private final List<Outcome<JsonNode>> outcomes;
    private final CompletableFuture<List<Outcome<JsonNode>>> completion = new CompletableFuture<>();
    private int remaining;

    PendingBroadcast(String method, List<ChildLink> targets) {
        this.method = method;
        this.targets = List.copyOf(targets);
        this.outcomes = new ArrayList<>(Collections.nCopies(targets.size(), null));
        this.remaining = targets.size();
        if (remaining == 0) {
            completion.complete(List.of());
        }
    }

    String method() {
        return method;
    }

    List<ChildLink> targets() {
        return targets;
    }

    /**
     * Records the outcome of the target at {@code index}. A second outcome for
     * the same target is ignored.
     */
    void record(int index, Outcome<JsonNode> outcome) {
        if (outcomes.get(index) != null) return;
        outcomes.set(index, outcome);
        remaining--;
        if (remaining == 0) {
            completion.complete(List.copyOf(outcomes));
        }
    }

    int remaining() {
        return remaining;
    }

    /** Outcomes in target order, once all are known. */
    CompletableFuture<List<Outcome<JsonNode>>> completion() {
        return completion;
    }
}
