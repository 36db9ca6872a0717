package com.lintmux.child;

import com.lintmux.core.events.Subscription;
import com.lintmux.core.model.ChildIdentity;
import com.lintmux.core.model.ChildSpec;
import com.lintmux.core.model.LinkState;
import com.lintmux.core.model.WorkspaceRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Exclusive owner of the connection to one child, and of every subscription
 * made on it.
 *
 * <p>State only moves forward: STARTING to READY or FAILED, and any state to
 * DISPOSED. Mutated on the orchestrator loop only.
 */
public class ChildLink {

    private static final Logger log = LoggerFactory.getLogger(ChildLink.class);

    private final ChildSpec spec;
    private final List<Subscription> subscriptions = new ArrayList<>();
    private List<WorkspaceRoot> roots;
    private ChildConnection connection;
    private LinkState state = LinkState.STARTING;
    private ChildFailure failure;

    public ChildLink(ChildSpec spec, List<WorkspaceRoot> roots) {
        this.spec = spec;
        this.roots = List.copyOf(roots);
    }

    public ChildIdentity identity() {
        return spec.identity();
    }

    public String name() {
        return spec.name();
    }

    public ChildSpec spec() {
        return spec;
    }

    public LinkState state() {
        return state;
    }

    public boolean isReady() {
        return state == LinkState.READY;
    }

    public boolean isDisposed() {
        return state == LinkState.DISPOSED;
    }

    /** Error and trace of a failed handshake, null unless FAILED. */
    public ChildFailure failure() {
        return failure;
    }

    public ChildConnection connection() {
        return connection;
    }

    public List<WorkspaceRoot> roots() {
        return roots;
    }

    void attach(ChildConnection connection) {
        this.connection = connection;
    }

    void updateRoots(List<WorkspaceRoot> roots) {
        this.roots = List.copyOf(roots);
    }

    /**
     * True when {@code file} lies inside one of the roots this child applies to.
     */
    public boolean covers(String file) {
        for (WorkspaceRoot root : roots) {
            if (root.contains(file)) return true;
        }
        return false;
    }

    public List<String> coveredFiles(List<String> files) {
        return files.stream().filter(this::covers).toList();
    }

    void markReady() {
        if (state != LinkState.STARTING) {
            throw new IllegalStateException("Link " + identity() + " cannot become READY from " + state);
        }
        state = LinkState.READY;
    }

    void markFailed(ChildFailure failure) {
        if (state != LinkState.STARTING) {
            throw new IllegalStateException("Link " + identity() + " cannot become FAILED from " + state);
        }
        this.failure = failure;
        state = LinkState.FAILED;
    }

    /**
     * Registers a subscription to cancel on {@link #dispose()}. Cancelled at once
     * when the link is already disposed.
     */
    public void own(Subscription subscription) {
        if (state == LinkState.DISPOSED) {
            subscription.unsubscribe();
            return;
        }
        subscriptions.add(subscription);
    }

    /**
     * Cancels every owned subscription and closes the connection.
     */
    void dispose() {
        if (state == LinkState.DISPOSED) return;
        state = LinkState.DISPOSED;
        for (Subscription subscription : subscriptions) {
            try {
                subscription.unsubscribe();
            } catch (Exception e) {
                log.warn("Failed to cancel subscription of {}: {}", identity(), e.getMessage());
            }
        }
        subscriptions.clear();
        if (connection != null) {
            try {
                connection.close();
            } catch (Exception e) {
                log.warn("Failed to close connection of {}: {}", identity(), e.getMessage(), e);
            }
        }
    }

    @Override
    public String toString() {
        return "ChildLink[" + spec.name() + " " + state + "]";
    }
}
