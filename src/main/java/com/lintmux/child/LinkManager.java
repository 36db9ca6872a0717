package com.lintmux.child;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lintmux.core.events.HostNotification;
import com.lintmux.core.events.NotificationBus;
import com.lintmux.core.events.Subscription;
import com.lintmux.core.logging.MdcContext;
import com.lintmux.core.metrics.LintmuxMetrics;
import com.lintmux.core.model.ChildIdentity;
import com.lintmux.core.model.ChildSpec;
import com.lintmux.core.model.LinkState;
import com.lintmux.core.model.ProtocolVersion;
import com.lintmux.core.model.VersionRange;
import com.lintmux.core.model.WorkspaceRoot;
import com.lintmux.core.protocol.HostRequest;
import com.lintmux.core.protocol.Methods;
import com.lintmux.core.scheduler.OrchestratorLoop;
import com.lintmux.core.state.ActiveChildren;
import com.lintmux.core.state.ReactiveStore;
import com.lintmux.core.state.StateKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;

/**
 * Turns the derived active child set into live {@link ChildLink}s.
 *
 * <p>On every change of {@link StateKeys#ACTIVE_CHILDREN}: identities that
 * appeared get a new link and a handshake, identities that disappeared are
 * disposed, identities present on both sides keep their link untouched (only
 * their context roots are re-sent when those changed). Runs on the
 * orchestrator loop.
 */
@Service
public class LinkManager {

    private static final Logger log = LoggerFactory.getLogger(LinkManager.class);

    private final ChildConnector connector;
    private final ReactiveStore store;
    private final OrchestratorLoop loop;
    private final NotificationBus notificationBus;
    private final ObjectMapper objectMapper;
    private final VersionRange acceptedVersions;
    private final LintmuxMetrics metrics;

    /** Identity to link, in creation order. */
    private final Map<ChildIdentity, ChildLink> links = new LinkedHashMap<>();
    private final List<LinkListener> listeners = new CopyOnWriteArrayList<>();
    private Subscription storeSubscription;

    @Autowired
    public LinkManager(ChildConnector connector, ReactiveStore store, OrchestratorLoop loop,
                       NotificationBus notificationBus, ObjectMapper objectMapper,
                       ChildProperties properties,
                       @Autowired(required = false) LintmuxMetrics metrics) {
        this(connector, store, loop, notificationBus, objectMapper,
                properties.getAcceptedProtocolVersions(), metrics);
    }

    public LinkManager(ChildConnector connector, ReactiveStore store, OrchestratorLoop loop,
                       NotificationBus notificationBus, ObjectMapper objectMapper,
                       VersionRange acceptedVersions, LintmuxMetrics metrics) {
        this.connector = connector;
        this.store = store;
        this.loop = loop;
        this.notificationBus = notificationBus;
        this.objectMapper = objectMapper;
        this.acceptedVersions = acceptedVersions;
        this.metrics = metrics;
    }

    /**
     * Starts following the active child set, creating links for children that
     * are already active.
     */
    public void start() {
        if (storeSubscription != null) return;
        storeSubscription = store.listen(StateKeys.ACTIVE_CHILDREN, this::onActiveChildrenChanged);
        onActiveChildrenChanged(ActiveChildren.EMPTY, store.read(StateKeys.ACTIVE_CHILDREN));
    }

    public void addListener(LinkListener listener) {
        listeners.add(listener);
    }

    /** Every link, whatever its state, in creation order. */
    public Collection<ChildLink> links() {
        return List.copyOf(links.values());
    }

    /** Links that completed their handshake, in creation order. */
    public List<ChildLink> readyLinks() {
        return links.values().stream().filter(ChildLink::isReady).toList();
    }

    public Optional<ChildLink> link(ChildIdentity identity) {
        return Optional.ofNullable(links.get(identity));
    }

    /**
     * Disposes every link and stops following the store.
     */
    public void disposeAll() {
        if (storeSubscription != null) {
            storeSubscription.unsubscribe();
            storeSubscription = null;
        }
        for (ChildIdentity identity : new ArrayList<>(links.keySet())) {
            dispose(identity);
        }
    }

    void onActiveChildrenChanged(ActiveChildren previous, ActiveChildren next) {
        for (ChildIdentity identity : new ArrayList<>(links.keySet())) {
            if (!next.identities().contains(identity)) {
                dispose(identity);
            }
        }

        for (var entry : next.specs().entrySet()) {
            ChildIdentity identity = entry.getKey();
            List<WorkspaceRoot> roots = next.rootsFor(identity);
            ChildLink existing = links.get(identity);
            if (existing == null) {
                startLink(entry.getValue(), roots);
            } else if (!existing.roots().equals(roots)) {
                existing.updateRoots(roots);
                if (existing.isReady()) {
                    resendContextRoots(existing);
                }
            }
        }
    }

    private void startLink(ChildSpec spec, List<WorkspaceRoot> roots) {
        var link = new ChildLink(spec, roots);
        links.put(spec.identity(), link);
        record(LinkState.STARTING);

        MdcContext.setChild(spec.identity(), spec.name());
        try {
            log.info("Starting plugin {} ({})", spec.name(), spec.identity());
            try {
                link.attach(connector.connect(spec));
            } catch (RuntimeException e) {
                fail(link, e);
                return;
            }
            notifyListeners(link, "start", LinkListener::linkStarted);

            handshake(link).whenCompleteAsync((ignored, error) -> {
                if (link.isDisposed()) {
                    log.debug("Handshake of disposed plugin {} completed, ignoring", spec.name());
                    return;
                }
                if (error != null) {
                    fail(link, ChildFailure.unwrap(error));
                } else {
                    ready(link);
                }
            }, loop);
        } finally {
            MdcContext.clearChild();
        }
    }

    /**
     * Version check, then the child's context roots and priority files.
     */
    private CompletableFuture<Void> handshake(ChildLink link) {
        ChildConnection connection = link.connection();
        JsonNode versionCheck = objectMapper.valueToTree(store.read(StateKeys.VERSION_CHECK));
        return connection.sendRequest(Methods.VERSION_CHECK, versionCheck)
                .thenAcceptAsync(response -> verifyCompatible(link, response), loop)
                .thenComposeAsync(v -> connection.sendRequest(Methods.SET_CONTEXT_ROOTS,
                        objectMapper.valueToTree(new HostRequest.SetContextRoots(link.roots()))), loop)
                .thenComposeAsync(v -> connection.sendRequest(Methods.SET_PRIORITY_FILES,
                        objectMapper.valueToTree(new HostRequest.SetPriorityFiles(
                                link.coveredFiles(store.read(StateKeys.PRIORITY_FILES))))), loop)
                .thenAccept(v -> { });
    }

    void verifyCompatible(ChildLink link, JsonNode response) {
        if (response == null || !response.isObject()) {
            throw new IncompatibleChildException("Plugin " + link.name() + " sent no version information");
        }
        if (!response.path("isCompatible").asBoolean(true)) {
            throw new IncompatibleChildException("Plugin " + link.name()
                    + " reported itself incompatible with this host");
        }
        String reported = response.path("version").asText(null);
        ProtocolVersion version;
        try {
            version = ProtocolVersion.parse(reported);
        } catch (IllegalArgumentException e) {
            throw new IncompatibleChildException("Plugin " + link.name() + " reported an invalid version: "
                    + e.getMessage());
        }
        if (!acceptedVersions.contains(version)) {
            throw new IncompatibleChildException("Plugin " + link.name() + " uses protocol version " + version
                    + ", accepted range is " + acceptedVersions);
        }
    }

    private void ready(ChildLink link) {
        link.markReady();
        record(LinkState.READY);
        log.info("Plugin {} is ready", link.name());
        notifyListeners(link, "ready", LinkListener::linkReady);
    }

    private void fail(ChildLink link, Throwable error) {
        var failure = ChildFailure.from(error);
        link.markFailed(failure);
        record(LinkState.FAILED);
        log.warn("Plugin {} failed to start: {}", link.name(), failure.message());
        notificationBus.publish(new HostNotification.PluginError(link.identity(),
                "The plugin " + link.name() + " failed to start: " + failure.message(),
                failure.stackTrace()));
        notifyListeners(link, "failure", LinkListener::linkFailed);
    }

    private void dispose(ChildIdentity identity) {
        ChildLink link = links.remove(identity);
        if (link == null) return;
        link.dispose();
        record(LinkState.DISPOSED);
        log.info("Disposed plugin {}", link.name());
        notifyListeners(link, "disposal", LinkListener::linkDisposed);
    }

    private void notifyListeners(ChildLink link, String transition, BiConsumer<LinkListener, ChildLink> callback) {
        for (LinkListener listener : listeners) {
            try {
                callback.accept(listener, link);
            } catch (Exception e) {
                log.warn("Link listener failed on {} of {}: {}", transition, link.name(), e.getMessage(), e);
            }
        }
    }

    private void resendContextRoots(ChildLink link) {
        log.debug("Context roots of plugin {} changed, updating it", link.name());
        link.connection()
                .sendRequest(Methods.SET_CONTEXT_ROOTS,
                        objectMapper.valueToTree(new HostRequest.SetContextRoots(link.roots())))
                .whenCompleteAsync((ignored, error) -> {
                    if (error != null && !link.isDisposed()) {
                        var failure = ChildFailure.from(ChildFailure.unwrap(error));
                        notificationBus.publish(new HostNotification.PluginError(link.identity(),
                                "The plugin " + link.name() + " failed with the error "
                                        + Methods.SET_CONTEXT_ROOTS + ":\n" + failure.message(),
                                failure.stackTrace()));
                    }
                }, loop);
    }

    private void record(LinkState state) {
        if (metrics != null) {
            metrics.recordLinkTransition(state);
        }
    }
}
