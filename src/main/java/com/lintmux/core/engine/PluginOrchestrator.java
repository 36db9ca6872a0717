package com.lintmux.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lintmux.child.ChildLink;
import com.lintmux.child.ChildProperties;
import com.lintmux.child.LinkManager;
import com.lintmux.core.broadcast.ChildResponse;
import com.lintmux.core.broadcast.RequestBroadcaster;
import com.lintmux.core.broadcast.ResultMerger;
import com.lintmux.core.logging.MdcContext;
import com.lintmux.core.model.AnalysisErrors;
import com.lintmux.core.model.ProtocolVersion;
import com.lintmux.core.model.VersionCheckParams;
import com.lintmux.core.model.VersionRange;
import com.lintmux.core.model.WorkspaceRoot;
import com.lintmux.core.protocol.ErrorCode;
import com.lintmux.core.protocol.HostRequest;
import com.lintmux.core.protocol.HostRequestException;
import com.lintmux.core.protocol.HostResult;
import com.lintmux.core.protocol.Methods;
import com.lintmux.core.relay.NotificationRelay;
import com.lintmux.core.scheduler.OrchestratorLoop;
import com.lintmux.core.state.ReactiveStore;
import com.lintmux.core.state.StateKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Entry point for every host request.
 *
 * <p>State-changing requests update the {@link ReactiveStore} and forward to
 * the children they concern; queries are broadcast and merged per kind. A
 * child's failure never fails the request, it only goes missing from the
 * merged answer. Invalid parameters fail the request with a
 * {@link HostRequestException}.
 */
@Service
public class PluginOrchestrator implements HostRequest.Visitor<CompletableFuture<HostResult>> {

    private static final Logger log = LoggerFactory.getLogger(PluginOrchestrator.class);

    private final ReactiveStore store;
    private final LinkManager linkManager;
    private final RequestBroadcaster broadcaster;
    private final ResultMerger merger;
    private final NotificationRelay relay;
    private final OrchestratorLoop loop;
    private final ObjectMapper objectMapper;
    private final PluginProperties properties;
    private final Duration shutdownTimeout;

    private boolean started;
    private volatile boolean shutDown;

    public PluginOrchestrator(ReactiveStore store, LinkManager linkManager, RequestBroadcaster broadcaster,
                              ResultMerger merger, NotificationRelay relay, OrchestratorLoop loop,
                              ObjectMapper objectMapper, PluginProperties properties,
                              ChildProperties childProperties) {
        this.store = store;
        this.linkManager = linkManager;
        this.broadcaster = broadcaster;
        this.merger = merger;
        this.relay = relay;
        this.loop = loop;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.shutdownTimeout = Duration.ofSeconds(childProperties.getShutdownTimeoutSeconds());
    }

    /**
     * Wires the relay to the link manager and starts following the active
     * child set.
     */
    public CompletableFuture<Void> start() {
        return loop.submit(() -> {
            if (!started) {
                started = true;
                linkManager.addListener(relay);
                linkManager.start();
                log.info("Orchestrator started as {} {}", properties.getName(), properties.getVersion());
            }
            return CompletableFuture.completedFuture(null);
        });
    }

    /**
     * Handles one host request on the orchestrator loop.
     */
    public CompletableFuture<HostResult> handle(HostRequest request) {
        return loop.submit(() -> {
            if (shutDown) {
                throw new HostRequestException(ErrorCode.SHUT_DOWN,
                        "Request " + request.method() + " received after shutdown");
            }
            MdcContext.setRequest(request.method());
            try {
                log.debug("Handling {}", request.method());
                return request.accept(this);
            } finally {
                MdcContext.clear();
            }
        });
    }

    public boolean isShutDown() {
        return shutDown;
    }

    // -- State-changing requests --

    @Override
    public CompletableFuture<HostResult> visit(HostRequest.SetContextRoots request) {
        List<WorkspaceRoot> roots = require(request.roots(), "roots");
        for (WorkspaceRoot root : roots) {
            if (root == null || root.root() == null || root.root().isBlank()) {
                throw invalid("Every context root needs a 'root' path");
            }
        }
        store.setInput(StateKeys.CONTEXT_ROOTS, List.copyOf(roots));
        return acknowledged();
    }

    @Override
    public CompletableFuture<HostResult> visit(HostRequest.SetPriorityFiles request) {
        List<String> files = List.copyOf(require(request.files(), "files"));
        store.setInput(StateKeys.PRIORITY_FILES, files);
        return broadcaster.broadcastEach(Methods.SET_PRIORITY_FILES,
                        link -> toTree(new HostRequest.SetPriorityFiles(link.coveredFiles(files))))
                .thenApply(responses -> HostResult.Acknowledged.INSTANCE);
    }

    @Override
    public CompletableFuture<HostResult> visit(HostRequest.SetSubscriptions request) {
        Map<String, List<String>> subscriptions = require(request.subscriptions(), "subscriptions");
        store.setInput(StateKeys.SUBSCRIPTIONS, Map.copyOf(subscriptions));
        return broadcaster.broadcast(Methods.SET_SUBSCRIPTIONS, toTree(request))
                .thenApply(responses -> HostResult.Acknowledged.INSTANCE);
    }

    /**
     * Each child only receives the overlays of files inside its roots, and
     * nothing when there are none.
     */
    @Override
    public CompletableFuture<HostResult> visit(HostRequest.UpdateContent request) {
        Map<String, JsonNode> files = require(request.files(), "files");
        return broadcaster.broadcastEach(Methods.UPDATE_CONTENT, link -> {
            var covered = new LinkedHashMap<String, JsonNode>();
            files.forEach((file, overlay) -> {
                if (link.covers(file)) covered.put(file, overlay);
            });
            return covered.isEmpty() ? null : toTree(new HostRequest.UpdateContent(covered));
        }).thenApply(responses -> HostResult.Acknowledged.INSTANCE);
    }

    @Override
    public CompletableFuture<HostResult> visit(HostRequest.HandleWatchEvents request) {
        require(request.events(), "events");
        return broadcaster.broadcast(Methods.HANDLE_WATCH_EVENTS, toTree(request))
                .thenApply(responses -> HostResult.Acknowledged.INSTANCE);
    }

    // -- Queries --

    @Override
    public CompletableFuture<HostResult> visit(HostRequest.GetDiagnostics request) {
        List<String> files = request.files() == null ? List.of() : request.files();
        var requested = new HashSet<>(files);
        return broadcaster.broadcast(Methods.GET_DIAGNOSTICS, toTree(new HostRequest.GetDiagnostics(files)))
                .thenApply(responses -> {
                    List<AnalysisErrors> lints = merger.mergeDiagnostics(responses);
                    if (!requested.isEmpty()) {
                        lints = lints.stream().filter(errors -> requested.contains(errors.file())).toList();
                    }
                    return new HostResult.DiagnosticsResult(lints);
                });
    }

    @Override
    public CompletableFuture<HostResult> visit(HostRequest.GetFixes request) {
        requireLocation(request.file(), request.offset(), 0);
        return forFile(request.file(), Methods.GET_FIXES, request)
                .thenApply(responses -> new HostResult.FixesResult(merger.concat(responses, "fixes")));
    }

    @Override
    public CompletableFuture<HostResult> visit(HostRequest.GetAssists request) {
        requireLocation(request.file(), request.offset(), request.length());
        return forFile(request.file(), Methods.GET_ASSISTS, request)
                .thenApply(responses -> new HostResult.AssistsResult(merger.concat(responses, "assists")));
    }

    @Override
    public CompletableFuture<HostResult> visit(HostRequest.GetAvailableRefactorings request) {
        requireLocation(request.file(), request.offset(), request.length());
        return forFile(request.file(), Methods.GET_AVAILABLE_REFACTORINGS, request)
                .thenApply(responses -> new HostResult.RefactoringKindsResult(merger.union(responses, "kinds")));
    }

    @Override
    public CompletableFuture<HostResult> visit(HostRequest.GetRefactoring request) {
        requireLocation(request.file(), request.offset(), request.length());
        if (request.kind() == null || request.kind().isBlank()) {
            throw invalid("Missing refactoring 'kind'");
        }
        return forFile(request.file(), Methods.GET_REFACTORING, request)
                .thenApply(responses -> new HostResult.RefactoringResult(merger.first(responses)));
    }

    @Override
    public CompletableFuture<HostResult> visit(HostRequest.GetNavigation request) {
        requireLocation(request.file(), request.offset(), request.length());
        return forFile(request.file(), Methods.GET_NAVIGATION, request)
                .thenApply(merger::mergeNavigation);
    }

    @Override
    public CompletableFuture<HostResult> visit(HostRequest.GetCompletions request) {
        requireLocation(request.file(), request.offset(), 0);
        return forFile(request.file(), Methods.GET_COMPLETIONS, request)
                .thenApply(merger::mergeCompletions);
    }

    /**
     * Forwarded to the children covering the file for their side effects; the
     * host gets no entries back.
     */
    @Override
    public CompletableFuture<HostResult> visit(HostRequest.GetKytheEntries request) {
        requireLocation(request.file(), 0, 0);
        return forFile(request.file(), Methods.GET_KYTHE_ENTRIES, request)
                .thenApply(responses -> HostResult.NoResult.INSTANCE);
    }

    // -- Lifecycle --

    /**
     * Records the payload replayed to children starting from now on and reports
     * whether the host's version is accepted.
     */
    @Override
    public CompletableFuture<HostResult> visit(HostRequest.VersionCheck request) {
        ProtocolVersion hostVersion;
        try {
            hostVersion = ProtocolVersion.parse(request.version());
        } catch (IllegalArgumentException e) {
            throw new HostRequestException(ErrorCode.INVALID_PARAMETER,
                    "Invalid host version: " + e.getMessage(), e);
        }
        store.setInput(StateKeys.VERSION_CHECK,
                new VersionCheckParams(request.byteStorePath(), request.sdkPath(), request.version()));

        VersionRange accepted = properties.getAcceptedHostVersions();
        boolean compatible = accepted.contains(hostVersion);
        if (!compatible) {
            log.warn("Host version {} is outside the accepted range {}", hostVersion, accepted);
        }
        return CompletableFuture.completedFuture(new HostResult.VersionCheckResult(
                compatible, properties.getName(), properties.getVersion(),
                List.copyOf(properties.getFileGlobs()), properties.getContactInfo()));
    }

    /**
     * Forwards the shutdown to every READY child, then disposes every link and
     * the store whatever the children answered. Children that have not answered
     * within the shutdown timeout are disposed all the same. Later requests fail
     * with {@link ErrorCode#SHUT_DOWN}.
     */
    @Override
    public CompletableFuture<HostResult> visit(HostRequest.Shutdown request) {
        shutDown = true;
        log.info("Shutting down {} plugins", linkManager.links().size());
        return broadcaster.broadcast(Methods.SHUTDOWN, objectMapper.createObjectNode())
                .completeOnTimeout(List.of(), shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenApplyAsync(responses -> {
                    linkManager.disposeAll();
                    relay.reset();
                    store.dispose();
                    return HostResult.Acknowledged.INSTANCE;
                }, loop);
    }

    private CompletableFuture<List<ChildResponse>> forFile(String file, String method, HostRequest request) {
        JsonNode params = toTree(request);
        Function<ChildLink, JsonNode> paramsFor = link -> link.covers(file) ? params : null;
        return broadcaster.broadcastEach(method, paramsFor);
    }

    private JsonNode toTree(Object value) {
        return objectMapper.valueToTree(value);
    }

    private static CompletableFuture<HostResult> acknowledged() {
        return CompletableFuture.completedFuture(HostResult.Acknowledged.INSTANCE);
    }

    private static <T> T require(T value, String name) {
        if (value == null) {
            throw invalid("Missing parameter '" + name + "'");
        }
        return value;
    }

    private static void requireLocation(String file, int offset, int length) {
        if (file == null || file.isBlank()) {
            throw invalid("Missing parameter 'file'");
        }
        if (offset < 0 || length < 0) {
            throw invalid("Invalid range " + offset + ":" + length + " in " + file);
        }
    }

    private static HostRequestException invalid(String message) {
        return new HostRequestException(ErrorCode.INVALID_PARAMETER, message);
    }
}
