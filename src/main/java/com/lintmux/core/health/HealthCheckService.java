package com.lintmux.core.health;

import com.lintmux.child.ChildLink;
import com.lintmux.child.LinkManager;
import com.lintmux.core.scheduler.OrchestratorLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final LinkManager linkManager;
    private final OrchestratorLoop loop;

    public HealthCheckService(LinkManager linkManager, OrchestratorLoop loop) {
        this.linkManager = linkManager;
        this.loop = loop;
    }

    /**
     * One status for the orchestrator as a whole followed by one per child.
     */
    public List<HealthStatus> checkAll() {
        List<ChildLink> links;
        try {
            links = loop.submit(() -> CompletableFuture.completedFuture(List.copyOf(linkManager.links())))
                    .get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of(loopDown("interrupted"));
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Health check could not read plugin links: {}", e.getMessage());
            return List.of(loopDown(e.getClass().getSimpleName()));
        }

        var results = new ArrayList<HealthStatus>();
        results.add(checkOrchestrator(links));
        for (ChildLink link : links) {
            results.add(checkLink(link));
        }
        return results;
    }

    private HealthStatus checkOrchestrator(List<ChildLink> links) {
        long ready = links.stream().filter(ChildLink::isReady).count();
        var metadata = Map.of("plugins", String.valueOf(links.size()), "ready", String.valueOf(ready));
        if (links.isEmpty() || ready == links.size()) {
            return new HealthStatus("orchestrator", HealthStatus.Status.UP,
                    ready + " plugins ready", metadata);
        }
        return new HealthStatus("orchestrator", HealthStatus.Status.DEGRADED,
                ready + " of " + links.size() + " plugins ready", metadata);
    }

    private HealthStatus checkLink(ChildLink link) {
        String component = "plugin:" + link.name();
        var metadata = Map.of("identity", link.identity().key(), "state", link.state().name());
        return switch (link.state()) {
            case READY -> new HealthStatus(component, HealthStatus.Status.UP, "Plugin ready", metadata);
            case STARTING -> new HealthStatus(component, HealthStatus.Status.DEGRADED,
                    "Plugin starting", metadata);
            case FAILED -> new HealthStatus(component, HealthStatus.Status.DOWN,
                    "Plugin failed: " + link.failure().message(), metadata);
            case DISPOSED -> new HealthStatus(component, HealthStatus.Status.DOWN,
                    "Plugin disposed", metadata);
        };
    }

    private HealthStatus loopDown(String reason) {
        return new HealthStatus("orchestrator", HealthStatus.Status.DOWN,
                "Orchestrator loop unavailable: " + reason, Map.of());
    }
}
