package com.lintmux.dispatch.cli;

import com.lintmux.core.engine.PluginOrchestrator;
import com.lintmux.core.health.HealthCheckService;
import com.lintmux.core.health.HealthStatus;
import com.lintmux.core.model.WorkspaceRoot;
import com.lintmux.core.protocol.HostRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: lintmux health &lt;root&gt;...
 * <p>
 * Starts the plugins of the given roots, waits for their handshakes and
 * reports the state of each, then shuts them down.
 */
@Command(name = "health", mixinStandardHelpOptions = true,
        description = "Start the plugins of workspace roots and check their health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final PluginOrchestrator orchestrator;
    private final HealthCheckService healthCheckService;

    @Parameters(arity = "1..*", paramLabel = "ROOT", description = "Workspace root directories")
    private List<Path> roots;

    @Option(names = "--wait", defaultValue = "30", description = "Seconds to wait for handshakes (default: ${DEFAULT-VALUE})")
    private int waitSeconds;

    public HealthCommand(PluginOrchestrator orchestrator, HealthCheckService healthCheckService) {
        this.orchestrator = orchestrator;
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() throws Exception {
        ConsoleOutput.printBanner();

        orchestrator.start().join();
        var workspaceRoots = roots.stream()
                .map(path -> WorkspaceRoot.of(path.toAbsolutePath().normalize().toString()))
                .toList();
        orchestrator.handle(new HostRequest.SetContextRoots(workspaceRoots)).join();

        List<HealthStatus> checks = awaitSettled(waitSeconds * 1000L);
        orchestrator.handle(new HostRequest.Shutdown()).join();

        boolean allUp = true;
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.info(label);
                    allUp = false;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all plugins ready");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more plugins not ready");
        return 1;
    }

    private List<HealthStatus> awaitSettled(long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        List<HealthStatus> checks = healthCheckService.checkAll();
        while (isStarting(checks) && System.currentTimeMillis() < deadline) {
            Thread.sleep(200);
            checks = healthCheckService.checkAll();
        }
        return checks;
    }

    private static boolean isStarting(List<HealthStatus> checks) {
        return checks.stream().anyMatch(check -> "STARTING".equals(check.metadata().get("state")));
    }
}
