package com.lintmux.dispatch.cli;

import com.lintmux.child.ChildDiscovery;
import com.lintmux.core.model.ChildSpec;
import com.lintmux.core.model.WorkspaceRoot;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: lintmux discover &lt;root&gt;...
 * <p>
 * Lists the plugins each workspace root declares, without starting them.
 */
@Command(name = "discover", mixinStandardHelpOptions = true,
        description = "List the plugins declared by workspace roots")
@Component
public class DiscoverCommand implements Callable<Integer> {

    private final ChildDiscovery discovery;

    @Parameters(arity = "1..*", paramLabel = "ROOT", description = "Workspace root directories")
    private List<Path> roots;

    public DiscoverCommand(ChildDiscovery discovery) {
        this.discovery = discovery;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        int total = 0;
        for (Path path : roots) {
            String root = path.toAbsolutePath().normalize().toString();
            List<ChildSpec> specs = discovery.discover(WorkspaceRoot.of(root));
            ConsoleOutput.root(root, specs.size());
            specs.forEach(ConsoleOutput::plugin);
            total += specs.size();
        }
        if (total == 0) {
            ConsoleOutput.error("No plugins declared");
            return 1;
        }
        ConsoleOutput.success(total + " plugin" + (total != 1 ? "s" : "") + " declared");
        return 0;
    }
}
