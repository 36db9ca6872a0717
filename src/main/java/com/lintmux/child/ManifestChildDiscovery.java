package com.lintmux.child;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lintmux.core.model.ChildIdentity;
import com.lintmux.core.model.ChildSpec;
import com.lintmux.core.model.WorkspaceRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Discovers children from a JSON manifest at the top of each workspace root.
 *
 * <pre>
 * {
 *   "plugins": [
 *     { "name": "naming_rules", "command": ["java", "-jar", "tools/naming-rules.jar"], "directory": "tools" }
 *   ]
 * }
 * </pre>
 *
 * A relative {@code directory} resolves against the root; it defaults to the root.
 */
public class ManifestChildDiscovery implements ChildDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ManifestChildDiscovery.class);

    private final ObjectMapper objectMapper;
    private final String manifestName;

    public ManifestChildDiscovery(ObjectMapper objectMapper, String manifestName) {
        this.objectMapper = objectMapper;
        this.manifestName = manifestName;
    }

    @Override
    public List<ChildSpec> discover(WorkspaceRoot root) {
        Path rootDir;
        try {
            rootDir = Path.of(root.root()).toAbsolutePath().normalize();
        } catch (InvalidPathException | NullPointerException e) {
            log.warn("Ignoring workspace root with invalid path: {}", root.root());
            return List.of();
        }

        Path manifest = rootDir.resolve(manifestName);
        if (!Files.isRegularFile(manifest)) {
            return List.of();
        }

        Manifest parsed;
        try {
            parsed = objectMapper.readValue(manifest.toFile(), Manifest.class);
        } catch (IOException e) {
            log.warn("Could not read plugin manifest {}: {}", manifest, e.getMessage());
            return List.of();
        }
        if (parsed.plugins() == null) {
            return List.of();
        }

        var specs = new ArrayList<ChildSpec>();
        for (PluginEntry entry : parsed.plugins()) {
            if (entry.name() == null || entry.name().isBlank()
                    || entry.command() == null || entry.command().isEmpty()) {
                log.warn("Skipping incomplete plugin entry in {}: {}", manifest, entry);
                continue;
            }
            Path directory = entry.directory() == null || entry.directory().isBlank()
                    ? rootDir
                    : rootDir.resolve(entry.directory()).normalize();
            specs.add(new ChildSpec(
                    ChildIdentity.of(manifest.toString(), entry.name()),
                    entry.name(),
                    entry.command(),
                    directory));
        }
        log.debug("Manifest {} declares {} plugins", manifest, specs.size());
        return specs;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Manifest(List<PluginEntry> plugins) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PluginEntry(String name, List<String> command, String directory) {}
}
