package com.lintmux.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything needed to start one child plugin.
 *
 * @param identity  stable key of the child
 * @param name      display name used to label its log output
 * @param command   command line launching the child
 * @param directory working directory of the child process
 */
public record ChildSpec(
    ChildIdentity identity,
    String name,
    List<String> command,
    Path directory
) {
    public ChildSpec {
        command = command == null ? List.of() : List.copyOf(command);
    }
}
