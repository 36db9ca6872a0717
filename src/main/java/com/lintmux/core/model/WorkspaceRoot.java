package com.lintmux.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * A directory designated by the host for analysis, minus its excluded paths.
 *
 * @param root    absolute root directory
 * @param exclude absolute paths under {@code root} that are not analyzed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkspaceRoot(String root, List<String> exclude) {

    public WorkspaceRoot {
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
    }

    public static WorkspaceRoot of(String root) {
        return new WorkspaceRoot(root, List.of());
    }

    /**
     * True when {@code file} lies strictly under the root and under none of the
     * excluded paths.
     */
    public boolean contains(String file) {
        if (file == null || root == null) return false;
        try {
            Path target = Path.of(file).normalize();
            Path base = Path.of(root).normalize();
            if (!target.startsWith(base) || target.equals(base)) {
                return false;
            }
            for (String excluded : exclude) {
                if (target.startsWith(Path.of(excluded).normalize())) {
                    return false;
                }
            }
            return true;
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
