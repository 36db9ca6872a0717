package com.lintmux.core.model;

import java.util.Objects;

/**
 * Stable key of a child plugin across recomputations of the active set.
 *
 * @param key opaque identity, e.g. {@code /work/app/.lintmux.json#naming_rules}
 */
public record ChildIdentity(String key) implements Comparable<ChildIdentity> {

    public ChildIdentity {
        Objects.requireNonNull(key, "key");
    }

    public static ChildIdentity of(String manifestPath, String pluginName) {
        return new ChildIdentity(manifestPath + "#" + pluginName);
    }

    @Override
    public int compareTo(ChildIdentity other) {
        return key.compareTo(other.key);
    }

    @Override
    public String toString() {
        return key;
    }
}
