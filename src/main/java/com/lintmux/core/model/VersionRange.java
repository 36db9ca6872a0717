package com.lintmux.core.model;

/**
 * Inclusive range of accepted versions.
 */
public record VersionRange(ProtocolVersion min, ProtocolVersion max) {

    public static VersionRange of(String min, String max) {
        return new VersionRange(ProtocolVersion.parse(min), ProtocolVersion.parse(max));
    }

    public boolean contains(ProtocolVersion version) {
        return version.compareTo(min) >= 0 && version.compareTo(max) <= 0;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
