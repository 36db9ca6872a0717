package com.lintmux.core.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@code major.minor.patch} version. Pre-release and build suffixes are ignored.
 */
public record ProtocolVersion(int major, int minor, int patch) implements Comparable<ProtocolVersion> {

    private static final Pattern VERSION = Pattern.compile("^\\s*(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?.*$");

    public static ProtocolVersion parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Version is missing");
        }
        Matcher m = VERSION.matcher(text);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a version: '" + text + "'");
        }
        return new ProtocolVersion(
                Integer.parseInt(m.group(1)),
                m.group(2) != null ? Integer.parseInt(m.group(2)) : 0,
                m.group(3) != null ? Integer.parseInt(m.group(3)) : 0);
    }

    @Override
    public int compareTo(ProtocolVersion o) {
        if (major != o.major) return Integer.compare(major, o.major);
        if (minor != o.minor) return Integer.compare(minor, o.minor);
        return Integer.compare(patch, o.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
