package com.lintmux.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VersionRangeTest {

    @Test
    void parsesPartialAndSuffixedVersions() {
        assertEquals(new ProtocolVersion(2, 0, 0), ProtocolVersion.parse("2"));
        assertEquals(new ProtocolVersion(1, 4, 0), ProtocolVersion.parse("1.4"));
        assertEquals(new ProtocolVersion(1, 4, 2), ProtocolVersion.parse("1.4.2-dev.1"));
    }

    @Test
    void rejectsNonVersions() {
        assertThrows(IllegalArgumentException.class, () -> ProtocolVersion.parse("latest"));
        assertThrows(IllegalArgumentException.class, () -> ProtocolVersion.parse(null));
    }

    @Test
    void boundsAreInclusive() {
        var range = VersionRange.of("1.0.0", "1.999.0");

        assertTrue(range.contains(ProtocolVersion.parse("1.0.0")));
        assertTrue(range.contains(ProtocolVersion.parse("1.999.0")));
        assertTrue(range.contains(ProtocolVersion.parse("1.20.3")));
        assertFalse(range.contains(ProtocolVersion.parse("0.9.9")));
        assertFalse(range.contains(ProtocolVersion.parse("2.0.0")));
    }
}
