package com.lintmux.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Version-check payload sent by the host and replayed to every child handshake.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VersionCheckParams(
    String byteStorePath,
    String sdkPath,
    String version
) {}
