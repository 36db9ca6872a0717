package com.lintmux.child;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A raw notification emitted by a child.
 */
public record ChildNotification(String method, JsonNode params) {}
