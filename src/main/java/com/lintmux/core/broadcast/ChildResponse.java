package com.lintmux.core.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.lintmux.core.model.ChildIdentity;

/**
 * A successful answer of one child.
 *
 * @param child  the child that answered
 * @param name   its display name
 * @param result the raw result, may be {@code null} or a JSON null
 */
public record ChildResponse(ChildIdentity child, String name, JsonNode result) {}
