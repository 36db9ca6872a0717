package com.lintmux.dispatch.host;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One framed request from the host, before its params are bound.
 *
 * @param id     request id echoed in the response, may be null
 * @param method wire method
 * @param params raw params, never null
 */
public record HostMessage(String id, String method, JsonNode params) {}
