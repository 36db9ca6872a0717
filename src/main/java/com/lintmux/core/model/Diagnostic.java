package com.lintmux.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One issue reported by a child, kept as the child sent it. Only
 * {@code location.file} is read by the orchestrator; every other field travels
 * unchanged to the host and takes part in equality.
 */
public final class Diagnostic {

    private final ObjectNode json;

    private Diagnostic(ObjectNode json) {
        this.json = json;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Diagnostic from(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("A diagnostic must be a JSON object");
        }
        return new Diagnostic(((ObjectNode) json).deepCopy());
    }

    /** An INFO lint at the start of {@code file}. */
    public static Diagnostic of(String file, String code, String message) {
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        json.put("severity", "INFO");
        json.put("type", "LINT");
        json.putObject("location")
                .put("file", file)
                .put("offset", 0)
                .put("length", 0)
                .put("startLine", 1)
                .put("startColumn", 1);
        json.put("message", message);
        json.put("code", code);
        return new Diagnostic(json);
    }

    /** File named by the diagnostic's location, null when absent. */
    public String file() {
        return json.path("location").path("file").asText(null);
    }

    public String code() {
        return json.path("code").asText(null);
    }

    public String message() {
        return json.path("message").asText(null);
    }

    @JsonValue
    public JsonNode json() {
        return json.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Diagnostic other && json.equals(other.json);
    }

    @Override
    public int hashCode() {
        return json.hashCode();
    }

    @Override
    public String toString() {
        return json.toString();
    }
}
