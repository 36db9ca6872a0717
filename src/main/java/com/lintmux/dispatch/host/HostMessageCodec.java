package com.lintmux.dispatch.host;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lintmux.core.events.HostNotification;
import com.lintmux.core.protocol.ErrorCode;
import com.lintmux.core.protocol.HostRequest;
import com.lintmux.core.protocol.HostRequestException;
import com.lintmux.core.protocol.HostResult;
import com.lintmux.core.protocol.Methods;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * JSON-lines framing between the host and the orchestrator.
 *
 * <ul>
 *   <li>request: {@code {"id":"1","method":"edit.getFixes","params":{...}}}</li>
 *   <li>response: {@code {"id":"1","result":{...}}} or
 *       {@code {"id":"1","error":{"code":"...","message":"...","stackTrace":"..."}}}</li>
 *   <li>notification: {@code {"event":"analysis.errors","params":{...}}}</li>
 * </ul>
 */
@Component
public class HostMessageCodec {

    private static final Map<String, Class<? extends HostRequest>> REQUEST_TYPES = Map.ofEntries(
            Map.entry(Methods.SET_CONTEXT_ROOTS, HostRequest.SetContextRoots.class),
            Map.entry(Methods.SET_PRIORITY_FILES, HostRequest.SetPriorityFiles.class),
            Map.entry(Methods.SET_SUBSCRIPTIONS, HostRequest.SetSubscriptions.class),
            Map.entry(Methods.UPDATE_CONTENT, HostRequest.UpdateContent.class),
            Map.entry(Methods.HANDLE_WATCH_EVENTS, HostRequest.HandleWatchEvents.class),
            Map.entry(Methods.GET_DIAGNOSTICS, HostRequest.GetDiagnostics.class),
            Map.entry(Methods.GET_FIXES, HostRequest.GetFixes.class),
            Map.entry(Methods.GET_ASSISTS, HostRequest.GetAssists.class),
            Map.entry(Methods.GET_AVAILABLE_REFACTORINGS, HostRequest.GetAvailableRefactorings.class),
            Map.entry(Methods.GET_REFACTORING, HostRequest.GetRefactoring.class),
            Map.entry(Methods.GET_NAVIGATION, HostRequest.GetNavigation.class),
            Map.entry(Methods.GET_COMPLETIONS, HostRequest.GetCompletions.class),
            Map.entry(Methods.GET_KYTHE_ENTRIES, HostRequest.GetKytheEntries.class),
            Map.entry(Methods.VERSION_CHECK, HostRequest.VersionCheck.class));

    private final ObjectMapper objectMapper;

    public HostMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses the framing of one line.
     *
     * @throws HostRequestException when the line is not a JSON object with a method
     */
    public HostMessage parse(String line) {
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new HostRequestException(ErrorCode.INVALID_PARAMETER,
                    "Malformed request: " + e.getOriginalMessage(), e);
        }
        if (message == null || !message.isObject()) {
            throw new HostRequestException(ErrorCode.INVALID_PARAMETER, "Request is not a JSON object");
        }
        String id = message.hasNonNull("id") ? message.get("id").asText() : null;
        String method = message.path("method").asText(null);
        if (method == null || method.isBlank()) {
            throw new HostRequestException(ErrorCode.INVALID_PARAMETER, "Request without a method");
        }
        JsonNode params = message.hasNonNull("params") ? message.get("params") : objectMapper.createObjectNode();
        return new HostMessage(id, method, params);
    }

    /**
     * Binds the params of {@code message} to its request type.
     *
     * @throws HostRequestException for an unknown method or params of the wrong shape
     */
    public HostRequest toRequest(HostMessage message) {
        if (Methods.SHUTDOWN.equals(message.method())) {
            return new HostRequest.Shutdown();
        }
        Class<? extends HostRequest> type = REQUEST_TYPES.get(message.method());
        if (type == null) {
            throw new HostRequestException(ErrorCode.UNKNOWN_REQUEST, "Unknown request " + message.method());
        }
        try {
            return objectMapper.treeToValue(message.params(), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new HostRequestException(ErrorCode.INVALID_PARAMETER,
                    "Invalid params for " + message.method() + ": " + e.getMessage(), e);
        }
    }

    public String encodeResponse(String id, HostResult result) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("id", id);
        if (result instanceof HostResult.Acknowledged) {
            response.set("result", objectMapper.createObjectNode());
        } else if (result instanceof HostResult.NoResult) {
            response.putNull("result");
        } else {
            response.set("result", objectMapper.valueToTree(result));
        }
        return write(response);
    }

    public String encodeError(String id, ErrorCode code, String message, String stackTrace) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("id", id);
        ObjectNode error = response.putObject("error");
        error.put("code", code.name());
        error.put("message", message);
        if (stackTrace != null) {
            error.put("stackTrace", stackTrace);
        }
        return write(response);
    }

    public String encodeNotification(HostNotification notification) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("event", notification.method());
        message.set("params", paramsOf(notification));
        return write(message);
    }

    private JsonNode paramsOf(HostNotification notification) {
        if (notification instanceof HostNotification.Passthrough passthrough) {
            return passthrough.params() != null ? passthrough.params() : objectMapper.nullNode();
        }
        if (notification instanceof HostNotification.PluginError error) {
            ObjectNode params = objectMapper.createObjectNode();
            params.put("isFatal", error.isFatal());
            params.put("plugin", error.child() != null ? error.child().key() : null);
            params.put("message", error.message());
            params.put("stackTrace", error.stackTrace());
            return params;
        }
        return objectMapper.valueToTree(notification);
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode host message: " + e.getMessage(), e);
        }
    }
}
