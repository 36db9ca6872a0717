package com.lintmux.core.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lintmux.core.model.AnalysisErrors;
import com.lintmux.core.model.Diagnostic;
import com.lintmux.core.protocol.HostResult.CompletionResult;
import com.lintmux.core.protocol.HostResult.NavigationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Merges the answers of several children into one host result, per request kind.
 *
 * <p>A child whose answer does not have the expected shape contributes nothing.
 */
@Component
public class ResultMerger {

    private static final Logger log = LoggerFactory.getLogger(ResultMerger.class);

    private final ObjectMapper objectMapper;

    public ResultMerger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Per-file merge of {@code {"lints": [{"file": .., "errors": [..]}]}} answers.
     * Diagnostics of a file reported by several children are concatenated in
     * response order; files appear in first-reported order.
     */
    public List<AnalysisErrors> mergeDiagnostics(List<ChildResponse> responses) {
        var byFile = new LinkedHashMap<String, List<Diagnostic>>();
        for (ChildResponse response : responses) {
            for (JsonNode lint : elements(response, "lints")) {
                try {
                    AnalysisErrors errors = objectMapper.treeToValue(lint, AnalysisErrors.class);
                    if (errors.file() == null) continue;
                    byFile.computeIfAbsent(errors.file(), k -> new ArrayList<>()).addAll(errors.errors());
                } catch (JsonProcessingException e) {
                    log.warn("Ignoring malformed diagnostics from plugin {}: {}", response.name(), e.getOriginalMessage());
                }
            }
        }
        return toAnalysisErrors(byFile);
    }

    /**
     * Concatenates the array {@code field} of every answer, e.g. {@code fixes}.
     */
    public List<JsonNode> concat(List<ChildResponse> responses, String field) {
        var merged = new ArrayList<JsonNode>();
        for (ChildResponse response : responses) {
            merged.addAll(elements(response, field));
        }
        return merged;
    }

    /**
     * Order-preserving union of the string array {@code field}.
     */
    public List<String> union(List<ChildResponse> responses, String field) {
        var merged = new LinkedHashSet<String>();
        for (ChildResponse response : responses) {
            for (JsonNode element : elements(response, field)) {
                if (element.isTextual()) {
                    merged.add(element.asText());
                }
            }
        }
        return List.copyOf(merged);
    }

    /**
     * The first answer that is not null, or {@code null}.
     */
    public JsonNode first(List<ChildResponse> responses) {
        for (ChildResponse response : responses) {
            if (response.result() != null && !response.result().isNull()) {
                return response.result();
            }
        }
        return null;
    }

    /**
     * Concatenates navigation answers. Targets refer to files and regions refer
     * to targets by index, so both indices are shifted by the number of entries
     * contributed by earlier children.
     */
    public NavigationResult mergeNavigation(List<ChildResponse> responses) {
        var files = new ArrayList<String>();
        var targets = new ArrayList<JsonNode>();
        var regions = new ArrayList<JsonNode>();
        for (ChildResponse response : responses) {
            int fileOffset = files.size();
            int targetOffset = targets.size();
            for (JsonNode file : elements(response, "files")) {
                files.add(file.asText());
            }
            for (JsonNode target : elements(response, "targets")) {
                if (target instanceof ObjectNode object) {
                    ObjectNode copy = object.deepCopy();
                    copy.put("fileIndex", object.path("fileIndex").asInt() + fileOffset);
                    targets.add(copy);
                }
            }
            for (JsonNode region : elements(response, "regions")) {
                if (region instanceof ObjectNode object) {
                    ObjectNode copy = object.deepCopy();
                    ArrayNode indices = copy.putArray("targets");
                    for (JsonNode index : object.path("targets")) {
                        indices.add(index.asInt() + targetOffset);
                    }
                    regions.add(copy);
                }
            }
        }
        return new NavigationResult(files, targets, regions);
    }

    /**
     * Concatenates suggestions; the replacement range is the first one reported,
     * {@code -1/-1} when none is.
     */
    public CompletionResult mergeCompletions(List<ChildResponse> responses) {
        int offset = -1;
        int length = -1;
        var results = new ArrayList<JsonNode>();
        for (ChildResponse response : responses) {
            JsonNode result = response.result();
            if (result == null || !result.isObject()) continue;
            if (offset < 0 && result.path("replacementOffset").asInt(-1) >= 0) {
                offset = result.path("replacementOffset").asInt();
                length = result.path("replacementLength").asInt(0);
            }
            results.addAll(elements(response, "results"));
        }
        return new CompletionResult(offset, length, results);
    }

    static List<AnalysisErrors> toAnalysisErrors(Map<String, List<Diagnostic>> byFile) {
        var merged = new ArrayList<AnalysisErrors>(byFile.size());
        byFile.forEach((file, errors) -> merged.add(new AnalysisErrors(file, errors)));
        return merged;
    }

    private List<JsonNode> elements(ChildResponse response, String field) {
        JsonNode result = response.result();
        if (result == null || !result.isObject()) {
            return List.of();
        }
        JsonNode array = result.get(field);
        if (array == null || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            log.warn("Ignoring '{}' from plugin {}: expected an array", field, response.name());
            return List.of();
        }
        var elements = new ArrayList<JsonNode>(array.size());
        array.forEach(elements::add);
        return elements;
    }
}
