package com.lintmux.core.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.lintmux.core.model.AnalysisErrors;

import java.util.List;

/**
 * Typed responses returned to the host, one per request kind.
 */
public sealed interface HostResult {

    /** Response of requests that only change state. */
    record Acknowledged() implements HostResult {
        public static final Acknowledged INSTANCE = new Acknowledged();
    }

    /** Response of requests forwarded to children whose answers are not merged; sent as null. */
    record NoResult() implements HostResult {
        public static final NoResult INSTANCE = new NoResult();
    }

    record DiagnosticsResult(List<AnalysisErrors> lints) implements HostResult {}

    record FixesResult(List<JsonNode> fixes) implements HostResult {}

    record AssistsResult(List<JsonNode> assists) implements HostResult {}

    record RefactoringKindsResult(List<String> kinds) implements HostResult {}

    /**
     * @param result the first child's answer, null when no child offered the refactoring
     */
    record RefactoringResult(JsonNode result) implements HostResult {}

    record NavigationResult(List<String> files, List<JsonNode> targets, List<JsonNode> regions)
            implements HostResult {}

    record CompletionResult(int replacementOffset, int replacementLength, List<JsonNode> results)
            implements HostResult {}

    record VersionCheckResult(
        @JsonProperty("isCompatible") boolean compatible,
        String name,
        String version,
        List<String> interestingFiles,
        String contactInfo
    ) implements HostResult {}
}
