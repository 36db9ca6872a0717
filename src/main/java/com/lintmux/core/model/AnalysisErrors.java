package com.lintmux.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * The diagnostics of a single file, as reported by a child or sent to the host.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisErrors(String file, List<Diagnostic> errors) {

    public AnalysisErrors {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
