package com.diagnosis.correlation.graph;

import com.diagnosis.correlation.core.model.ModelCollections;
import com.diagnosis.correlation.core.model.Severity;

import java.util.List;
import java.util.Objects;

/**
 * A failure pattern reported by the log analyzer, before it is correlated with procedures.
 *
 * @param type         failure category
 * @param description  pattern description
 * @param severity     reported severity
 * @param confidence   analyzer confidence
 * @param matchedLines sample log lines
 * @param components   component names attached by the analyzer
 */
public record FailurePattern(
        String type,
        String description,
        Severity severity,
        double confidence,
        List<String> matchedLines,
        List<String> components
) {
    public FailurePattern {
        type = type != null && !type.isBlank() ? type : "unknown";
        description = description != null ? description : "";
        Objects.requireNonNull(severity, "severity is required");
        matchedLines = ModelCollections.listCopy(matchedLines);
        components = ModelCollections.listCopy(components);
    }
}
