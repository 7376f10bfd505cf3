package com.diagnosis.correlation.source;

import com.diagnosis.correlation.core.model.ModelCollections;

import java.util.List;

/**
 * One top issue reported by the log analyzer.
 *
 * @param type          failure category, {@code unknown} when absent
 * @param description   issue description
 * @param severity      severity label (LOW, MEDIUM, HIGH, CRITICAL)
 * @param confidence    analyzer confidence
 * @param sampleMatches sample log lines that matched
 * @param components    component names the analyzer attached, if any
 */
public record LogIssue(
        String type,
        String description,
        String severity,
        double confidence,
        List<String> sampleMatches,
        List<String> components
) {
    public LogIssue {
        type = type != null && !type.isBlank() ? type : "unknown";
        description = description != null ? description : "";
        severity = severity != null && !severity.isBlank() ? severity : "MEDIUM";
        sampleMatches = ModelCollections.listCopy(sampleMatches);
        components = ModelCollections.listCopy(components);
    }

    public static LogIssue of(String type, String description, String severity, List<String> sampleMatches) {
        return new LogIssue(type, description, severity, 0.5, sampleMatches, List.of());
    }
}
