package com.diagnosis.correlation.source;

import com.diagnosis.correlation.core.model.ModelCollections;

import java.util.List;

/**
 * A categorized failure indicator from the log analyzer.
 *
 * @param type        failure type; the category name is used when absent
 * @param description indicator description
 * @param severity    severity label
 * @param confidence  analyzer confidence
 * @param sampleLines sample log lines
 */
public record FailureIndicator(
        String type,
        String description,
        String severity,
        double confidence,
        List<String> sampleLines
) {
    public FailureIndicator {
        description = description != null ? description : "";
        severity = severity != null && !severity.isBlank() ? severity : "MEDIUM";
        sampleLines = ModelCollections.listCopy(sampleLines);
    }
}
