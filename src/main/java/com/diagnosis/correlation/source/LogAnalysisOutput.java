package com.diagnosis.correlation.source;

import com.diagnosis.correlation.core.model.ModelCollections;

import java.util.List;
import java.util.Map;

/**
 * Output of the log analyzer.
 *
 * @param topIssues              ranked issues found in the logs
 * @param categorizedIndicators  indicators grouped by category
 * @param analysisSummary        free-form analyzer summary
 */
public record LogAnalysisOutput(
        List<LogIssue> topIssues,
        Map<String, List<FailureIndicator>> categorizedIndicators,
        Map<String, Object> analysisSummary
) {
    public LogAnalysisOutput {
        topIssues = ModelCollections.listCopy(topIssues);
        categorizedIndicators = ModelCollections.multimapCopy(categorizedIndicators);
        analysisSummary = ModelCollections.mapCopy(analysisSummary);
    }

    public static LogAnalysisOutput empty() {
        return new LogAnalysisOutput(List.of(), Map.of(), Map.of());
    }

    public static LogAnalysisOutput ofIssues(List<LogIssue> issues) {
        return new LogAnalysisOutput(issues, Map.of(), Map.of());
    }

    public boolean isEmpty() {
        return topIssues.isEmpty() && categorizedIndicators.isEmpty();
    }
}
