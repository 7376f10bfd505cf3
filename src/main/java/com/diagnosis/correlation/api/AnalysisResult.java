package com.diagnosis.correlation.api;

import com.diagnosis.correlation.planning.ResolutionPlan;
import com.diagnosis.correlation.report.DiagnosticReport;
import com.diagnosis.correlation.validation.ValidationReport;

/**
 * Outputs of one full pipeline run, from correlation to the compiled report.
 *
 * @param runId              id shared by every log line of the run
 * @param correlation        component correlation
 * @param failureCorrelation failure-to-procedure correlation
 * @param validation         consistency validation
 * @param plan               resolution plan
 * @param report             compiled report
 */
public record AnalysisResult(
        String runId,
        CorrelationResult correlation,
        FailureCorrelationResult failureCorrelation,
        ValidationReport validation,
        ResolutionPlan plan,
        DiagnosticReport report
) {
}
