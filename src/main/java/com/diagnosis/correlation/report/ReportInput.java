package com.diagnosis.correlation.report;

import com.diagnosis.correlation.core.model.FailurePatternCorrelation;
import com.diagnosis.correlation.core.model.ModelCollections;
import com.diagnosis.correlation.graph.CorrelationGraph;
import com.diagnosis.correlation.planning.ResolutionPlan;
import com.diagnosis.correlation.validation.ValidationReport;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a report is compiled from.
 *
 * @param graph           correlation graph of the run
 * @param failures        failure-to-procedure correlations
 * @param analysisSummary the log analyzer's summary, read for its risk level
 * @param validation      validation outcome
 * @param plan            resolution plan, or null when none was produced
 * @param sourcesAnalyzed source types that contributed mentions or failures
 */
public record ReportInput(
        CorrelationGraph graph,
        List<FailurePatternCorrelation> failures,
        Map<String, Object> analysisSummary,
        ValidationReport validation,
        ResolutionPlan plan,
        List<String> sourcesAnalyzed
) {
    public ReportInput {
        Objects.requireNonNull(graph, "graph is required");
        failures = ModelCollections.listCopy(failures);
        analysisSummary = ModelCollections.mapCopy(analysisSummary);
        Objects.requireNonNull(validation, "validation is required");
        sourcesAnalyzed = ModelCollections.listCopy(sourcesAnalyzed);
    }
}
