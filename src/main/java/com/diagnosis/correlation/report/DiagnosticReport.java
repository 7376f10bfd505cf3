package com.diagnosis.correlation.report;

import com.diagnosis.correlation.core.model.ModelCollections;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A compiled diagnostic report. Sections that a format leaves out are null
 * and omitted from the JSON rendering.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiagnosticReport(
        Header reportHeader,
        ExecutiveSummary executiveSummary,
        StatusSection systemStatus,
        DetailedFindings detailedFindings,
        List<Recommendation> recommendations,
        TechnicalAppendix technicalAppendix,
        Metadata reportMetadata,
        List<String> followUpRecommendations
) {
    public DiagnosticReport {
        Objects.requireNonNull(reportHeader, "reportHeader is required");
        Objects.requireNonNull(executiveSummary, "executiveSummary is required");
        Objects.requireNonNull(systemStatus, "systemStatus is required");
        recommendations = ModelCollections.listCopy(recommendations);
        Objects.requireNonNull(reportMetadata, "reportMetadata is required");
        followUpRecommendations = ModelCollections.listCopy(followUpRecommendations);
    }

    public record Header(String reportType, ReportFormat format, String generationTimestamp, String analysisScope) {
    }

    public record ExecutiveSummary(
            SystemStatus systemHealth,
            String confidenceAssessment,
            String dataConsistency,
            int componentsIdentified,
            int failurePatternsDetected,
            int consistencyViolations,
            int criticalIssues,
            int immediateActionsRequired,
            String overallAssessment
    ) {
    }

    public record StatusSection(
            SystemStatus overallStatus,
            double confidenceLevel,
            String consistencyLevel,
            String dataQuality
    ) {
    }

    public record DetailedFindings(
            int totalComponents,
            int highConfidenceComponents,
            int componentsWithFailures,
            int totalPatterns,
            int criticalFailures,
            int patternsWithProcedures,
            double overallConsistencyScore,
            Map<String, Integer> violationsBySeverity,
            int validCrossReferences
    ) {
        public DetailedFindings {
            violationsBySeverity = ModelCollections.mapCopy(violationsBySeverity);
        }
    }

    public record TechnicalAppendix(
            Map<String, Double> consistencyMetrics,
            Map<String, Integer> relationshipTypes,
            double relationshipDensity,
            int clusters,
            int danglingReferences,
            List<String> sourcesAnalyzed
    ) {
        public TechnicalAppendix {
            consistencyMetrics = ModelCollections.mapCopy(consistencyMetrics);
            relationshipTypes = ModelCollections.mapCopy(relationshipTypes);
            sourcesAnalyzed = ModelCollections.listCopy(sourcesAnalyzed);
        }
    }

    public record Metadata(
            String detailLevel,
            int totalComponentsAnalyzed,
            int totalFailurePatterns,
            int consistencyViolations,
            int dataSourcesIntegrated,
            double reportCompleteness,
            Map<String, String> qualityIndicators
    ) {
        public Metadata {
            qualityIndicators = ModelCollections.mapCopy(qualityIndicators);
        }
    }
}
