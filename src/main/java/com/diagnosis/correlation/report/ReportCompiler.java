package com.diagnosis.correlation.report;

import com.diagnosis.correlation.core.model.CanonicalEntity;
import com.diagnosis.correlation.core.model.FailurePatternCorrelation;
import com.diagnosis.correlation.core.model.Procedure;
import com.diagnosis.correlation.core.model.ResolutionItem;
import com.diagnosis.correlation.core.model.Severity;
import com.diagnosis.correlation.graph.ComponentClusterer;
import com.diagnosis.correlation.graph.CorrelationGraph;
import com.diagnosis.correlation.graph.RelationshipAnalysis;
import com.diagnosis.correlation.json.JsonSupport;
import com.diagnosis.correlation.planning.ResolutionPlan;
import com.diagnosis.correlation.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges correlation, validation and planning results into a single diagnostic report.
 *
 * <p>The report carries an overall status derived from the log analyzer's risk level,
 * a confidence level combined from the analyses that ran, and a deduplicated,
 * priority-ordered recommendation list.</p>
 */
public class ReportCompiler {
    private static final Logger log = LoggerFactory.getLogger(ReportCompiler.class);

    public static final String REPORT_TYPE = "Comprehensive Instrument Diagnostic Report";
    public static final String ANALYSIS_SCOPE = "Cross-source correlation with consistency validation";

    static final int UNIFIED_RECOMMENDATION_LIMIT = 10;
    static final double DEFAULT_CONFIDENCE = 0.5;
    static final double DECISIVE_RISK_CONFIDENCE = 0.9;
    static final double UNDECIDED_RISK_CONFIDENCE = 0.6;
    static final double CONFIDENCE_CAP = 0.9;

    static final String ASSESSMENT_CRITICAL = "CRITICAL - Immediate attention required";
    static final String ASSESSMENT_CAUTION = "CAUTION - Further investigation recommended";
    static final String ASSESSMENT_ACCEPTABLE = "ACCEPTABLE - Continue monitoring";

    private final ComponentClusterer clusterer;

    public ReportCompiler() {
        this(new ComponentClusterer());
    }

    public ReportCompiler(ComponentClusterer clusterer) {
        this.clusterer = clusterer;
    }

    public DiagnosticReport compile(ReportInput input, ReportFormat format) {
        return compile(input, format, Instant.now());
    }

    /**
     * Compiles a report stamped with the given generation time.
     */
    public DiagnosticReport compile(ReportInput input, ReportFormat format, Instant generatedAt) {
        CorrelationGraph graph = input.graph();
        List<FailurePatternCorrelation> failures = input.failures();
        ValidationReport validation = input.validation();

        SystemStatus status = SystemStatus.fromAnalysisSummary(input.analysisSummary());
        double confidence = confidenceLevel(input);
        double consistency = validation.overallConsistencyScore();

        List<Recommendation> recommendations = compileRecommendations(
                unifiedRecommendations(status, graph.entities(), failures), input.plan());
        int criticalFailures = (int) failures.stream().filter(f -> f.severity() == Severity.CRITICAL).count();
        int immediateActions = (int) recommendations.stream()
                .filter(r -> r.priority() == RecommendationPriority.IMMEDIATE)
                .count();

        DiagnosticReport.Header header = new DiagnosticReport.Header(
                REPORT_TYPE, format, generatedAt.toString(), ANALYSIS_SCOPE);
        DiagnosticReport.ExecutiveSummary summary = new DiagnosticReport.ExecutiveSummary(
                status,
                grade(confidence, "HIGH", "MEDIUM", "LOW"),
                validation.consistencyLevel().name(),
                graph.entities().size(),
                failures.size(),
                validation.violations().size(),
                criticalFailures,
                immediateActions,
                overallAssessment(status, confidence, consistency));
        DiagnosticReport.StatusSection statusSection = new DiagnosticReport.StatusSection(
                status, confidence, validation.consistencyLevel().name(),
                grade((consistency + confidence) / 2, "HIGH", "MEDIUM", "LOW"));

        DiagnosticReport.DetailedFindings findings = null;
        DiagnosticReport.TechnicalAppendix appendix = null;
        List<Recommendation> reported = recommendations;
        if (format == ReportFormat.EXECUTIVE) {
            reported = recommendations.subList(0,
                    Math.min(ReportFormat.EXECUTIVE_RECOMMENDATION_LIMIT, recommendations.size()));
        } else {
            findings = detailedFindings(graph, failures, validation);
        }
        if (format.includesAppendix()) {
            appendix = technicalAppendix(input);
        }

        int sectionsPresent = 3 + (findings != null ? 1 : 0) + (reported.isEmpty() ? 0 : 1);
        DiagnosticReport.Metadata metadata = new DiagnosticReport.Metadata(
                format.detailLevel(),
                graph.entities().size(),
                failures.size(),
                validation.violations().size(),
                input.sourcesAnalyzed().size(),
                sectionsPresent / 5.0,
                qualityIndicators(consistency, confidence, graph.entities().size(), failures.size()));

        DiagnosticReport report = new DiagnosticReport(header, summary, statusSection, findings, reported,
                appendix, metadata, followUpRecommendations(status, confidence));
        log.info("report.compiled format={} status={} recommendations={}",
                format.getWireName(), status, reported.size());
        return report;
    }

    /**
     * Renders a report as snake_case JSON.
     */
    public String toJson(DiagnosticReport report) {
        return JsonSupport.toJson(report);
    }

    /**
     * Mean of the confidence factors of the analyses that ran, or 0.5 when none did.
     */
    double confidenceLevel(ReportInput input) {
        List<Double> factors = new ArrayList<>();
        if (input.analysisSummary().containsKey(SystemStatus.RISK_LEVEL_KEY)) {
            SystemStatus status = SystemStatus.fromAnalysisSummary(input.analysisSummary());
            factors.add(status == SystemStatus.UNCERTAIN ? UNDECIDED_RISK_CONFIDENCE : DECISIVE_RISK_CONFIDENCE);
        }
        if (input.graph().totalMentions() > 0) {
            factors.add(Math.min(CONFIDENCE_CAP, input.graph().correlationRate() + 0.3));
        }
        if (!input.failures().isEmpty()) {
            double withProcedures = input.failures().stream().filter(f -> !f.procedures().isEmpty()).count();
            factors.add(Math.min(CONFIDENCE_CAP, withProcedures / input.failures().size() + 0.2));
        }
        return factors.stream().mapToDouble(Double::doubleValue).average().orElse(DEFAULT_CONFIDENCE);
    }

    List<Recommendation> unifiedRecommendations(SystemStatus status, List<CanonicalEntity> entities,
                                                List<FailurePatternCorrelation> failures) {
        List<Recommendation> recommendations = new ArrayList<>();
        if (status == SystemStatus.FAIL) {
            recommendations.add(new Recommendation(RecommendationPriority.IMMEDIATE, Recommendation.CATEGORY_SAFETY,
                    "Stop instrument operation immediately",
                    "Critical issues detected across multiple data sources", "unified_analysis", null));
        }
        for (CanonicalEntity entity : entities) {
            if (!entity.failureAssociations().isEmpty()) {
                recommendations.add(new Recommendation(RecommendationPriority.HIGH, Recommendation.CATEGORY_COMPONENT,
                        "Investigate " + entity.canonicalName(),
                        "Component has " + entity.failureAssociations().size() + " associated failure patterns",
                        "component_correlation", entity.canonicalName()));
            }
        }
        for (FailurePatternCorrelation failure : failures) {
            boolean severe = failure.severity() == Severity.CRITICAL || failure.severity() == Severity.HIGH;
            if (severe && !failure.procedures().isEmpty()) {
                Procedure procedure = failure.procedures().get(0);
                RecommendationPriority priority = failure.severity() == Severity.CRITICAL
                        ? RecommendationPriority.HIGH : RecommendationPriority.MEDIUM;
                recommendations.add(new Recommendation(priority, Recommendation.CATEGORY_TROUBLESHOOTING,
                        "Execute procedure: " + procedure.title(),
                        "Address " + failure.failurePattern(), "failure_correlation", procedure.title()));
            }
        }
        recommendations.sort(Comparator.comparing(Recommendation::priority));
        return recommendations.subList(0, Math.min(UNIFIED_RECOMMENDATION_LIMIT, recommendations.size()));
    }

    /**
     * Appends the plan's resolutions, keeps the first recommendation per action and
     * orders the result by priority. The sort is stable.
     */
    List<Recommendation> compileRecommendations(List<Recommendation> unified, ResolutionPlan plan) {
        List<Recommendation> all = new ArrayList<>(unified);
        if (plan != null) {
            for (ResolutionItem resolution : plan.resolutions()) {
                all.add(new Recommendation(RecommendationPriority.fromSeverity(resolution.priority()),
                        Recommendation.CATEGORY_CONSISTENCY, resolution.action(), resolution.description(),
                        "consistency_resolution", resolution.violationRef()));
            }
        }
        Set<String> seenActions = new HashSet<>();
        List<Recommendation> unique = new ArrayList<>();
        for (Recommendation recommendation : all) {
            if (seenActions.add(recommendation.action())) {
                unique.add(recommendation);
            }
        }
        unique.sort(Comparator.comparing(Recommendation::priority));
        return unique;
    }

    static String overallAssessment(SystemStatus status, double confidence, double consistency) {
        if (status == SystemStatus.FAIL || confidence < 0.5 || consistency < 0.5) {
            return ASSESSMENT_CRITICAL;
        }
        if (status == SystemStatus.UNCERTAIN || confidence < 0.7 || consistency < 0.7) {
            return ASSESSMENT_CAUTION;
        }
        return ASSESSMENT_ACCEPTABLE;
    }

    static Map<String, String> qualityIndicators(double consistency, double confidence,
                                                 int componentCount, int failureCount) {
        Map<String, String> indicators = new LinkedHashMap<>();
        indicators.put("data_consistency", grade(consistency, "EXCELLENT", "GOOD", "NEEDS_IMPROVEMENT"));
        indicators.put("analysis_confidence", grade(confidence, "HIGH", "MEDIUM", "LOW"));
        String completeness;
        if (componentCount > 5 && failureCount > 3) {
            completeness = "COMPREHENSIVE";
        } else if (componentCount > 2 && failureCount > 1) {
            completeness = "ADEQUATE";
        } else {
            completeness = "LIMITED";
        }
        indicators.put("analysis_completeness", completeness);
        return indicators;
    }

    static List<String> followUpRecommendations(SystemStatus status, double confidence) {
        List<String> followUps = new ArrayList<>();
        if (status == SystemStatus.FAIL) {
            followUps.add("Schedule immediate maintenance intervention");
            followUps.add("Implement continuous monitoring until issues resolved");
        } else if (status == SystemStatus.UNCERTAIN) {
            followUps.add("Perform additional diagnostic tests");
            followUps.add("Increase monitoring frequency");
        }
        if (confidence < 0.7) {
            followUps.add("Collect additional data to improve analysis confidence");
            followUps.add("Consider expert review of findings");
        }
        followUps.add("Schedule follow-up analysis in 24-48 hours");
        followUps.add("Document all maintenance actions taken");
        return followUps;
    }

    private DiagnosticReport.DetailedFindings detailedFindings(CorrelationGraph graph,
                                                               List<FailurePatternCorrelation> failures,
                                                               ValidationReport validation) {
        List<CanonicalEntity> entities = graph.entities();
        ValidationReport.ViolationSummary violations = validation.violationSummary();
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        bySeverity.put(Severity.CRITICAL.name(), violations.criticalViolations());
        bySeverity.put(Severity.HIGH.name(), violations.highViolations());
        bySeverity.put(Severity.MEDIUM.name(), violations.mediumViolations());
        bySeverity.put(Severity.LOW.name(), violations.lowViolations());
        return new DiagnosticReport.DetailedFindings(
                entities.size(),
                (int) entities.stream().filter(e -> e.consistencyScore() > 0.8).count(),
                (int) entities.stream().filter(e -> !e.failureAssociations().isEmpty()).count(),
                failures.size(),
                (int) failures.stream().filter(f -> f.severity() == Severity.CRITICAL).count(),
                (int) failures.stream().filter(f -> !f.procedures().isEmpty()).count(),
                validation.overallConsistencyScore(),
                bySeverity,
                validation.crossReferenceSummary().validReferences());
    }

    private DiagnosticReport.TechnicalAppendix technicalAppendix(ReportInput input) {
        RelationshipAnalysis relationships = RelationshipAnalysis.of(input.graph());
        return new DiagnosticReport.TechnicalAppendix(
                input.validation().metrics().toMap(),
                relationships.relationshipTypes(),
                relationships.relationshipDensity(),
                clusterer.cluster(input.graph()).size(),
                input.graph().danglingReferences().size(),
                input.sourcesAnalyzed());
    }

    private static String grade(double score, String high, String medium, String low) {
        if (score > 0.8) {
            return high;
        }
        return score > 0.6 ? medium : low;
    }
}
