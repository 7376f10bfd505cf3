package com.diagnosis.correlation.mcp;

import com.diagnosis.correlation.api.AnalysisResult;
import com.diagnosis.correlation.api.CorrelationEngine;
import com.diagnosis.correlation.api.CorrelationResult;
import com.diagnosis.correlation.api.EngineResult;
import com.diagnosis.correlation.api.FailureCorrelationResult;
import com.diagnosis.correlation.api.InputValidator;
import com.diagnosis.correlation.api.InvalidInputException;
import com.diagnosis.correlation.core.model.CanonicalEntity;
import com.diagnosis.correlation.core.model.ConsistencyViolation;
import com.diagnosis.correlation.core.model.FailurePatternCorrelation;
import com.diagnosis.correlation.graph.CorrelationGraph;
import com.diagnosis.correlation.json.JsonSupport;
import com.diagnosis.correlation.planning.ImplementationTimeline;
import com.diagnosis.correlation.planning.PrioritizationStrategy;
import com.diagnosis.correlation.planning.ResolutionPlan;
import com.diagnosis.correlation.planning.TimelineBucket;
import com.diagnosis.correlation.report.DiagnosticReport;
import com.diagnosis.correlation.report.RecommendationPriority;
import com.diagnosis.correlation.report.ReportFormat;
import com.diagnosis.correlation.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Builds MCP (Model Context Protocol) tool definitions for the correlation engine.
 * All tools are <strong>read-only</strong>: they analyze their parameters and return a result map.
 *
 * <p>Available tools:</p>
 * <ul>
 *   <li>{@code correlate_components_across_sources} -- resolve component mentions into canonical entities</li>
 *   <li>{@code correlate_failures_to_procedures} -- match failure patterns with troubleshooting procedures</li>
 *   <li>{@code validate_cross_source_consistency} -- run the consistency rules over a correlation result</li>
 *   <li>{@code resolve_consistency_conflicts} -- plan resolutions for consistency violations</li>
 *   <li>{@code generate_comprehensive_diagnostic_report} -- run the whole pipeline and compile a report</li>
 * </ul>
 *
 * <p>A tool never throws; failures are returned as {@code {"error": message}}.</p>
 */
public final class DiagnosisMcpTools {
    private static final Logger log = LoggerFactory.getLogger(DiagnosisMcpTools.class);

    static final String LOG_ANALYSIS_DATA = "log_analysis_data";
    static final String COMPONENT_INVENTORY = "component_inventory";
    static final String DOCUMENT_ANALYSIS = "document_analysis";
    static final String FAILURE_ANALYSIS_DATA = "failure_analysis_data";
    static final String TROUBLESHOOTING_GUIDES = "troubleshooting_guides";
    static final String UNIFIED_ANALYSIS_DATA = "unified_analysis_data";
    static final String CONSISTENCY_VALIDATION_DATA = "consistency_validation_data";
    static final String RESOLUTION_PRIORITY = "resolution_priority";
    static final String REPORT_FORMAT = "report_format";

    private final CorrelationEngine engine;

    public DiagnosisMcpTools(CorrelationEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
    }

    /**
     * Returns all 5 read-only MCP tool definitions.
     */
    public List<McpToolDefinition> getToolDefinitions() {
        return List.of(
                buildCorrelateComponentsTool(),
                buildCorrelateFailuresTool(),
                buildValidateConsistencyTool(),
                buildResolveConflictsTool(),
                buildDiagnosticReportTool()
        );
    }

    /**
     * Finds a tool definition by name.
     */
    public Optional<McpToolDefinition> getTool(String name) {
        return getToolDefinitions().stream()
                .filter(t -> t.name().equals(name))
                .findFirst();
    }

    private McpToolDefinition buildCorrelateComponentsTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", sourceProperties(),
                "required", List.of()
        );

        return new McpToolDefinition(
                "correlate_components_across_sources",
                "Correlate component references across log analysis, component inventory and document analysis. "
                        + "Returns canonical components, their relationships and correlation metrics.",
                schema,
                guarded("Component correlation", params -> {
                    EngineResult<CorrelationResult> result = engine.correlateComponents(
                            McpPayloads.sources(params, LOG_ANALYSIS_DATA, COMPONENT_INVENTORY, DOCUMENT_ANALYSIS));
                    if (!result.isSuccess()) {
                        return result.toErrorMap();
                    }
                    return correlationMap(result.getValue());
                })
        );
    }

    private McpToolDefinition buildCorrelateFailuresTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        FAILURE_ANALYSIS_DATA, Map.of("type", "object", "description",
                                "Log analysis output with top_issues and categorized_indicators"),
                        TROUBLESHOOTING_GUIDES, Map.of("type", "object", "description",
                                "Document analysis output with structured_sections")
                ),
                "required", List.of(FAILURE_ANALYSIS_DATA, TROUBLESHOOTING_GUIDES)
        );

        return new McpToolDefinition(
                "correlate_failures_to_procedures",
                "Correlate failure patterns found in logs with documented troubleshooting procedures.",
                schema,
                guarded("Failure-procedure correlation", params -> {
                    InputValidator.requireNonNull(params.get(FAILURE_ANALYSIS_DATA), FAILURE_ANALYSIS_DATA);
                    InputValidator.requireNonNull(params.get(TROUBLESHOOTING_GUIDES), TROUBLESHOOTING_GUIDES);
                    EngineResult<FailureCorrelationResult> result = engine.correlateFailures(
                            McpPayloads.logAnalysis(params.get(FAILURE_ANALYSIS_DATA), FAILURE_ANALYSIS_DATA),
                            McpPayloads.documents(params.get(TROUBLESHOOTING_GUIDES), TROUBLESHOOTING_GUIDES));
                    if (!result.isSuccess()) {
                        return result.toErrorMap();
                    }
                    return failureCorrelationMap(result.getValue());
                })
        );
    }

    private McpToolDefinition buildValidateConsistencyTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        UNIFIED_ANALYSIS_DATA, Map.of("type", "object", "description",
                                "Object with unified_analysis.component_correlations and "
                                        + "unified_analysis.failure_correlations")
                ),
                "required", List.of(UNIFIED_ANALYSIS_DATA)
        );

        return new McpToolDefinition(
                "validate_cross_source_consistency",
                "Validate consistency across all data sources and identify violations with severities.",
                schema,
                guarded("Consistency validation", params -> {
                    Map<String, Object> data = McpPayloads.payload(params.get(UNIFIED_ANALYSIS_DATA),
                            UNIFIED_ANALYSIS_DATA);
                    Map<String, Object> unified = InputValidator.requireMap(data, "unified_analysis");
                    List<CanonicalEntity> entities = McpPayloads.items(
                            unified.get("component_correlations"), CanonicalEntity.class, "component_correlations");
                    List<FailurePatternCorrelation> failures = McpPayloads.items(
                            unified.get("failure_correlations"), FailurePatternCorrelation.class,
                            "failure_correlations");
                    CorrelationGraph graph = new CorrelationGraph(entities, List.of(), List.of(), Map.of(),
                            entities.size());

                    EngineResult<ValidationReport> result = engine.validate(graph, failures);
                    if (!result.isSuccess()) {
                        return result.toErrorMap();
                    }
                    return validationMap(result.getValue());
                })
        );
    }

    private McpToolDefinition buildResolveConflictsTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        CONSISTENCY_VALIDATION_DATA, Map.of("type", "object", "description",
                                "Output of validate_cross_source_consistency"),
                        RESOLUTION_PRIORITY, Map.of("type", "string", "description",
                                "Prioritization strategy (critical_first, high_impact, quick_wins)")
                ),
                "required", List.of(CONSISTENCY_VALIDATION_DATA)
        );

        return new McpToolDefinition(
                "resolve_consistency_conflicts",
                "Generate prioritized resolution recommendations for consistency violations.",
                schema,
                guarded("Conflict resolution", params -> {
                    Map<String, Object> data = McpPayloads.payload(params.get(CONSISTENCY_VALIDATION_DATA),
                            CONSISTENCY_VALIDATION_DATA);
                    PrioritizationStrategy strategy = PrioritizationStrategy.fromWireName(McpPayloads.string(
                            params, RESOLUTION_PRIORITY, PrioritizationStrategy.CRITICAL_FIRST.getWireName()));
                    List<ConsistencyViolation> violations = McpPayloads.items(
                            data.get("violations_found"), ConsistencyViolation.class, "violations_found");

                    EngineResult<ResolutionPlan> result = engine.planResolutions(violations, strategy);
                    if (!result.isSuccess()) {
                        return result.toErrorMap();
                    }
                    return planMap(result.getValue());
                })
        );
    }

    private McpToolDefinition buildDiagnosticReportTool() {
        Map<String, Object> properties = new LinkedHashMap<>(sourceProperties());
        properties.put(REPORT_FORMAT, Map.of("type", "string", "description",
                "Report format (comprehensive, executive, technical)"));
        properties.put(RESOLUTION_PRIORITY, Map.of("type", "string", "description",
                "Prioritization strategy (critical_first, high_impact, quick_wins)"));
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", properties,
                "required", List.of()
        );

        return new McpToolDefinition(
                "generate_comprehensive_diagnostic_report",
                "Run correlation, validation and resolution planning over all sources and compile "
                        + "a diagnostic report in the requested format.",
                schema,
                guarded("Comprehensive report generation", params -> {
                    ReportFormat format = ReportFormat.fromWireName(McpPayloads.string(
                            params, REPORT_FORMAT, engine.getOptions().getReportFormat().getWireName()));
                    PrioritizationStrategy strategy = PrioritizationStrategy.fromWireName(McpPayloads.string(
                            params, RESOLUTION_PRIORITY, engine.getOptions().getPrioritizationStrategy().getWireName()));
                    EngineResult<AnalysisResult> result = engine.analyze(
                            McpPayloads.sources(params, LOG_ANALYSIS_DATA, COMPONENT_INVENTORY, DOCUMENT_ANALYSIS),
                            strategy, format);
                    if (!result.isSuccess()) {
                        return result.toErrorMap();
                    }
                    return reportMap(result.getValue());
                })
        );
    }

    // ========== Result maps ==========

    private static Map<String, Object> correlationMap(CorrelationResult result) {
        CorrelationGraph graph = result.graph();
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("component_correlations", JsonSupport.toList(graph.entities()));
        map.put("relationships", JsonSupport.toList(graph.edges()));
        map.put("dangling_references", JsonSupport.toList(graph.danglingReferences()));
        map.put("consistency_metrics", result.consistencyMetrics());
        map.put("correlation_summary", JsonSupport.toMap(result.summary()));
        map.put("relationship_analysis", JsonSupport.toMap(result.relationshipAnalysis()));
        map.put("relationship_matrix", result.relationshipAnalysis().relationshipMatrix());
        map.put("component_clusters", JsonSupport.toList(result.clusters()));
        return map;
    }

    private static Map<String, Object> failureCorrelationMap(FailureCorrelationResult result) {
        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("failure_patterns_analyzed", result.patternsAnalyzed());
        statistics.put("procedures_analyzed", result.proceduresAnalyzed());
        statistics.put("correlations_found", result.correlations().size());
        statistics.put("correlation_rate", result.correlationRate());
        statistics.put("avg_correlation_strength", result.avgCorrelationStrength());
        statistics.put("correlation_threshold", result.threshold());

        Map<String, Object> bySeverity = new LinkedHashMap<>();
        result.correlationsBySeverity().forEach((severity, correlations) ->
                bySeverity.put(severity.name(), JsonSupport.toList(correlations)));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("failure_correlations", JsonSupport.toList(result.correlations()));
        map.put("correlation_statistics", statistics);
        map.put("correlations_by_severity", bySeverity);
        return map;
    }

    private static Map<String, Object> validationMap(ValidationReport report) {
        Map<String, Object> validation = new LinkedHashMap<>();
        validation.put("overall_consistency_score", report.overallConsistencyScore());
        validation.put("consistency_level", report.consistencyLevel().name());
        validation.put("meets_threshold", report.meetsThreshold());
        validation.put("consistency_threshold", report.consistencyThreshold());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("components_analyzed", report.componentsAnalyzed());
        metadata.put("failures_analyzed", report.failuresAnalyzed());

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("consistency_validation", validation);
        map.put("consistency_metrics", report.metrics().toMap());
        map.put("violations_found", JsonSupport.toList(report.violations()));
        map.put("cross_references", JsonSupport.toList(report.crossReferences()));
        map.put("violation_summary", JsonSupport.toMap(report.violationSummary()));
        map.put("cross_reference_summary", JsonSupport.toMap(report.crossReferenceSummary()));
        map.put("validation_metadata", metadata);
        return map;
    }

    private static Map<String, Object> planMap(ResolutionPlan plan) {
        Map<String, Object> resolutionPlan = new LinkedHashMap<>();
        resolutionPlan.put("total_resolutions", plan.resolutions().size());
        resolutionPlan.put("resolutions", JsonSupport.toList(plan.resolutions()));
        resolutionPlan.put("prioritization_strategy", plan.strategy().getWireName());
        resolutionPlan.put("status", plan.status());
        resolutionPlan.put("message", plan.message());

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("resolution_plan", resolutionPlan);
        map.put("implementation_timeline", timelineMap(plan.timeline()));
        map.put("resolution_summary", JsonSupport.toMap(plan.summary()));
        map.put("implementation_guidance", JsonSupport.toList(plan.guidance()));
        map.put("violations_processed", plan.violationsProcessed());
        return map;
    }

    private static Map<String, Object> timelineMap(ImplementationTimeline timeline) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (TimelineBucket bucket : TimelineBucket.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("timeframe", bucket.getTimeframe());
            entry.put("resolutions", JsonSupport.toList(timeline.bucket(bucket)));
            map.put(bucket.getWireName(), entry);
        }
        return map;
    }

    private static Map<String, Object> reportMap(AnalysisResult analysis) {
        DiagnosticReport report = analysis.report();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("report_type", report.reportHeader().reportType());
        summary.put("system_status", report.systemStatus().overallStatus().name());
        summary.put("confidence_level", report.systemStatus().confidenceLevel());
        summary.put("total_recommendations", report.recommendations().size());
        summary.put("critical_issues", report.recommendations().stream()
                .filter(r -> r.priority() == RecommendationPriority.IMMEDIATE)
                .count());
        summary.put("report_completeness", report.reportMetadata().reportCompleteness());
        summary.put("generation_timestamp", report.reportHeader().generationTimestamp());

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("run_id", analysis.runId());
        map.put("diagnostic_report", JsonSupport.toMap(report));
        map.put("report_summary", summary);
        map.put("follow_up_recommendations", report.followUpRecommendations());
        return map;
    }

    // ========== Helpers ==========

    private static Map<String, Object> sourceProperties() {
        return Map.of(
                LOG_ANALYSIS_DATA, Map.of("type", "object", "description",
                        "Log analysis output with top_issues, categorized_indicators and analysis_summary"),
                COMPONENT_INVENTORY, Map.of("type", "object", "description",
                        "Component inventory with components, aliases and relationships"),
                DOCUMENT_ANALYSIS, Map.of("type", "object", "description",
                        "Document analysis with structured_sections (procedures, symptoms, troubleshooting_steps)")
        );
    }

    /**
     * Wraps a handler so that parameter errors and unexpected failures become error maps.
     */
    private static Function<Map<String, Object>, Map<String, Object>> guarded(
            String operation, Function<Map<String, Object>, Map<String, Object>> handler) {
        return params -> {
            try {
                return handler.apply(params);
            } catch (InvalidInputException | IllegalArgumentException e) {
                log.warn("mcp.invalid_input operation={} error={}", operation, e.getMessage());
                return errorMap(e.getMessage());
            } catch (RuntimeException e) {
                log.error("mcp.failed operation={} error={}", operation, e.getMessage(), e);
                return errorMap(operation + " failed: " + e.getMessage());
            }
        };
    }

    private static Map<String, Object> errorMap(String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", message);
        return error;
    }
}
