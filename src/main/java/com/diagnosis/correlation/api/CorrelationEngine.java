package com.diagnosis.correlation.api;

import com.diagnosis.correlation.cache.CacheConfig;
import com.diagnosis.correlation.cache.NormalizationCache;
import com.diagnosis.correlation.core.model.CanonicalEntity;
import com.diagnosis.correlation.core.model.ConsistencyViolation;
import com.diagnosis.correlation.core.model.FailurePatternCorrelation;
import com.diagnosis.correlation.core.model.Procedure;
import com.diagnosis.correlation.extraction.MentionExtractor;
import com.diagnosis.correlation.extraction.PatternMentionExtractor;
import com.diagnosis.correlation.extraction.SourceMentionCollector;
import com.diagnosis.correlation.graph.ComponentClusterer;
import com.diagnosis.correlation.graph.CorrelationGraph;
import com.diagnosis.correlation.graph.CorrelationGraphBuilder;
import com.diagnosis.correlation.graph.CorrelationMetricsCalculator;
import com.diagnosis.correlation.graph.FailurePattern;
import com.diagnosis.correlation.graph.FailureProcedureCorrelator;
import com.diagnosis.correlation.graph.RelationshipAnalysis;
import com.diagnosis.correlation.graph.RelationshipInferrer;
import com.diagnosis.correlation.logging.LogContext;
import com.diagnosis.correlation.matching.ComponentMatcher;
import com.diagnosis.correlation.matching.ConflictResolver;
import com.diagnosis.correlation.metrics.MetricsService;
import com.diagnosis.correlation.metrics.NoOpMetricsService;
import com.diagnosis.correlation.planning.PrioritizationStrategy;
import com.diagnosis.correlation.planning.ResolutionPlan;
import com.diagnosis.correlation.planning.ResolutionPlanner;
import com.diagnosis.correlation.report.DiagnosticReport;
import com.diagnosis.correlation.report.ReportCompiler;
import com.diagnosis.correlation.report.ReportFormat;
import com.diagnosis.correlation.report.ReportInput;
import com.diagnosis.correlation.rules.ComponentNormalizationRules;
import com.diagnosis.correlation.rules.NormalizationEngine;
import com.diagnosis.correlation.similarity.ComponentNameSimilarity;
import com.diagnosis.correlation.source.DocumentAnalysis;
import com.diagnosis.correlation.source.LogAnalysisOutput;
import com.diagnosis.correlation.source.SourceData;
import com.diagnosis.correlation.source.SourceTypes;
import com.diagnosis.correlation.validation.ConsistencyValidator;
import com.diagnosis.correlation.validation.ValidationContext;
import com.diagnosis.correlation.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Entry point of the correlation pipeline.
 *
 * <p>An engine is an explicit value built by the caller. It holds its collaborators,
 * a private normalization cache and a metrics service; it has no other mutable state,
 * so independent runs may use separate engines, or one engine, concurrently.</p>
 *
 * <p>No operation throws. Empty or malformed input yields an
 * {@link ErrorKind#INVALID_INPUT} result and unexpected failures an
 * {@link ErrorKind#INTERNAL} result.</p>
 *
 * <pre>
 * CorrelationEngine engine = CorrelationEngine.builder()
 *         .options(EngineOptions.defaults())
 *         .build();
 * EngineResult&lt;AnalysisResult&gt; result = engine.analyze(sources);
 * </pre>
 */
public class CorrelationEngine {
    private static final Logger log = LoggerFactory.getLogger(CorrelationEngine.class);

    static final String STAGE_CORRELATION = "correlation";
    static final String STAGE_FAILURE_CORRELATION = "failure_correlation";
    static final String STAGE_VALIDATION = "validation";
    static final String STAGE_PLANNING = "planning";
    static final String STAGE_REPORT = "report";
    static final String STAGE_ANALYSIS = "analysis";

    private final EngineOptions options;
    private final NormalizationEngine normalizationEngine;
    private final CorrelationGraphBuilder graphBuilder;
    private final CorrelationMetricsCalculator metricsCalculator;
    private final ComponentClusterer clusterer;
    private final FailureProcedureCorrelator failureCorrelator;
    private final ConsistencyValidator validator;
    private final ResolutionPlanner planner;
    private final ReportCompiler reportCompiler;
    private final MetricsService metricsService;

    private CorrelationEngine(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        NormalizationCache cache = builder.cacheConfig.createCache();
        this.normalizationEngine = ComponentNormalizationRules.createEngine(cache, metricsService);

        ComponentNameSimilarity similarity = new ComponentNameSimilarity(normalizationEngine);
        MentionExtractor extractor = builder.mentionExtractor != null
                ? builder.mentionExtractor : new PatternMentionExtractor();
        this.graphBuilder = new CorrelationGraphBuilder(
                new SourceMentionCollector(extractor),
                new ComponentMatcher(similarity, options.getMaxMatchesPerSource()),
                new ConflictResolver(),
                new RelationshipInferrer());
        this.metricsCalculator = new CorrelationMetricsCalculator(similarity);
        this.clusterer = new ComponentClusterer();
        this.failureCorrelator = new FailureProcedureCorrelator(extractor);
        this.validator = builder.validator != null ? builder.validator : ConsistencyValidator.createDefault();
        this.planner = builder.planner != null ? builder.planner : new ResolutionPlanner();
        this.reportCompiler = builder.reportCompiler != null ? builder.reportCompiler : new ReportCompiler(clusterer);

        log.info("engine.init options={} cache={}", options, builder.cacheConfig.enabled());
    }

    // ========== Component correlation ==========

    /**
     * Resolves the component mentions of every source into canonical entities and
     * builds the relationship graph between them.
     */
    public EngineResult<CorrelationResult> correlateComponents(SourceData sources) {
        String runId = LogContext.generateRunId();
        return execute(STAGE_CORRELATION, () -> LogContext.forCorrelation(runId),
                () -> doCorrelateComponents(sources));
    }

    private CorrelationResult doCorrelateComponents(SourceData sources) {
        InputValidator.requireSources(sources);
        CorrelationGraph graph = graphBuilder.build(sources, options.getMatchThreshold(),
                options.getCorrelationThreshold(), options.isIncludeInferredRelationships());

        metricsService.incrementEntitiesResolved(graph.entities().size());
        for (CanonicalEntity entity : graph.entities()) {
            entity.confidenceScores().values().forEach(metricsService::recordSimilarityScore);
        }

        return new CorrelationResult(graph,
                metricsCalculator.calculate(graph.entities()),
                CorrelationResult.CorrelationSummary.of(graph),
                RelationshipAnalysis.of(graph),
                clusterer.cluster(graph));
    }

    // ========== Failure correlation ==========

    /**
     * Correlates the failure patterns found in the logs with documented procedures.
     */
    public EngineResult<FailureCorrelationResult> correlateFailures(LogAnalysisOutput logAnalysis,
                                                                    DocumentAnalysis documents) {
        String runId = LogContext.generateRunId();
        return execute(STAGE_FAILURE_CORRELATION, () -> LogContext.forCorrelation(runId),
                () -> doCorrelateFailures(logAnalysis, documents));
    }

    private FailureCorrelationResult doCorrelateFailures(LogAnalysisOutput logAnalysis, DocumentAnalysis documents) {
        InputValidator.requireNonNull(logAnalysis, "logAnalysis");
        InputValidator.requireNonNull(documents, "documents");
        List<FailurePattern> patterns = failureCorrelator.collectFailurePatterns(logAnalysis);
        List<Procedure> procedures = failureCorrelator.collectProcedures(documents);
        List<FailurePatternCorrelation> correlations = failureCorrelator.correlate(patterns, procedures);

        FailureCorrelationResult result = new FailureCorrelationResult(correlations,
                options.getFailureProcedureThreshold(), procedures.size());
        log.info("failures.correlated patterns={} procedures={} correlated={}",
                patterns.size(), procedures.size(), result.correlations().size());
        return result;
    }

    // ========== Validation ==========

    /**
     * Validates the consistency of a correlation graph and its failure correlations.
     * Zero components and zero failures is a vacuous pass.
     */
    public EngineResult<ValidationReport> validate(CorrelationGraph graph,
                                                   List<FailurePatternCorrelation> failures) {
        String runId = LogContext.generateRunId();
        return execute(STAGE_VALIDATION, () -> LogContext.forValidation(runId),
                () -> doValidate(graph, failures));
    }

    private ValidationReport doValidate(CorrelationGraph graph, List<FailurePatternCorrelation> failures) {
        InputValidator.requireNonNull(graph, "graph");
        InputValidator.requireNonNull(failures, "failures");
        ValidationReport report = validator.validate(ValidationContext.of(graph, failures),
                options.getConsistencyThreshold());
        for (ConsistencyViolation violation : report.violations()) {
            metricsService.incrementViolation(violation.violationType(), violation.severity());
        }
        return report;
    }

    // ========== Planning ==========

    /**
     * Plans resolutions with the engine's default prioritization strategy.
     */
    public EngineResult<ResolutionPlan> planResolutions(List<ConsistencyViolation> violations) {
        return planResolutions(violations, options.getPrioritizationStrategy());
    }

    public EngineResult<ResolutionPlan> planResolutions(List<ConsistencyViolation> violations,
                                                        PrioritizationStrategy strategy) {
        String runId = LogContext.generateRunId();
        String strategyName = strategy != null ? strategy.getWireName() : "none";
        return execute(STAGE_PLANNING, () -> LogContext.forPlanning(runId, strategyName),
                () -> doPlan(violations, strategy));
    }

    private ResolutionPlan doPlan(List<ConsistencyViolation> violations, PrioritizationStrategy strategy) {
        InputValidator.requireNonNull(violations, "violations");
        InputValidator.requireNonNull(strategy, "strategy");
        ResolutionPlan plan = planner.plan(violations, strategy);
        metricsService.recordResolutionsPlanned(plan.resolutions().size());
        return plan;
    }

    // ========== Report ==========

    public EngineResult<DiagnosticReport> compileReport(ReportInput input) {
        return compileReport(input, options.getReportFormat());
    }

    public EngineResult<DiagnosticReport> compileReport(ReportInput input, ReportFormat format) {
        String runId = LogContext.generateRunId();
        String formatName = format != null ? format.getWireName() : "none";
        return execute(STAGE_REPORT, () -> LogContext.forReport(runId, formatName), () -> {
            InputValidator.requireNonNull(input, "input");
            InputValidator.requireNonNull(format, "format");
            return reportCompiler.compile(input, format);
        });
    }

    // ========== Full pipeline ==========

    /**
     * Runs the whole pipeline: component correlation, failure correlation, validation,
     * planning and report compilation, under one run id.
     */
    public EngineResult<AnalysisResult> analyze(SourceData sources) {
        return analyze(sources, options.getPrioritizationStrategy(), options.getReportFormat());
    }

    /**
     * Runs the whole pipeline with the given prioritization strategy and report format.
     */
    public EngineResult<AnalysisResult> analyze(SourceData sources, PrioritizationStrategy strategy,
                                                ReportFormat format) {
        String runId = LogContext.generateRunId();
        return execute(STAGE_ANALYSIS, () -> LogContext.forCorrelation(runId).with("pipeline", "analyze"), () -> {
            InputValidator.requireSources(sources);
            InputValidator.requireNonNull(strategy, "strategy");
            InputValidator.requireNonNull(format, "format");
            CorrelationResult correlation = timed(STAGE_CORRELATION, () -> doCorrelateComponents(sources));
            FailureCorrelationResult failures = timed(STAGE_FAILURE_CORRELATION,
                    () -> doCorrelateFailures(sources.logAnalysis(), sources.documentAnalysis()));
            ValidationReport validation = timed(STAGE_VALIDATION,
                    () -> doValidate(correlation.graph(), failures.allCorrelations()));
            ResolutionPlan plan = timed(STAGE_PLANNING,
                    () -> doPlan(validation.violations(), strategy));
            ReportInput reportInput = new ReportInput(correlation.graph(), failures.allCorrelations(),
                    sources.logAnalysis().analysisSummary(), validation, plan, sourcesAnalyzed(sources, correlation));
            DiagnosticReport report = timed(STAGE_REPORT,
                    () -> reportCompiler.compile(reportInput, format));
            log.info("analysis.completed entities={} failures={} violations={} resolutions={}",
                    correlation.componentCorrelations().size(), failures.patternsAnalyzed(),
                    validation.violations().size(), plan.resolutions().size());
            return new AnalysisResult(runId, correlation, failures, validation, plan, report);
        });
    }

    public EngineOptions getOptions() {
        return options;
    }

    public NormalizationEngine getNormalizationEngine() {
        return normalizationEngine;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    private static List<String> sourcesAnalyzed(SourceData sources, CorrelationResult correlation) {
        Set<String> analyzed = new LinkedHashSet<>(correlation.summary().sourcesAnalyzed());
        if (!sources.logAnalysis().isEmpty()) {
            analyzed.add(SourceTypes.LOG_ANALYSIS);
        }
        if (!sources.documentAnalysis().isEmpty()) {
            analyzed.add(SourceTypes.DOCUMENT_ANALYSIS);
        }
        return new ArrayList<>(analyzed);
    }

    private <T> T timed(String stage, Supplier<T> work) {
        long start = System.nanoTime();
        T value = work.get();
        metricsService.recordStageDuration(stage, Duration.ofNanos(System.nanoTime() - start));
        return value;
    }

    private <T> EngineResult<T> execute(String stage, Supplier<LogContext> context, Supplier<T> work) {
        try (LogContext ignored = context.get()) {
            try {
                return EngineResult.success(timed(stage, work));
            } catch (InvalidInputException e) {
                log.warn("engine.invalid_input stage={} error={}", stage, e.getMessage());
                return EngineResult.failure(ErrorKind.INVALID_INPUT, e.getMessage());
            } catch (RuntimeException e) {
                log.error("engine.failed stage={} error={}", stage, e.getMessage(), e);
                return EngineResult.failure(ErrorKind.INTERNAL, stage + " failed: " + e.getMessage());
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EngineOptions options = EngineOptions.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private MetricsService metricsService;
        private MentionExtractor mentionExtractor;
        private ConsistencyValidator validator;
        private ResolutionPlanner planner;
        private ReportCompiler reportCompiler;

        public Builder options(EngineOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets the normalization cache configuration. Defaults to {@link CacheConfig#defaults()}.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * Sets a custom metrics service for recording operational metrics.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets the extractor that pulls component mentions out of free text.
         * Defaults to {@link PatternMentionExtractor}.
         */
        public Builder mentionExtractor(MentionExtractor mentionExtractor) {
            this.mentionExtractor = mentionExtractor;
            return this;
        }

        public Builder validator(ConsistencyValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder planner(ResolutionPlanner planner) {
            this.planner = planner;
            return this;
        }

        public Builder reportCompiler(ReportCompiler reportCompiler) {
            this.reportCompiler = reportCompiler;
            return this;
        }

        public CorrelationEngine build() {
            if (options == null) {
                throw new IllegalStateException("EngineOptions is required");
            }
            if (cacheConfig == null) {
                throw new IllegalStateException("CacheConfig is required");
            }
            return new CorrelationEngine(this);
        }
    }
}
