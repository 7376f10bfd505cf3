package com.diagnosis.correlation.api;

import com.diagnosis.correlation.core.model.CanonicalEntity;
import com.diagnosis.correlation.core.model.Procedure;
import com.diagnosis.correlation.core.model.Severity;
import com.diagnosis.correlation.core.model.ViolationTypes;
import com.diagnosis.correlation.graph.CorrelationGraph;
import com.diagnosis.correlation.metrics.MetricsService;
import com.diagnosis.correlation.planning.PrioritizationStrategy;
import com.diagnosis.correlation.planning.ResolutionPlan;
import com.diagnosis.correlation.planning.ResolutionPlanner;
import com.diagnosis.correlation.report.ReportFormat;
import com.diagnosis.correlation.source.ComponentInventory;
import com.diagnosis.correlation.source.ComponentRecord;
import com.diagnosis.correlation.source.DocumentAnalysis;
import com.diagnosis.correlation.source.LogAnalysisOutput;
import com.diagnosis.correlation.source.LogIssue;
import com.diagnosis.correlation.source.SourceData;
import com.diagnosis.correlation.source.SourceTypes;
import com.diagnosis.correlation.validation.ValidationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CorrelationEngineTest {

    private MetricsService metrics;
    private CorrelationEngine engine;
    private SourceData sources;

    @BeforeEach
    void setUp() {
        metrics = mock(MetricsService.class);
        engine = CorrelationEngine.builder().metricsService(metrics).build();

        Map<String, ComponentRecord> components = new LinkedHashMap<>();
        components.put("Laser Diode", ComponentRecord.of("Laser Diode", "Emits the excitation beam"));
        components.put("Detector Array", ComponentRecord.of("Detector Array", "Detects emitted photons"));
        components.put("Signal Processor", ComponentRecord.of("Signal Processor", "Processes detector output"));
        ComponentInventory inventory = new ComponentInventory(components, Map.of(),
                Map.of("Laser Diode", List.of("Detector Array")));

        LogAnalysisOutput logs = new LogAnalysisOutput(
                List.of(LogIssue.of("optical_alignment", "Laser diode power drop detected", "HIGH",
                        List.of("ERROR laser diode output below threshold"))),
                Map.of(), Map.of("risk_level", "HIGH"));

        DocumentAnalysis documents = new DocumentAnalysis(
                List.of(new Procedure("Realign laser diode", "Restore laser diode power after a drop",
                        List.of("Power drop"), List.of("Check laser diode alignment"))),
                List.of(), List.of());

        sources = new SourceData(logs, inventory, documents);
    }

    @Nested
    @DisplayName("Component correlation")
    class CorrelationTests {

        @Test
        @DisplayName("Should resolve inventory components into entities")
        void testCorrelateComponents() {
            EngineResult<CorrelationResult> result = engine.correlateComponents(sources);

            assertTrue(result.isSuccess(), result::toString);
            CorrelationResult correlation = result.getValue();
            assertTrue(correlation.graph().findEntity("Detector Array").isPresent());
            assertTrue(correlation.graph().findEntity("Signal Processor").isPresent());
            assertEquals(correlation.graph().entities().size(), correlation.summary().componentsCorrelated());
            assertTrue(correlation.summary().sourcesAnalyzed().contains(SourceTypes.COMPONENT_INVENTORY));
            verify(metrics).incrementEntitiesResolved(correlation.graph().entities().size());
            verify(metrics).recordStageDuration(eq("correlation"), any(Duration.class));
        }

        @Test
        @DisplayName("Should reject sources without any component mentions")
        void testEmptySources() {
            EngineResult<CorrelationResult> result = engine.correlateComponents(SourceData.empty());

            assertFalse(result.isSuccess());
            assertEquals(ErrorKind.INVALID_INPUT, result.getErrorKind());
            assertEquals("No component mentions found in any source", result.getMessage());
            verify(metrics, never()).incrementEntitiesResolved(anyInt());
        }

        @Test
        @DisplayName("Should accept an inventory that only lists aliases")
        void testAliasOnlyInventory() {
            ComponentInventory aliasesOnly = new ComponentInventory(Map.of(),
                    Map.of("Laser Diode", "LD-1"), Map.of());

            EngineResult<CorrelationResult> result =
                    engine.correlateComponents(new SourceData(null, aliasesOnly, null));

            assertTrue(result.isSuccess(), result::toString);
            assertTrue(result.getValue().graph().findEntity("Laser Diode").isPresent());
        }

        @Test
        @DisplayName("Should reject null sources")
        void testNullSources() {
            EngineResult<CorrelationResult> result = engine.correlateComponents(null);

            assertEquals(ErrorKind.INVALID_INPUT, result.getErrorKind());
            assertEquals("Source data is required", result.getMessage());
        }
    }

    @Nested
    @DisplayName("Failure correlation")
    class FailureTests {

        @Test
        @DisplayName("Should analyze every pattern against every procedure")
        void testCorrelateFailures() {
            EngineResult<FailureCorrelationResult> result =
                    engine.correlateFailures(sources.logAnalysis(), sources.documentAnalysis());

            assertTrue(result.isSuccess(), result::toString);
            assertEquals(1, result.getValue().patternsAnalyzed());
            assertEquals(0.5, result.getValue().threshold());
            assertTrue(result.getValue().proceduresAnalyzed() >= 1);
        }

        @Test
        @DisplayName("Should require the log analysis")
        void testMissingLogs() {
            EngineResult<FailureCorrelationResult> result =
                    engine.correlateFailures(null, DocumentAnalysis.empty());

            assertEquals(ErrorKind.INVALID_INPUT, result.getErrorKind());
            assertEquals("logAnalysis is required", result.getMessage());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Zero components and zero failures should pass vacuously")
        void testVacuousPass() {
            EngineResult<ValidationReport> result = engine.validate(CorrelationGraph.empty(), List.of());

            assertTrue(result.isSuccess());
            assertTrue(result.getValue().violations().isEmpty());
            assertEquals(1.0, result.getValue().overallConsistencyScore());
            assertTrue(result.getValue().meetsThreshold());
        }

        @Test
        @DisplayName("Should count every violation found")
        void testViolationMetrics() {
            Map<String, List<String>> references = new LinkedHashMap<>();
            references.put(SourceTypes.LOG_ANALYSIS, List.of("Mirror", "Reflector"));
            references.put(SourceTypes.COMPONENT_INVENTORY, List.of("Mirror Assembly", "Beam Mirror"));
            CanonicalEntity mirror = new CanonicalEntity("Mirror Unit", "Mirror", references,
                    Map.of(SourceTypes.LOG_ANALYSIS, 0.9, SourceTypes.COMPONENT_INVENTORY, 0.9),
                    List.of(), List.of(), 0.9);
            CorrelationGraph graph = new CorrelationGraph(List.of(mirror), List.of(), List.of(), Map.of(), 4);

            EngineResult<ValidationReport> result = engine.validate(graph, List.of());

            assertTrue(result.isSuccess());
            assertEquals(1, result.getValue().violations().size());
            verify(metrics).incrementViolation(ViolationTypes.COMPONENT_NAME_CONFLICT, Severity.MEDIUM);
        }
    }

    @Nested
    @DisplayName("Planning")
    class PlanningTests {

        @Test
        @DisplayName("Should reject a missing strategy")
        void testNullStrategy() {
            EngineResult<ResolutionPlan> result = engine.planResolutions(List.of(), null);

            assertEquals(ErrorKind.INVALID_INPUT, result.getErrorKind());
            assertEquals("strategy is required", result.getMessage());
        }

        @Test
        @DisplayName("Should plan nothing for no violations")
        void testNoViolations() {
            EngineResult<ResolutionPlan> result = engine.planResolutions(List.of());

            assertTrue(result.isSuccess());
            assertFalse(result.getValue().isActionRequired());
            verify(metrics).recordResolutionsPlanned(0);
        }

        @Test
        @DisplayName("Should report an unexpected failure as INTERNAL")
        void testInternalFailure() {
            ResolutionPlanner planner = mock(ResolutionPlanner.class);
            when(planner.plan(any(), any())).thenThrow(new IllegalStateException("boom"));
            CorrelationEngine failing = CorrelationEngine.builder().planner(planner).build();

            EngineResult<ResolutionPlan> result = failing.planResolutions(List.of(), PrioritizationStrategy.QUICK_WINS);

            assertEquals(ErrorKind.INTERNAL, result.getErrorKind());
            assertEquals("planning failed: boom", result.getMessage());
        }
    }

    @Nested
    @DisplayName("Full pipeline")
    class AnalyzeTests {

        @Test
        @DisplayName("Should run every stage and compile a report")
        void testAnalyze() {
            EngineResult<AnalysisResult> result = engine.analyze(sources);

            assertTrue(result.isSuccess(), result::toString);
            AnalysisResult analysis = result.getValue();
            assertNotNull(analysis.runId());
            assertFalse(analysis.correlation().componentCorrelations().isEmpty());
            assertEquals(1, analysis.failureCorrelation().patternsAnalyzed());
            assertNotNull(analysis.plan());
            assertNotNull(analysis.report().detailedFindings());
            assertTrue(analysis.report().reportMetadata().dataSourcesIntegrated() >= 2);

            for (String stage : List.of("correlation", "failure_correlation", "validation", "planning", "report",
                    "analysis")) {
                verify(metrics).recordStageDuration(eq(stage), any(Duration.class));
            }
        }

        @Test
        @DisplayName("Should produce identical results from identical input on separate engines")
        void testDeterministicAcrossEngines() {
            AnalysisResult first = CorrelationEngine.builder().build().analyze(sources).getValue();
            AnalysisResult second = CorrelationEngine.builder().build().analyze(sources).getValue();

            assertEquals(first.correlation().graph().entities(), second.correlation().graph().entities());
            assertEquals(first.correlation().graph().edges(), second.correlation().graph().edges());
            assertEquals(first.validation().violations(), second.validation().violations());
            assertEquals(first.validation(), second.validation());
            assertEquals(first.plan().resolutions().stream().map(r -> r.violationRef() + ":" + r.resolutionType())
                            .toList(),
                    second.plan().resolutions().stream().map(r -> r.violationRef() + ":" + r.resolutionType())
                            .toList());
            assertEquals(first.plan().resolutions(), second.plan().resolutions());
        }

        @Test
        @DisplayName("Should honour the requested report format")
        void testExecutiveFormat() {
            EngineResult<AnalysisResult> result =
                    engine.analyze(sources, PrioritizationStrategy.QUICK_WINS, ReportFormat.EXECUTIVE);

            assertTrue(result.isSuccess(), result::toString);
            assertNull(result.getValue().report().detailedFindings());
        }

        @Test
        @DisplayName("Should reject a missing strategy before doing any work")
        void testNullStrategy() {
            EngineResult<AnalysisResult> result = engine.analyze(sources, null, ReportFormat.COMPREHENSIVE);

            assertEquals(ErrorKind.INVALID_INPUT, result.getErrorKind());
            verify(metrics, never()).incrementEntitiesResolved(anyInt());
        }

        @Test
        @DisplayName("Should reject empty sources")
        void testEmptySources() {
            EngineResult<AnalysisResult> result = engine.analyze(SourceData.empty());

            assertEquals(ErrorKind.INVALID_INPUT, result.getErrorKind());
            assertThrows(java.util.NoSuchElementException.class, result::getValue);
        }
    }

    @Test
    @DisplayName("Builder should require options and cache configuration")
    void testBuilderValidation() {
        assertThrows(IllegalStateException.class, () -> CorrelationEngine.builder().options(null).build());
        assertThrows(IllegalStateException.class, () -> CorrelationEngine.builder().cacheConfig(null).build());
    }
}
