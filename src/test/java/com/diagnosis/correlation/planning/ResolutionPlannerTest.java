package com.diagnosis.correlation.planning;

import com.diagnosis.correlation.core.model.ConsistencyViolation;
import com.diagnosis.correlation.core.model.ResolutionItem;
import com.diagnosis.correlation.core.model.ResolutionType;
import com.diagnosis.correlation.core.model.Severity;
import com.diagnosis.correlation.core.model.ViolationTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionPlannerTest {

    private ResolutionPlanner planner;
    private ConsistencyViolation nameConflict;
    private ConsistencyViolation severityMismatch;
    private ConsistencyViolation brokenReference;
    private ConsistencyViolation sourceMismatch;

    @BeforeEach
    void setUp() {
        planner = new ResolutionPlanner();

        nameConflict = new ConsistencyViolation(ViolationTypes.COMPONENT_NAME_CONFLICT, "Mirror has 4 names",
                List.of("log_analysis", "component_inventory"),
                Map.of("name_variations", List.of("Reflector", "Mirror", "Mirror Assembly", "Beam Mirror")),
                Severity.MEDIUM, "Use highest confidence source for canonical name", 0.9);

        Map<String, Object> severities = new LinkedHashMap<>();
        severities.put("severities", List.of("CRITICAL", "MEDIUM"));
        severities.put("pattern_type", "connection_timeout");
        severityMismatch = new ConsistencyViolation(ViolationTypes.FAILURE_SEVERITY_MISMATCH, "mismatch",
                List.of("failure_analysis"), severities, Severity.HIGH, "Review", 0.8);

        brokenReference = new ConsistencyViolation(ViolationTypes.BROKEN_CROSS_REFERENCE, "unknown component",
                List.of("failure_correlation", "component_correlation"),
                Map.of("missing_component", "Cooling Fan X9", "failure_pattern", "Fan stall"),
                Severity.MEDIUM, "Update references or mark as deprecated", 0.9);

        sourceMismatch = new ConsistencyViolation(ViolationTypes.DATA_SOURCE_MISMATCH, "low confidence",
                List.of("log_analysis", "component_inventory", "engineering_docs"),
                Map.of("low_confidence_scores", Map.of("log_analysis", 0.6)),
                Severity.MEDIUM, "Verify data source integrity and update if necessary", 0.7);
    }

    private List<ConsistencyViolation> allViolations() {
        return List.of(nameConflict, severityMismatch, brokenReference, sourceMismatch);
    }

    private static List<String> types(ResolutionPlan plan) {
        return plan.resolutions().stream().map(ResolutionItem::violationType).toList();
    }

    @Test
    @DisplayName("Should return a no-action plan for no violations")
    void testNoViolations() {
        ResolutionPlan plan = planner.plan(List.of(), PrioritizationStrategy.CRITICAL_FIRST);

        assertFalse(plan.isActionRequired());
        assertEquals(ResolutionPlan.NO_ACTION_REQUIRED, plan.status());
        assertEquals(ResolutionPlan.CONSISTENT_MESSAGE, plan.message());
        assertEquals(1.0, plan.summary().successProbability());
        assertTrue(plan.timeline().bucket(TimelineBucket.IMMEDIATE).isEmpty());
    }

    @Test
    @DisplayName("Should produce exactly one resolution per violation")
    void testOneResolutionPerViolation() {
        ResolutionPlan plan = planner.plan(allViolations(), PrioritizationStrategy.CRITICAL_FIRST);

        assertEquals(4, plan.resolutions().size());
        assertEquals(4, plan.violationsProcessed());
        assertEquals(ResolutionPlan.ACTION_REQUIRED, plan.status());
    }

    @Test
    @DisplayName("Should standardize a name conflict on the shortest variant")
    void testNameConflictResolution() {
        ResolutionItem item = planner.resolve(nameConflict);

        assertEquals(ResolutionType.CANONICAL_NAME_ASSIGNMENT, item.resolutionType());
        assertEquals("Mirror", item.affectedItems().get("suggested_canonical"));
        assertEquals(Severity.MEDIUM, item.priority());
    }

    @Test
    @DisplayName("Should standardize a severity mismatch on the most severe value")
    void testSeverityResolution() {
        ResolutionItem item = planner.resolve(severityMismatch);

        assertEquals(ResolutionType.SEVERITY_STANDARDIZATION, item.resolutionType());
        assertEquals("CRITICAL", item.affectedItems().get("suggested_severity"));
        assertTrue(item.action().contains("connection_timeout"));
    }

    @Test
    @DisplayName("Should fall back to manual review when no severity is recognised")
    void testUnknownSeverities() {
        ConsistencyViolation unknown = new ConsistencyViolation(ViolationTypes.FAILURE_SEVERITY_MISMATCH, "odd",
                List.of(), Map.of("severities", List.of("SEVERE", "MILD")), Severity.HIGH, "Review it", 0.8);

        ResolutionItem item = planner.resolve(unknown);

        assertEquals(ResolutionType.MANUAL_REVIEW, item.resolutionType());
        assertEquals("Review it", item.action());
    }

    @Test
    @DisplayName("Should offer three alternatives for a broken reference")
    void testReferenceRepair() {
        ResolutionItem item = planner.resolve(brokenReference);

        assertEquals(ResolutionType.REFERENCE_REPAIR, item.resolutionType());
        assertEquals(ResolutionPlanner.REPAIR_ACTIONS, item.affectedItems().get("suggested_actions"));
        assertEquals("Cooling Fan X9", item.affectedItems().get("missing_component"));
    }

    @Test
    @DisplayName("critical_first should order by severity then confidence")
    void testCriticalFirst() {
        ResolutionPlan plan = planner.plan(allViolations(), PrioritizationStrategy.CRITICAL_FIRST);

        assertEquals(List.of(ViolationTypes.FAILURE_SEVERITY_MISMATCH, ViolationTypes.COMPONENT_NAME_CONFLICT,
                ViolationTypes.BROKEN_CROSS_REFERENCE, ViolationTypes.DATA_SOURCE_MISMATCH), types(plan));
    }

    @Test
    @DisplayName("quick_wins should put name assignments and reference repairs first")
    void testQuickWins() {
        ResolutionPlan plan = planner.plan(allViolations(), PrioritizationStrategy.QUICK_WINS);

        assertEquals(List.of(ViolationTypes.COMPONENT_NAME_CONFLICT, ViolationTypes.BROKEN_CROSS_REFERENCE,
                ViolationTypes.FAILURE_SEVERITY_MISMATCH, ViolationTypes.DATA_SOURCE_MISMATCH), types(plan));
    }

    @Test
    @DisplayName("high_impact should put resolutions touching most sources first")
    void testHighImpact() {
        ResolutionPlan plan = planner.plan(allViolations(), PrioritizationStrategy.HIGH_IMPACT);

        assertEquals(List.of(ViolationTypes.DATA_SOURCE_MISMATCH, ViolationTypes.COMPONENT_NAME_CONFLICT,
                ViolationTypes.BROKEN_CROSS_REFERENCE, ViolationTypes.FAILURE_SEVERITY_MISMATCH), types(plan));
    }

    @Test
    @DisplayName("Should summarize effort, priorities and success probability")
    void testSummary() {
        ResolutionPlan plan = planner.plan(allViolations(), PrioritizationStrategy.CRITICAL_FIRST);
        ResolutionSummary summary = plan.summary();

        assertEquals(4, summary.totalResolutions());
        assertEquals(0, summary.criticalResolutions());
        assertEquals(1, summary.highPriorityResolutions());
        assertEquals(List.of("severity_standardization", "canonical_name_assignment", "reference_repair",
                "manual_review"), summary.resolutionTypes());

        EffortEstimate effort = summary.estimatedEffort();
        assertEquals(12.5, effort.estimatedHours(), 0.0001);
        assertEquals(1, effort.lowEffort());
        assertEquals(2, effort.mediumEffort());
        assertEquals(1, effort.highEffort());

        // (0.9x0.9 + 0.7x0.8 + 0.8x0.9 + 0.5x0.7) / (0.9 + 0.8 + 0.9 + 0.7)
        assertEquals(2.44 / 3.3, summary.successProbability(), 0.0001);
    }

    @Test
    @DisplayName("Should group resolutions into time windows")
    void testTimeline() {
        ConsistencyViolation critical = new ConsistencyViolation(ViolationTypes.INCONSISTENT_FAILURE_ASSOCIATION,
                "too many", List.of(), Map.of("component", "Pump"), Severity.CRITICAL, "Cross-validate", 0.6);
        ConsistencyViolation low = new ConsistencyViolation(ViolationTypes.MISSING_CANONICAL_NAME, "no name",
                List.of(), Map.of("component_name", "pump"), Severity.LOW, "Generate", 0.8);

        ResolutionPlan plan = planner.plan(List.of(critical, nameConflict, sourceMismatch, low),
                PrioritizationStrategy.CRITICAL_FIRST);
        ImplementationTimeline timeline = plan.timeline();

        assertEquals(1, timeline.bucket(TimelineBucket.IMMEDIATE).size());
        assertEquals(1, timeline.bucket(TimelineBucket.SHORT_TERM).size());
        assertEquals(1, timeline.bucket(TimelineBucket.MEDIUM_TERM).size());
        assertEquals(1, timeline.bucket(TimelineBucket.LONG_TERM).size());
        assertEquals(ResolutionType.CANONICAL_NAME_ASSIGNMENT,
                timeline.bucket(TimelineBucket.SHORT_TERM).get(0).resolutionType());
    }

    @Test
    @DisplayName("Should produce guidance for every resolution type except manual review")
    void testGuidance() {
        ResolutionPlan plan = planner.plan(allViolations(), PrioritizationStrategy.CRITICAL_FIRST);

        assertEquals(3, plan.guidance().size());
        assertEquals("Standardize failure severities (1 items)", plan.guidance().get(0).step());
        assertEquals(15, plan.guidance().get(0).estimatedMinutes());
    }

    @Test
    @DisplayName("Should derive the same id from the same content")
    void testStableIds() {
        ConsistencyViolation reordered = new ConsistencyViolation(ViolationTypes.COMPONENT_NAME_CONFLICT,
                "different description", List.of("component_inventory", "log_analysis"),
                Map.of("name_variations", List.of("Beam Mirror", "Mirror Assembly", "Mirror", "Reflector")),
                Severity.MEDIUM, "", 0.5);

        String id = ViolationIdGenerator.idFor(nameConflict);

        assertEquals(id, ViolationIdGenerator.idFor(nameConflict));
        assertEquals(id, ViolationIdGenerator.idFor(reordered));
        assertNotEquals(id, ViolationIdGenerator.idFor(brokenReference));
        assertTrue(id.startsWith(ViolationTypes.COMPONENT_NAME_CONFLICT + "-"));
        assertEquals(ViolationTypes.COMPONENT_NAME_CONFLICT.length() + 1 + 12, id.length());
    }

    @ParameterizedTest
    @CsvSource({
            "critical_first, CRITICAL_FIRST",
            "HIGH_IMPACT, HIGH_IMPACT",
            " quick_wins , QUICK_WINS"
    })
    @DisplayName("Should parse strategy names")
    void testStrategyParsing(String input, PrioritizationStrategy expected) {
        assertEquals(expected, PrioritizationStrategy.fromWireName(input));
    }

    @Test
    @DisplayName("Should reject unknown strategy names")
    void testUnknownStrategy() {
        assertThrows(IllegalArgumentException.class, () -> PrioritizationStrategy.fromWireName("fastest"));
    }
}
