package com.diagnosis.correlation.validation;

import com.diagnosis.correlation.core.model.CanonicalEntity;
import com.diagnosis.correlation.core.model.ConsistencyViolation;
import com.diagnosis.correlation.core.model.CrossReference;
import com.diagnosis.correlation.core.model.FailurePatternCorrelation;
import com.diagnosis.correlation.core.model.Severity;
import com.diagnosis.correlation.core.model.ValidationStatus;
import com.diagnosis.correlation.core.model.ViolationTypes;
import com.diagnosis.correlation.source.SourceTypes;
import com.diagnosis.correlation.validation.rules.MissingCanonicalNameRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConsistencyValidatorTest {

    private CanonicalEntity mirror;
    private List<FailurePatternCorrelation> failures;

    @BeforeEach
    void setUp() {
        Map<String, List<String>> references = new LinkedHashMap<>();
        references.put(SourceTypes.LOG_ANALYSIS, List.of("Mirror", "Reflector"));
        references.put(SourceTypes.COMPONENT_INVENTORY, List.of("Mirror Assembly", "Beam Mirror"));
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put(SourceTypes.LOG_ANALYSIS, 0.9);
        scores.put(SourceTypes.COMPONENT_INVENTORY, 0.9);
        mirror = new CanonicalEntity("Mirror", "Mirror", references, scores, List.of(), List.of(), 0.9);

        failures = List.of(
                FailurePatternCorrelation.of("Beam drift", "connection_timeout", Severity.CRITICAL, List.of("mirror")),
                FailurePatternCorrelation.of("Fan stall", "connection_timeout", Severity.MEDIUM,
                        List.of("Cooling Fan X9")));
    }

    @Nested
    @DisplayName("CrossReferenceValidator")
    class CrossReferenceTests {

        private final CrossReferenceValidator validator = new CrossReferenceValidator();

        @Test
        @DisplayName("Should resolve aliases ignoring case and grade the reference")
        void testResolvedReference() {
            CrossReferenceValidator.Result result = validator.validate(ValidationContext.of(List.of(mirror), failures));

            CrossReference resolved = result.crossReferences().get(0);
            assertEquals("Mirror", resolved.targetItem());
            // 0.7 x 1.0 similarity + 0.3 x 0.9 mean confidence
            assertEquals(0.97, resolved.strength(), 0.0001);
            assertEquals(ValidationStatus.VALID, resolved.validationStatus());
            assertEquals(CrossReference.FAILURE_CORRELATION, resolved.sourceType());
        }

        @Test
        @DisplayName("Should mark an unknown component INVALID and raise a violation")
        void testBrokenReference() {
            CrossReferenceValidator.Result result = validator.validate(ValidationContext.of(List.of(mirror), failures));

            CrossReference broken = result.crossReferences().get(1);
            assertEquals("Cooling Fan X9", broken.targetItem());
            assertEquals(ValidationStatus.INVALID, broken.validationStatus());
            assertEquals(0.0, broken.strength());

            assertEquals(1, result.violations().size());
            assertEquals(ViolationTypes.BROKEN_CROSS_REFERENCE, result.violations().get(0).violationType());
        }

        @Test
        @DisplayName("Should mark a weak match UNCERTAIN")
        void testUncertainReference() {
            CanonicalEntity laser = new CanonicalEntity("Laser Diode", "Laser Diode",
                    Map.of(SourceTypes.LOG_ANALYSIS, List.of("Laser Diode")), Map.of(SourceTypes.LOG_ANALYSIS, 0.5),
                    List.of(), List.of(), 0.5);
            FailurePatternCorrelation failure = FailurePatternCorrelation.of("Power drop", "optical_alignment",
                    Severity.HIGH, List.of("Laser"));

            CrossReference reference = validator.validate(ValidationContext.of(List.of(laser), List.of(failure)))
                    .crossReferences().get(0);

            // 0.7 x 0.9 containment + 0.3 x 0.5
            assertEquals(0.78, reference.strength(), 0.0001);
            assertEquals(ValidationStatus.VALID, reference.validationStatus());

            CanonicalEntity lowConfidence = new CanonicalEntity("Laser Diode", "Laser Diode", Map.of(),
                    Map.of(SourceTypes.LOG_ANALYSIS, 0.1), List.of(), List.of(), 0.1);
            CrossReference weak = validator.validate(ValidationContext.of(List.of(lowConfidence), List.of(failure)))
                    .crossReferences().get(0);
            assertEquals(ValidationStatus.UNCERTAIN, weak.validationStatus());
        }
    }

    @Nested
    @DisplayName("ConsistencyMetrics")
    class MetricsTests {

        @Test
        @DisplayName("Should score 1.0 everywhere when there is nothing to check")
        void testVacuous() {
            ConsistencyMetrics metrics = ConsistencyMetrics.calculate(List.of(), List.of(), 0, 0);

            assertEquals(ConsistencyMetrics.perfect(), metrics);
        }

        @Test
        @DisplayName("Should derive per-category and severity-weighted scores")
        void testCalculate() {
            List<ConsistencyViolation> violations = List.of(
                    violation(ViolationTypes.COMPONENT_NAME_CONFLICT, Severity.MEDIUM),
                    violation(ViolationTypes.FAILURE_SEVERITY_MISMATCH, Severity.HIGH));
            List<CrossReference> references = List.of(
                    CrossReference.failureToComponent("f", "A", 0.9, ValidationStatus.VALID, Map.of()),
                    CrossReference.failureToComponent("f", "B", 0.0, ValidationStatus.INVALID, Map.of()),
                    CrossReference.failureToComponent("f", "C", 0.6, ValidationStatus.UNCERTAIN, Map.of()),
                    CrossReference.failureToComponent("g", "A", 0.9, ValidationStatus.VALID, Map.of()));

            ConsistencyMetrics metrics = ConsistencyMetrics.calculate(violations, references, 4, 6);

            assertEquals(0.8, metrics.overallConsistency(), 0.0001);
            assertEquals(0.75, metrics.componentConsistency(), 0.0001);
            assertEquals(5.0 / 6.0, metrics.failureConsistency(), 0.0001);
            assertEquals(0.5, metrics.crossReferenceValidity(), 0.0001);
            // (2 + 3) / (10 x 4)
            assertEquals(1.0 - 5.0 / 40.0, metrics.severityWeightedConsistency(), 0.0001);
        }

        @Test
        @DisplayName("Should clamp at zero when violations outnumber items")
        void testClamp() {
            ConsistencyMetrics metrics = ConsistencyMetrics.calculate(List.of(
                    violation(ViolationTypes.COMPONENT_NAME_CONFLICT, Severity.CRITICAL),
                    violation(ViolationTypes.COMPONENT_NAME_CONFLICT, Severity.CRITICAL)), List.of(), 1, 0);

            assertEquals(0.0, metrics.overallConsistency());
            assertEquals(0.0, metrics.componentConsistency());
            assertEquals(1.0, metrics.failureConsistency());
            assertEquals(5, metrics.toMap().size());
        }

        private ConsistencyViolation violation(String type, Severity severity) {
            return new ConsistencyViolation(type, "", List.of(), Map.of(), severity, "", 0.8);
        }
    }

    @Nested
    @DisplayName("ConsistencyValidator")
    class ValidatorTests {

        @Test
        @DisplayName("Should concatenate every rule's violations in rule order")
        void testValidate() {
            ValidationReport report = ConsistencyValidator.createDefault()
                    .validate(ValidationContext.of(List.of(mirror), failures), 0.7);

            assertEquals(List.of(ViolationTypes.COMPONENT_NAME_CONFLICT, ViolationTypes.MISSING_CANONICAL_NAME,
                            ViolationTypes.FAILURE_SEVERITY_MISMATCH, ViolationTypes.BROKEN_CROSS_REFERENCE),
                    report.violations().stream().map(ConsistencyViolation::violationType).toList());
            assertEquals(2, report.crossReferences().size());
            assertEquals(0.0, report.overallConsistencyScore());
            assertEquals(ConsistencyLevel.LOW, report.consistencyLevel());
            assertFalse(report.meetsThreshold());
            assertEquals(1, report.componentsAnalyzed());
            assertEquals(2, report.failuresAnalyzed());

            ValidationReport.ViolationSummary summary = report.violationSummary();
            assertEquals(4, summary.totalViolations());
            assertEquals(1, summary.highViolations());
            assertEquals(2, summary.mediumViolations());
            assertEquals(1, summary.lowViolations());

            ValidationReport.CrossReferenceSummary references = report.crossReferenceSummary();
            assertEquals(1, references.validReferences());
            assertEquals(1, references.invalidReferences());
        }

        @Test
        @DisplayName("Should report full consistency for clean input")
        void testCleanInput() {
            ValidationReport report = ConsistencyValidator.createDefault()
                    .validate(ValidationContext.of(List.of(), List.of()), 0.7);

            assertTrue(report.violations().isEmpty());
            assertEquals(1.0, report.overallConsistencyScore());
            assertEquals(ConsistencyLevel.HIGH, report.consistencyLevel());
            assertTrue(report.meetsThreshold());
        }

        @Test
        @DisplayName("Should skip a failing rule and keep the others")
        void testFailingRule() {
            ConsistencyRule failing = new ConsistencyRule() {
                @Override
                public String violationType() {
                    return "exploding";
                }

                @Override
                public List<ConsistencyViolation> check(ValidationContext context) {
                    throw new IllegalStateException("boom");
                }
            };
            ConsistencyValidator validator = new ConsistencyValidator(
                    List.of(failing, new MissingCanonicalNameRule()), new CrossReferenceValidator());

            ValidationReport report = validator.validate(ValidationContext.of(List.of(mirror), List.of()), 0.7);

            assertEquals(1, report.violations().size());
            assertEquals(ViolationTypes.MISSING_CANONICAL_NAME, report.violations().get(0).violationType());
        }

        @Test
        @DisplayName("Should grade consistency levels at 0.8 and 0.6")
        void testLevels() {
            assertEquals(ConsistencyLevel.HIGH, ConsistencyLevel.of(0.8));
            assertEquals(ConsistencyLevel.MEDIUM, ConsistencyLevel.of(0.6));
            assertEquals(ConsistencyLevel.LOW, ConsistencyLevel.of(0.59));
        }
    }
}
