package com.diagnosis.correlation.validation;

import com.diagnosis.correlation.core.model.ConsistencyViolation;
import com.diagnosis.correlation.core.model.CrossReference;
import com.diagnosis.correlation.core.model.Severity;
import com.diagnosis.correlation.core.model.ValidationStatus;
import com.diagnosis.correlation.core.model.ViolationTypes;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consistency scores of one validation pass, each clamped to [0, 1].
 * A pass over no items scores 1.0 everywhere.
 *
 * @param overallConsistency          {@code 1 - violations / (components + failures)}
 * @param componentConsistency        same, restricted to component violation types
 * @param failureConsistency          same, restricted to failure violation types
 * @param crossReferenceValidity      share of VALID cross-references
 * @param severityWeightedConsistency {@code 1 - sum(weights) / (items x weight(CRITICAL))}
 */
public record ConsistencyMetrics(
        double overallConsistency,
        double componentConsistency,
        double failureConsistency,
        double crossReferenceValidity,
        double severityWeightedConsistency
) {

    public static ConsistencyMetrics perfect() {
        return new ConsistencyMetrics(1.0, 1.0, 1.0, 1.0, 1.0);
    }

    public static ConsistencyMetrics calculate(List<ConsistencyViolation> violations,
                                               List<CrossReference> crossReferences,
                                               int totalComponents, int totalFailures) {
        int totalItems = totalComponents + totalFailures;

        long componentViolations = violations.stream()
                .filter(v -> ViolationTypes.isComponentType(v.violationType()))
                .count();
        long failureViolations = violations.stream()
                .filter(v -> ViolationTypes.isFailureType(v.violationType()))
                .count();
        long validReferences = crossReferences.stream()
                .filter(r -> r.validationStatus() == ValidationStatus.VALID)
                .count();
        int weightedViolations = violations.stream()
                .mapToInt(v -> v.severity().getWeight())
                .sum();

        return new ConsistencyMetrics(
                inverseRate(violations.size(), totalItems),
                inverseRate(componentViolations, totalComponents),
                inverseRate(failureViolations, totalFailures),
                crossReferences.isEmpty() ? 1.0 : clamp((double) validReferences / crossReferences.size()),
                inverseRate(weightedViolations, (long) totalItems * Severity.CRITICAL.getWeight())
        );
    }

    private static double inverseRate(long count, long total) {
        if (total <= 0) {
            return 1.0;
        }
        return clamp(1.0 - (double) count / total);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Returns the metrics keyed by their snake_case names.
     */
    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("overall_consistency", overallConsistency);
        map.put("component_consistency", componentConsistency);
        map.put("failure_consistency", failureConsistency);
        map.put("cross_reference_validity", crossReferenceValidity);
        map.put("severity_weighted_consistency", severityWeightedConsistency);
        return map;
    }
}
