package com.diagnosis.correlation.validation;

import com.diagnosis.correlation.core.model.ConsistencyViolation;
import com.diagnosis.correlation.core.model.CrossReference;
import com.diagnosis.correlation.core.model.ModelCollections;
import com.diagnosis.correlation.core.model.Severity;
import com.diagnosis.correlation.core.model.ValidationStatus;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one validation pass.
 *
 * @param metrics              consistency metrics
 * @param consistencyLevel     grade of the overall score
 * @param meetsThreshold       whether the overall score reaches the consistency threshold
 * @param consistencyThreshold the threshold used
 * @param violations           all violations, in rule order
 * @param crossReferences      failure-to-component references
 * @param componentsAnalyzed   number of canonical entities checked
 * @param failuresAnalyzed     number of failure correlations checked
 */
public record ValidationReport(
        ConsistencyMetrics metrics,
        ConsistencyLevel consistencyLevel,
        boolean meetsThreshold,
        double consistencyThreshold,
        List<ConsistencyViolation> violations,
        List<CrossReference> crossReferences,
        int componentsAnalyzed,
        int failuresAnalyzed
) {
    public ValidationReport {
        Objects.requireNonNull(metrics, "metrics is required");
        Objects.requireNonNull(consistencyLevel, "consistencyLevel is required");
        violations = ModelCollections.listCopy(violations);
        crossReferences = ModelCollections.listCopy(crossReferences);
    }

    public double overallConsistencyScore() {
        return metrics.overallConsistency();
    }

    /**
     * Violation counts per severity, most severe first.
     */
    public ViolationSummary violationSummary() {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        LinkedHashSet<String> types = new LinkedHashSet<>();
        for (ConsistencyViolation violation : violations) {
            counts.merge(violation.severity(), 1, Integer::sum);
            types.add(violation.violationType());
        }
        return new ViolationSummary(violations.size(),
                counts.getOrDefault(Severity.CRITICAL, 0),
                counts.getOrDefault(Severity.HIGH, 0),
                counts.getOrDefault(Severity.MEDIUM, 0),
                counts.getOrDefault(Severity.LOW, 0),
                List.copyOf(types));
    }

    public CrossReferenceSummary crossReferenceSummary() {
        Map<ValidationStatus, Integer> counts = new EnumMap<>(ValidationStatus.class);
        crossReferences.forEach(r -> counts.merge(r.validationStatus(), 1, Integer::sum));
        double avgStrength = crossReferences.stream()
                .mapToDouble(CrossReference::strength)
                .average()
                .orElse(0.0);
        return new CrossReferenceSummary(crossReferences.size(),
                counts.getOrDefault(ValidationStatus.VALID, 0),
                counts.getOrDefault(ValidationStatus.INVALID, 0),
                counts.getOrDefault(ValidationStatus.UNCERTAIN, 0),
                avgStrength);
    }

    public record ViolationSummary(
            int totalViolations,
            int criticalViolations,
            int highViolations,
            int mediumViolations,
            int lowViolations,
            List<String> violationTypes
    ) {
    }

    public record CrossReferenceSummary(
            int totalReferences,
            int validReferences,
            int invalidReferences,
            int uncertainReferences,
            double avgReferenceStrength
    ) {
    }
}
