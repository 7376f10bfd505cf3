package com.diagnosis.correlation.validation.rules;

import com.diagnosis.correlation.core.model.ConsistencyViolation;
import com.diagnosis.correlation.core.model.FailurePatternCorrelation;
import com.diagnosis.correlation.core.model.Severity;
import com.diagnosis.correlation.core.model.ViolationTypes;
import com.diagnosis.correlation.validation.ConsistencyRule;
import com.diagnosis.correlation.validation.ResolutionSuggestions;
import com.diagnosis.correlation.validation.ValidationContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flags failure pattern types reported with more than one severity.
 */
public class FailureSeverityMismatchRule implements ConsistencyRule {

    @Override
    public String violationType() {
        return ViolationTypes.FAILURE_SEVERITY_MISMATCH;
    }

    @Override
    public List<ConsistencyViolation> check(ValidationContext context) {
        Map<String, Set<Severity>> severitiesByType = new LinkedHashMap<>();
        for (FailurePatternCorrelation failure : context.failures()) {
            severitiesByType.computeIfAbsent(failure.patternType(), t -> new LinkedHashSet<>())
                    .add(failure.severity());
        }

        List<ConsistencyViolation> violations = new ArrayList<>();
        severitiesByType.forEach((patternType, severities) -> {
            if (severities.size() > 1) {
                List<String> labels = severities.stream().map(Severity::name).toList();
                Map<String, Object> values = new LinkedHashMap<>();
                values.put("severities", labels);
                values.put("pattern_type", patternType);
                violations.add(new ConsistencyViolation(
                        violationType(),
                        "Pattern type \"" + patternType + "\" has inconsistent severity levels: "
                                + String.join(", ", labels),
                        List.of("failure_analysis"),
                        values,
                        ResolutionSuggestions.severityFor(violationType()),
                        ResolutionSuggestions.suggestionFor(violationType()),
                        0.8));
            }
        });
        return violations;
    }
}
