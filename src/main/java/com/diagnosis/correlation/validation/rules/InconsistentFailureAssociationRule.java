package com.diagnosis.correlation.validation.rules;

import com.diagnosis.correlation.core.model.ConsistencyViolation;
import com.diagnosis.correlation.core.model.FailurePatternCorrelation;
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
 * Flags components associated with more than three distinct failure patterns.
 */
public class InconsistentFailureAssociationRule implements ConsistencyRule {

    static final int MAX_PATTERNS_PER_COMPONENT = 3;

    @Override
    public String violationType() {
        return ViolationTypes.INCONSISTENT_FAILURE_ASSOCIATION;
    }

    @Override
    public List<ConsistencyViolation> check(ValidationContext context) {
        Map<String, Set<String>> patternsByComponent = new LinkedHashMap<>();
        for (FailurePatternCorrelation failure : context.failures()) {
            for (String component : failure.associatedComponents()) {
                patternsByComponent.computeIfAbsent(component, c -> new LinkedHashSet<>())
                        .add(failure.failurePattern());
            }
        }

        List<ConsistencyViolation> violations = new ArrayList<>();
        patternsByComponent.forEach((component, patterns) -> {
            if (patterns.size() > MAX_PATTERNS_PER_COMPONENT) {
                Map<String, Object> values = new LinkedHashMap<>();
                values.put("component", component);
                values.put("failure_patterns", new ArrayList<>(patterns));
                violations.add(new ConsistencyViolation(
                        violationType(),
                        "Component \"" + component + "\" is associated with " + patterns.size()
                                + " different failure patterns",
                        List.of("failure_analysis", "component_correlation"),
                        values,
                        ResolutionSuggestions.severityFor(violationType()),
                        ResolutionSuggestions.suggestionFor(violationType()),
                        0.6));
            }
        });
        return violations;
    }
}
