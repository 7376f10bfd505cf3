package com.diagnosis.correlation.validation.rules;

import com.diagnosis.correlation.core.model.CanonicalEntity;
import com.diagnosis.correlation.core.model.ConsistencyViolation;
import com.diagnosis.correlation.core.model.ViolationTypes;
import com.diagnosis.correlation.validation.ConsistencyRule;
import com.diagnosis.correlation.validation.ResolutionSuggestions;
import com.diagnosis.correlation.validation.ValidationContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags multi-source entities whose canonical name is empty or just the seeding mention.
 */
public class MissingCanonicalNameRule implements ConsistencyRule {

    @Override
    public String violationType() {
        return ViolationTypes.MISSING_CANONICAL_NAME;
    }

    @Override
    public List<ConsistencyViolation> check(ValidationContext context) {
        List<ConsistencyViolation> violations = new ArrayList<>();
        for (CanonicalEntity entity : context.entities()) {
            if (!entity.isMultiSource()) {
                continue;
            }
            String canonical = entity.canonicalName();
            if (canonical.isEmpty() || canonical.equals(entity.originalName())) {
                Map<String, Object> values = new LinkedHashMap<>();
                values.put("canonical_name", canonical);
                values.put("component_name", entity.originalName());
                violations.add(new ConsistencyViolation(
                        violationType(),
                        "Component \"" + entity.originalName() + "\" lacks a proper canonical name",
                        new ArrayList<>(entity.sourceReferences().keySet()),
                        values,
                        ResolutionSuggestions.severityFor(violationType()),
                        ResolutionSuggestions.suggestionFor(violationType()),
                        0.8));
            }
        }
        return violations;
    }
}
