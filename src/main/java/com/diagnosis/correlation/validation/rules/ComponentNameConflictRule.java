package com.diagnosis.correlation.validation.rules;

import com.diagnosis.correlation.core.model.CanonicalEntity;
import com.diagnosis.correlation.core.model.ConsistencyViolation;
import com.diagnosis.correlation.core.model.ViolationTypes;
import com.diagnosis.correlation.validation.ConsistencyRule;
import com.diagnosis.correlation.validation.ResolutionSuggestions;
import com.diagnosis.correlation.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flags multi-source entities known under more than three distinct raw names.
 */
public class ComponentNameConflictRule implements ConsistencyRule {

    static final int MAX_NAME_VARIATIONS = 3;

    @Override
    public String violationType() {
        return ViolationTypes.COMPONENT_NAME_CONFLICT;
    }

    @Override
    public List<ConsistencyViolation> check(ValidationContext context) {
        List<ConsistencyViolation> violations = new ArrayList<>();
        for (CanonicalEntity entity : context.entities()) {
            if (!entity.isMultiSource()) {
                continue;
            }
            Set<String> names = entity.aliases();
            if (names.size() > MAX_NAME_VARIATIONS) {
                violations.add(new ConsistencyViolation(
                        violationType(),
                        "Component \"" + entity.originalName() + "\" has " + names.size()
                                + " different name variations across sources",
                        new ArrayList<>(entity.sourceReferences().keySet()),
                        Map.of("name_variations", new ArrayList<>(names)),
                        ResolutionSuggestions.severityFor(violationType()),
                        ResolutionSuggestions.suggestionFor(violationType()),
                        0.9));
            }
        }
        return violations;
    }
}
