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
 * Flags multi-source entities identified with low confidence in at least one source.
 */
public class DataSourceMismatchRule implements ConsistencyRule {

    static final double MIN_SOURCE_CONFIDENCE = 0.8;

    @Override
    public String violationType() {
        return ViolationTypes.DATA_SOURCE_MISMATCH;
    }

    @Override
    public List<ConsistencyViolation> check(ValidationContext context) {
        List<ConsistencyViolation> violations = new ArrayList<>();
        for (CanonicalEntity entity : context.entities()) {
            if (!entity.isMultiSource()) {
                continue;
            }
            Map<String, Double> lowScores = new LinkedHashMap<>();
            entity.confidenceScores().forEach((source, score) -> {
                if (score < MIN_SOURCE_CONFIDENCE) {
                    lowScores.put(source, score);
                }
            });
            if (!lowScores.isEmpty()) {
                violations.add(new ConsistencyViolation(
                        violationType(),
                        "Low confidence component identification in sources: "
                                + String.join(", ", lowScores.keySet()),
                        new ArrayList<>(lowScores.keySet()),
                        Map.of("low_confidence_scores", lowScores),
                        ResolutionSuggestions.severityFor(violationType()),
                        ResolutionSuggestions.suggestionFor(violationType()),
                        0.7));
            }
        }
        return violations;
    }
}
