package com.diagnosis.correlation.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A detected contradiction or quality problem in the resolved data.
 * Immutable; produced and consumed within one validation pass.
 *
 * @param violationType        violation type (see {@link ViolationTypes})
 * @param description          human-readable description
 * @param affectedSources      sources involved in the violation
 * @param conflictingValues    the values in conflict, keyed by role
 * @param severity             violation severity
 * @param resolutionSuggestion default remediation text for this type
 * @param confidence           confidence that this is a real problem (0.0-1.0)
 */
public record ConsistencyViolation(
        String violationType,
        String description,
        List<String> affectedSources,
        Map<String, Object> conflictingValues,
        Severity severity,
        String resolutionSuggestion,
        double confidence
) {
    public ConsistencyViolation {
        if (violationType == null || violationType.isBlank()) {
            throw new IllegalArgumentException("violationType is required");
        }
        description = description != null ? description : "";
        affectedSources = ModelCollections.listCopy(affectedSources);
        conflictingValues = ModelCollections.mapCopy(conflictingValues);
        Objects.requireNonNull(severity, "severity is required");
        resolutionSuggestion = resolutionSuggestion != null ? resolutionSuggestion : "";
        ModelCollections.checkUnitInterval(confidence, "confidence");
    }
}
