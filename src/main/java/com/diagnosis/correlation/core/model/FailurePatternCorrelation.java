package com.diagnosis.correlation.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A failure pattern together with the components it names and the procedures
 * that address it.
 *
 * @param failurePattern       failure pattern description
 * @param patternType          failure category (e.g. {@code connection_timeout})
 * @param severity             reported severity
 * @param associatedComponents component names referenced by the pattern
 * @param procedures           best matching procedures, strongest first
 * @param correlationStrength  strength of the best procedure match (0.0-1.0)
 */
public record FailurePatternCorrelation(
        String failurePattern,
        String patternType,
        Severity severity,
        List<String> associatedComponents,
        List<Procedure> procedures,
        double correlationStrength
) {
    public FailurePatternCorrelation {
        failurePattern = failurePattern != null ? failurePattern : "";
        patternType = patternType != null && !patternType.isBlank() ? patternType : "unknown";
        Objects.requireNonNull(severity, "severity is required");
        associatedComponents = ModelCollections.listCopy(associatedComponents);
        procedures = ModelCollections.listCopy(procedures);
        ModelCollections.checkUnitInterval(correlationStrength, "correlationStrength");
    }

    /**
     * Creates a correlation with no linked procedures.
     */
    public static FailurePatternCorrelation of(String failurePattern, String patternType, Severity severity,
                                               List<String> associatedComponents) {
        return new FailurePatternCorrelation(failurePattern, patternType, severity,
                associatedComponents, List.of(), 0.0);
    }
}
