package com.diagnosis.correlation.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A link from a failure pattern to a canonical entity, carrying a validation status.
 *
 * @param sourceType        kind of the referring item
 * @param targetType        kind of the referenced item
 * @param sourceItem        the referring failure pattern
 * @param targetItem        the resolved canonical name, or the raw reference when unresolved
 * @param strength          reference strength (0.0-1.0)
 * @param validationStatus  validation outcome
 * @param validationDetails supporting details
 */
public record CrossReference(
        String sourceType,
        String targetType,
        String sourceItem,
        String targetItem,
        double strength,
        ValidationStatus validationStatus,
        Map<String, Object> validationDetails
) {
    public static final String FAILURE_CORRELATION = "failure_correlation";
    public static final String COMPONENT_CORRELATION = "component_correlation";

    public CrossReference {
        Objects.requireNonNull(sourceItem, "sourceItem is required");
        Objects.requireNonNull(targetItem, "targetItem is required");
        Objects.requireNonNull(validationStatus, "validationStatus is required");
        ModelCollections.checkUnitInterval(strength, "strength");
        validationDetails = ModelCollections.mapCopy(validationDetails);
    }

    /**
     * Creates a failure-pattern-to-component reference.
     */
    public static CrossReference failureToComponent(String failurePattern, String component, double strength,
                                                    ValidationStatus status, Map<String, Object> details) {
        return new CrossReference(FAILURE_CORRELATION, COMPONENT_CORRELATION,
                failurePattern, component, strength, status, details);
    }
}
