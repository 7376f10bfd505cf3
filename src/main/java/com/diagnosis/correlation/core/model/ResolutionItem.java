package com.diagnosis.correlation.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single actionable remediation for one consistency violation.
 *
 * @param violationRef    stable id derived from the violation content
 * @param violationType   type of the violation being resolved
 * @param resolutionType  kind of remediation
 * @param priority        priority, equal to the violation severity
 * @param action          the action to take
 * @param description     longer explanation
 * @param affectedItems   type-specific details (suggested values, alternatives)
 * @param affectedSources sources affected by the violation
 * @param confidence      confidence of the underlying violation
 */
public record ResolutionItem(
        String violationRef,
        String violationType,
        ResolutionType resolutionType,
        Severity priority,
        String action,
        String description,
        Map<String, Object> affectedItems,
        List<String> affectedSources,
        double confidence
) {
    public ResolutionItem {
        Objects.requireNonNull(violationRef, "violationRef is required");
        Objects.requireNonNull(resolutionType, "resolutionType is required");
        Objects.requireNonNull(priority, "priority is required");
        action = action != null ? action : "";
        description = description != null ? description : "";
        affectedItems = ModelCollections.mapCopy(affectedItems);
        affectedSources = ModelCollections.listCopy(affectedSources);
        ModelCollections.checkUnitInterval(confidence, "confidence");
    }
}
