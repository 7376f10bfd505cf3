package com.diagnosis.correlation.validation;

import com.diagnosis.correlation.core.model.Severity;
import com.diagnosis.correlation.core.model.ViolationTypes;

import java.util.Map;

/**
 * Default severity and remediation text per violation type.
 */
public final class ResolutionSuggestions {

    private static final Map<String, String> SUGGESTIONS = Map.of(
            ViolationTypes.COMPONENT_NAME_CONFLICT, "Use highest confidence source for canonical name",
            ViolationTypes.FAILURE_SEVERITY_MISMATCH, "Review failure analysis criteria and re-evaluate",
            ViolationTypes.BROKEN_CROSS_REFERENCE, "Update references or mark as deprecated",
            ViolationTypes.MISSING_CANONICAL_NAME, "Generate canonical name from most common variant",
            ViolationTypes.INCONSISTENT_FAILURE_ASSOCIATION, "Cross-validate with additional data sources",
            ViolationTypes.DATA_SOURCE_MISMATCH, "Verify data source integrity and update if necessary"
    );

    private static final Map<String, Severity> SEVERITIES = Map.of(
            ViolationTypes.COMPONENT_NAME_CONFLICT, Severity.MEDIUM,
            ViolationTypes.FAILURE_SEVERITY_MISMATCH, Severity.HIGH,
            ViolationTypes.BROKEN_CROSS_REFERENCE, Severity.MEDIUM,
            ViolationTypes.MISSING_CANONICAL_NAME, Severity.LOW,
            ViolationTypes.INCONSISTENT_FAILURE_ASSOCIATION, Severity.HIGH,
            ViolationTypes.DATA_SOURCE_MISMATCH, Severity.MEDIUM
    );

    private ResolutionSuggestions() {
        // Constants class
    }

    public static String suggestionFor(String violationType) {
        return SUGGESTIONS.getOrDefault(violationType, "Review manually");
    }

    public static Severity severityFor(String violationType) {
        return SEVERITIES.getOrDefault(violationType, Severity.MEDIUM);
    }
}
