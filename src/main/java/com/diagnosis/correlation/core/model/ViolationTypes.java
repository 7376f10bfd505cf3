package com.diagnosis.correlation.core.model;

import java.util.List;

/**
 * Names of the violation types emitted by the consistency rules.
 * Violation types stay strings because violations reconstructed from serialized
 * form may carry types this engine does not know.
 */
public final class ViolationTypes {

    public static final String COMPONENT_NAME_CONFLICT = "component_name_conflict";
    public static final String MISSING_CANONICAL_NAME = "missing_canonical_name";
    public static final String DATA_SOURCE_MISMATCH = "data_source_mismatch";
    public static final String FAILURE_SEVERITY_MISMATCH = "failure_severity_mismatch";
    public static final String INCONSISTENT_FAILURE_ASSOCIATION = "inconsistent_failure_association";
    public static final String BROKEN_CROSS_REFERENCE = "broken_cross_reference";

    public static final List<String> ALL = List.of(
            COMPONENT_NAME_CONFLICT,
            MISSING_CANONICAL_NAME,
            DATA_SOURCE_MISMATCH,
            FAILURE_SEVERITY_MISMATCH,
            INCONSISTENT_FAILURE_ASSOCIATION,
            BROKEN_CROSS_REFERENCE
    );

    private ViolationTypes() {
        // Constants class
    }

    /**
     * True for types counted by the component consistency metric.
     */
    public static boolean isComponentType(String violationType) {
        return violationType != null && violationType.contains("component");
    }

    /**
     * True for types counted by the failure consistency metric.
     */
    public static boolean isFailureType(String violationType) {
        return violationType != null && violationType.contains("failure");
    }
}
