package com.diagnosis.correlation.core.model;

/**
 * Validation status of a cross-reference from a failure pattern to a canonical entity.
 */
public enum ValidationStatus {
    /**
     * Reference resolves to a known entity with strength above 0.7.
     */
    VALID,

    /**
     * Reference does not resolve to any known entity.
     */
    INVALID,

    /**
     * Reference resolves to an entity but the match is weak.
     */
    UNCERTAIN
}
