package com.diagnosis.correlation.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of remediation proposed for a violation, with its fixed effort estimate.
 */
public enum ResolutionType {
    CANONICAL_NAME_ASSIGNMENT("canonical_name_assignment", 0.5, "LOW", true),
    SEVERITY_STANDARDIZATION("severity_standardization", 2.0, "MEDIUM", false),
    REFERENCE_REPAIR("reference_repair", 2.0, "MEDIUM", true),
    MANUAL_REVIEW("manual_review", 8.0, "HIGH", false);

    private final String wireName;
    private final double effortHours;
    private final String effortLevel;
    private final boolean quickWin;

    ResolutionType(String wireName, double effortHours, String effortLevel, boolean quickWin) {
        this.wireName = wireName;
        this.effortHours = effortHours;
        this.effortLevel = effortLevel;
        this.quickWin = quickWin;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public double getEffortHours() {
        return effortHours;
    }

    /**
     * Effort bucket: LOW, MEDIUM or HIGH.
     */
    public String getEffortLevel() {
        return effortLevel;
    }

    /**
     * Quick wins are scheduled short-term and first under the quick_wins strategy.
     */
    public boolean isQuickWin() {
        return quickWin;
    }

    @JsonCreator
    public static ResolutionType fromWireName(String value) {
        for (ResolutionType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return MANUAL_REVIEW;
    }
}
