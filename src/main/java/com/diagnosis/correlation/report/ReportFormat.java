package com.diagnosis.correlation.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Audience of a diagnostic report.
 */
public enum ReportFormat {
    /** All sections, technical appendix included. */
    COMPREHENSIVE("comprehensive", true),
    /** Summary sections and the top five recommendations only. */
    EXECUTIVE("executive", false),
    /** All sections, marked for a technical audience. */
    TECHNICAL("technical", true);

    static final int EXECUTIVE_RECOMMENDATION_LIMIT = 5;

    private final String wireName;
    private final boolean includesAppendix;

    ReportFormat(String wireName, boolean includesAppendix) {
        this.wireName = wireName;
        this.includesAppendix = includesAppendix;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean includesAppendix() {
        return includesAppendix;
    }

    /**
     * Detail level reported in the report metadata.
     */
    public String detailLevel() {
        return this == EXECUTIVE ? "summary_only" : "comprehensive";
    }

    @JsonCreator
    public static ReportFormat fromWireName(String value) {
        for (ReportFormat format : values()) {
            if (format.wireName.equalsIgnoreCase(value) || format.name().equalsIgnoreCase(value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown report format: " + value);
    }
}
