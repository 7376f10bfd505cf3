package com.diagnosis.correlation.report;

import com.diagnosis.correlation.core.model.Severity;

/**
 * Priority of a report recommendation, most urgent first.
 */
public enum RecommendationPriority {
    IMMEDIATE,
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Maps a resolution priority onto a recommendation priority. CRITICAL becomes IMMEDIATE.
     */
    public static RecommendationPriority fromSeverity(Severity severity) {
        return switch (severity) {
            case CRITICAL -> IMMEDIATE;
            case HIGH -> HIGH;
            case MEDIUM -> MEDIUM;
            case LOW -> LOW;
        };
    }
}
