package com.diagnosis.correlation.validation;

/**
 * Coarse grade of an overall consistency score.
 */
public enum ConsistencyLevel {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * HIGH from 0.8, MEDIUM from 0.6, LOW below.
     */
    public static ConsistencyLevel of(double overallConsistency) {
        if (overallConsistency >= 0.8) {
            return HIGH;
        }
        if (overallConsistency >= 0.6) {
            return MEDIUM;
        }
        return LOW;
    }
}
