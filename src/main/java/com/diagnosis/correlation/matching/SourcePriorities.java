package com.diagnosis.correlation.matching;

import com.diagnosis.correlation.source.SourceTypes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed trust ordering of the data sources, used to weight match scores.
 */
public final class SourcePriorities {

    public static final double UNKNOWN_SOURCE_PRIORITY = 0.5;

    private static final Map<String, Double> PRIORITIES;

    static {
        Map<String, Double> priorities = new LinkedHashMap<>();
        priorities.put(SourceTypes.ENGINEERING_DOCS, 1.0);
        priorities.put(SourceTypes.TROUBLESHOOTING_GUIDES, 0.9);
        priorities.put(SourceTypes.LOG_ANALYSIS, 0.8);
        priorities.put(SourceTypes.COMPONENT_INVENTORY, 0.7);
        PRIORITIES = Collections.unmodifiableMap(priorities);
    }

    private SourcePriorities() {
        // Utility class
    }

    /**
     * Returns the priority of a source, or 0.5 for sources not in the table.
     */
    public static double priorityOf(String sourceType) {
        if (sourceType == null) {
            return UNKNOWN_SOURCE_PRIORITY;
        }
        return PRIORITIES.getOrDefault(sourceType, UNKNOWN_SOURCE_PRIORITY);
    }

    public static Map<String, Double> all() {
        return PRIORITIES;
    }
}
