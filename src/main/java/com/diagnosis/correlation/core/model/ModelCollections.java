package com.diagnosis.correlation.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insertion-ordered immutable copies for model records.
 * {@link Map#copyOf} is avoided because its iteration order is not stable across runs.
 */
public final class ModelCollections {

    private ModelCollections() {
        // Utility class
    }

    public static <T> List<T> listCopy(List<T> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(source));
    }

    public static <K, V> Map<K, V> mapCopy(Map<K, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /**
     * Copies a map of lists, copying each value list as well.
     */
    public static <K, V> Map<K, List<V>> multimapCopy(Map<K, List<V>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<K, List<V>> copy = new LinkedHashMap<>();
        source.forEach((key, values) -> copy.put(key, listCopy(values)));
        return Collections.unmodifiableMap(copy);
    }

    static void checkUnitInterval(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got " + value);
        }
    }
}
