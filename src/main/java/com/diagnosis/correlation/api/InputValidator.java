package com.diagnosis.correlation.api;

import com.diagnosis.correlation.source.SourceData;

import java.util.Collection;
import java.util.Map;

/**
 * Checks the inputs of engine operations.
 * Every check throws {@link InvalidInputException}.
 */
public final class InputValidator {

    public static final String ERROR_KEY = "error";

    private InputValidator() {
    }

    /**
     * Requires at least one source with data.
     */
    public static SourceData requireSources(SourceData sources) {
        if (sources == null) {
            throw new InvalidInputException("Source data is required");
        }
        if (sources.isEmpty()) {
            throw new InvalidInputException("No component mentions found in any source");
        }
        return sources;
    }

    public static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new InvalidInputException(name + " is required");
        }
        return value;
    }

    public static <C extends Collection<?>> C requireNonEmpty(C values, String name) {
        requireNonNull(values, name);
        if (values.isEmpty()) {
            throw new InvalidInputException(name + " must not be empty");
        }
        return values;
    }

    /**
     * Rejects upstream results that carry an {@code error} key.
     */
    public static Map<String, Object> requireNoUpstreamError(Map<String, Object> data, String name) {
        requireNonNull(data, name);
        if (data.containsKey(ERROR_KEY)) {
            throw new InvalidInputException(name + " contains an upstream error: " + data.get(ERROR_KEY));
        }
        return data;
    }

    /**
     * Returns the map stored under the key.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> requireMap(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (!(value instanceof Map<?, ?> map)) {
            throw new InvalidInputException("Missing required key: " + key);
        }
        return (Map<String, Object>) map;
    }

    public static double requireUnitInterval(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidInputException(name + " must be between 0.0 and 1.0");
        }
        return value;
    }
}
