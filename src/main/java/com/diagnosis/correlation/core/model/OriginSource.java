package com.diagnosis.correlation.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a relationship edge came from.
 */
public enum OriginSource {
    /**
     * Stated directly in source data.
     */
    DOCUMENTATION("documentation"),

    /**
     * Inferred from keywords in component function text.
     */
    FUNCTION_INFERENCE("function_inference");

    private final String wireName;

    OriginSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static OriginSource fromWireName(String value) {
        for (OriginSource source : values()) {
            if (source.wireName.equalsIgnoreCase(value) || source.name().equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown origin source: " + value);
    }
}
