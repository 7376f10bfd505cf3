package com.diagnosis.correlation.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.List;
import java.util.Map;

/**
 * Shared Jackson configuration. All wire shapes use snake_case property names.
 */
public final class JsonSupport {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {
    };

    private static final ObjectMapper MAPPER = createMapper();

    private JsonSupport() {
    }

    /**
     * Creates a mapper with snake_case naming that ignores unknown input properties.
     */
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.ALWAYS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Converts a value object to its map form.
     */
    public static Map<String, Object> toMap(Object value) {
        return MAPPER.convertValue(value, MAP_TYPE);
    }

    /**
     * Converts a collection of value objects to a list of maps.
     */
    public static List<Object> toList(Object values) {
        return MAPPER.convertValue(values, LIST_TYPE);
    }

    /**
     * Converts a map to a value object.
     *
     * @throws IllegalArgumentException if the map does not fit the target type
     */
    public static <T> T fromMap(Object map, Class<T> type) {
        return MAPPER.convertValue(map, type);
    }

    /**
     * Renders a value as pretty-printed JSON.
     *
     * @throws IllegalStateException if the value cannot be serialized
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render JSON: " + e.getOriginalMessage(), e);
        }
    }
}
