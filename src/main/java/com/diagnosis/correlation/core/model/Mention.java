package com.diagnosis.correlation.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A raw, source-specific textual reference to a component or failure pattern,
 * as produced by an extractor. Read-only input to the engine.
 *
 * @param text       the mention text as it appeared in the source
 * @param sourceType the source the mention came from (e.g. {@code log_analysis})
 * @param attributes optional extractor-specific attributes
 */
public record Mention(String text, String sourceType, Map<String, Object> attributes) {

    public Mention {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(sourceType, "sourceType is required");
        attributes = ModelCollections.mapCopy(attributes);
    }

    public static Mention of(String text, String sourceType) {
        return new Mention(text, sourceType, Map.of());
    }
}
