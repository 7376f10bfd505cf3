package com.diagnosis.correlation.core.model;

import java.util.Objects;

/**
 * Directed relationship between two canonical entities.
 * Parallel edges of different types between the same pair are allowed.
 *
 * @param sourceEntity canonical name of the source entity
 * @param targetEntity canonical name of the target entity
 * @param type         relationship type
 * @param confidence   confidence of the relationship (0.0-1.0)
 * @param originSource whether the edge was documented or inferred
 */
public record RelationshipEdge(
        String sourceEntity,
        String targetEntity,
        RelationshipType type,
        double confidence,
        OriginSource originSource
) {
    public RelationshipEdge {
        Objects.requireNonNull(sourceEntity, "sourceEntity is required");
        Objects.requireNonNull(targetEntity, "targetEntity is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(originSource, "originSource is required");
        ModelCollections.checkUnitInterval(confidence, "confidence");
    }
}
