package com.diagnosis.correlation.graph;

import com.diagnosis.correlation.core.model.RelationshipType;

import java.util.Objects;

/**
 * A documented relationship whose endpoint does not resolve to any canonical entity.
 * Reported as a broken cross-reference instead of becoming an edge.
 *
 * @param referencingItem  the component that states the relationship
 * @param missingItem      the endpoint that could not be resolved
 * @param relationshipType the type the edge would have had
 */
public record DanglingReference(String referencingItem, String missingItem, RelationshipType relationshipType) {

    public DanglingReference {
        Objects.requireNonNull(referencingItem, "referencingItem is required");
        Objects.requireNonNull(missingItem, "missingItem is required");
        Objects.requireNonNull(relationshipType, "relationshipType is required");
    }
}
