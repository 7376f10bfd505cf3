package com.diagnosis.correlation.graph;

import com.diagnosis.correlation.core.model.CanonicalEntity;
import com.diagnosis.correlation.core.model.ModelCollections;
import com.diagnosis.correlation.core.model.RelationshipEdge;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical entities of one run together with the relationships between them.
 * Every edge endpoint is the canonical name of an entity in {@link #entities()}.
 *
 * @param entities           canonical entities, in resolution order
 * @param edges              explicit and inferred relationships
 * @param danglingReferences documented relationships that could not be resolved
 * @param sourceMentions     candidate mentions per source the entities were resolved from
 * @param totalMentions      number of distinct mention strings across all sources
 */
public record CorrelationGraph(
        List<CanonicalEntity> entities,
        List<RelationshipEdge> edges,
        List<DanglingReference> danglingReferences,
        Map<String, List<String>> sourceMentions,
        int totalMentions
) {
    public CorrelationGraph {
        entities = ModelCollections.listCopy(entities);
        edges = ModelCollections.listCopy(edges);
        danglingReferences = ModelCollections.listCopy(danglingReferences);
        sourceMentions = ModelCollections.multimapCopy(sourceMentions);
        if (totalMentions < 0) {
            throw new IllegalArgumentException("totalMentions must be >= 0");
        }
    }

    public static CorrelationGraph empty() {
        return new CorrelationGraph(List.of(), List.of(), List.of(), Map.of(), 0);
    }

    public Optional<CanonicalEntity> findEntity(String canonicalName) {
        return entities.stream()
                .filter(e -> e.canonicalName().equals(canonicalName))
                .findFirst();
    }

    public List<RelationshipEdge> edgesFrom(String canonicalName) {
        return edges.stream()
                .filter(e -> e.sourceEntity().equals(canonicalName))
                .toList();
    }

    /**
     * Share of distinct mentions that ended up in a canonical entity.
     */
    public double correlationRate() {
        return totalMentions == 0 ? 0.0 : Math.min(1.0, (double) entities.size() / totalMentions);
    }

    public double averageConsistencyScore() {
        return entities.stream()
                .mapToDouble(CanonicalEntity::consistencyScore)
                .average()
                .orElse(0.0);
    }
}
