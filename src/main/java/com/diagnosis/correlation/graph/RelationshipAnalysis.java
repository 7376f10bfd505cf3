package com.diagnosis.correlation.graph;

import com.diagnosis.correlation.core.model.CanonicalEntity;
import com.diagnosis.correlation.core.model.ModelCollections;
import com.diagnosis.correlation.core.model.RelationshipEdge;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary statistics of the relationship graph.
 *
 * @param totalRelationships  number of edges
 * @param relationshipTypes   edge count per relationship type, in first-seen order
 * @param relationshipDensity {@code edges / (n x (n - 1))}, 0 when there are fewer than two entities
 * @param mostConnected       up to five entities with the most incident edges
 * @param averageConnectionsPerComponent edges per entity, 0 when there are no entities
 * @param relationshipMatrix  for every ordered entity pair, {@code self} on the diagonal, the wire
 *                            name of the first edge between them, or {@code none}; serialized
 *                            separately from the summary
 */
public record RelationshipAnalysis(
        int totalRelationships,
        Map<String, Integer> relationshipTypes,
        double relationshipDensity,
        List<ConnectedEntity> mostConnected,
        double averageConnectionsPerComponent,
        @JsonIgnore Map<String, Map<String, String>> relationshipMatrix
) {
    static final int MOST_CONNECTED_LIMIT = 5;

    public RelationshipAnalysis {
        relationshipTypes = ModelCollections.mapCopy(relationshipTypes);
        mostConnected = ModelCollections.listCopy(mostConnected);
        relationshipMatrix = ModelCollections.mapCopy(relationshipMatrix);
    }

    /**
     * @param name        canonical name
     * @param connections number of incoming plus outgoing edges
     */
    public record ConnectedEntity(String name, int connections) {
    }

    public static RelationshipAnalysis of(CorrelationGraph graph) {
        List<RelationshipEdge> edges = graph.edges();
        Map<String, Integer> typeCounts = new LinkedHashMap<>();
        Map<String, Integer> degree = new LinkedHashMap<>();
        graph.entities().forEach(e -> degree.put(e.canonicalName(), 0));

        for (RelationshipEdge edge : edges) {
            typeCounts.merge(edge.type().getWireName(), 1, Integer::sum);
            degree.merge(edge.sourceEntity(), 1, Integer::sum);
            degree.merge(edge.targetEntity(), 1, Integer::sum);
        }

        int n = graph.entities().size();
        double density = n > 1 ? Math.min(1.0, (double) edges.size() / ((double) n * (n - 1))) : 0.0;

        List<ConnectedEntity> connected = new ArrayList<>();
        degree.forEach((name, count) -> {
            if (count > 0) {
                connected.add(new ConnectedEntity(name, count));
            }
        });
        connected.sort(Comparator.comparingInt(ConnectedEntity::connections).reversed()
                .thenComparing(ConnectedEntity::name));

        double averageConnections = n > 0 ? (double) edges.size() / n : 0.0;

        return new RelationshipAnalysis(edges.size(), typeCounts, density,
                connected.subList(0, Math.min(MOST_CONNECTED_LIMIT, connected.size())),
                averageConnections, matrix(graph.entities(), edges));
    }

    static Map<String, Map<String, String>> matrix(List<CanonicalEntity> entities, List<RelationshipEdge> edges) {
        Map<String, Map<String, String>> matrix = new LinkedHashMap<>();
        for (CanonicalEntity from : entities) {
            Map<String, String> row = new LinkedHashMap<>();
            for (CanonicalEntity to : entities) {
                row.put(to.canonicalName(), from.canonicalName().equals(to.canonicalName()) ? "self" : "none");
            }
            matrix.put(from.canonicalName(), row);
        }
        for (RelationshipEdge edge : edges) {
            Map<String, String> row = matrix.get(edge.sourceEntity());
            if (row != null && "none".equals(row.get(edge.targetEntity()))) {
                row.put(edge.targetEntity(), edge.type().getWireName());
            }
        }
        matrix.replaceAll((name, row) -> Collections.unmodifiableMap(row));
        return matrix;
    }
}
