package com.diagnosis.correlation.graph;

import com.diagnosis.correlation.core.model.CanonicalEntity;
import com.diagnosis.correlation.core.model.ComponentCluster;
import com.diagnosis.correlation.core.model.RelationshipEdge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups canonical entities into clusters by breadth-first traversal of the forward
 * relationship edges.
 *
 * <p>A single visited set is shared by all traversals, so each entity is visited once
 * and traversal terminates on cyclic graphs. Only groups of two or more are reported.</p>
 */
public class ComponentClusterer {

    public List<ComponentCluster> cluster(CorrelationGraph graph) {
        return cluster(graph.entities(), graph.edges());
    }

    public List<ComponentCluster> cluster(List<CanonicalEntity> entities, List<RelationshipEdge> edges) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (CanonicalEntity entity : entities) {
            adjacency.put(entity.canonicalName(), new ArrayList<>());
        }
        for (RelationshipEdge edge : edges) {
            List<String> targets = adjacency.get(edge.sourceEntity());
            if (targets != null && adjacency.containsKey(edge.targetEntity())) {
                targets.add(edge.targetEntity());
            }
        }

        Set<String> visited = new HashSet<>();
        List<ComponentCluster> clusters = new ArrayList<>();

        for (String start : adjacency.keySet()) {
            if (visited.contains(start)) {
                continue;
            }
            List<String> members = traverse(start, adjacency, visited);
            if (members.size() >= 2) {
                clusters.add(new ComponentCluster(clusters.size() + 1, members, start));
            }
        }
        return clusters;
    }

    private List<String> traverse(String start, Map<String, List<String>> adjacency, Set<String> visited) {
        List<String> members = new ArrayList<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        visited.add(start);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            members.add(current);
            for (String next : adjacency.getOrDefault(current, List.of())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return members;
    }
}
