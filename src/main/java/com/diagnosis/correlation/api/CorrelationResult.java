package com.diagnosis.correlation.api;

import com.diagnosis.correlation.core.model.CanonicalEntity;
import com.diagnosis.correlation.core.model.ComponentCluster;
import com.diagnosis.correlation.core.model.ModelCollections;
import com.diagnosis.correlation.graph.CorrelationGraph;
import com.diagnosis.correlation.graph.RelationshipAnalysis;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of correlating components across sources.
 *
 * @param graph                correlation graph of the run
 * @param consistencyMetrics   cross-source metrics (empty when nothing was resolved)
 * @param summary              correlation counts and rates
 * @param relationshipAnalysis relationship statistics of the graph
 * @param clusters             connected groups of at least two entities
 */
public record CorrelationResult(
        CorrelationGraph graph,
        Map<String, Double> consistencyMetrics,
        CorrelationSummary summary,
        RelationshipAnalysis relationshipAnalysis,
        List<ComponentCluster> clusters
) {
    public CorrelationResult {
        Objects.requireNonNull(graph, "graph is required");
        consistencyMetrics = ModelCollections.mapCopy(consistencyMetrics);
        Objects.requireNonNull(summary, "summary is required");
        Objects.requireNonNull(relationshipAnalysis, "relationshipAnalysis is required");
        clusters = ModelCollections.listCopy(clusters);
    }

    public List<CanonicalEntity> componentCorrelations() {
        return graph.entities();
    }

    /**
     * @param totalComponentsFound distinct mentions across all sources
     * @param componentsCorrelated canonical entities resolved from them
     * @param correlationRate      share of mentions that became entities
     * @param avgConsistencyScore  mean entity consistency score
     * @param sourcesAnalyzed      sources that contributed mentions
     */
    public record CorrelationSummary(
            int totalComponentsFound,
            int componentsCorrelated,
            double correlationRate,
            double avgConsistencyScore,
            List<String> sourcesAnalyzed
    ) {
        public CorrelationSummary {
            sourcesAnalyzed = ModelCollections.listCopy(sourcesAnalyzed);
        }

        public static CorrelationSummary of(CorrelationGraph graph) {
            return new CorrelationSummary(graph.totalMentions(), graph.entities().size(),
                    graph.correlationRate(), graph.averageConsistencyScore(),
                    List.copyOf(graph.sourceMentions().keySet()));
        }
    }
}
