package com.diagnosis.correlation.graph;

import com.diagnosis.correlation.core.model.CanonicalEntity;
import com.diagnosis.correlation.similarity.SimilarityAlgorithm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-source consistency metrics of a set of canonical entities:
 * {@code component_identification}, {@code source_agreement} and
 * {@code failure_pattern_coverage}. Empty when there are no entities.
 */
public class CorrelationMetricsCalculator {

    public static final String COMPONENT_IDENTIFICATION = "component_identification";
    public static final String SOURCE_AGREEMENT = "source_agreement";
    public static final String FAILURE_PATTERN_COVERAGE = "failure_pattern_coverage";

    static final double HIGH_CONSISTENCY = 0.8;
    static final double AGREEMENT_SIMILARITY = 0.7;
    static final double EXPECTED_FAILURE_ASSOCIATIONS = 3.0;

    private final SimilarityAlgorithm similarity;

    public CorrelationMetricsCalculator(SimilarityAlgorithm similarity) {
        this.similarity = similarity;
    }

    public Map<String, Double> calculate(List<CanonicalEntity> entities) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        if (entities.isEmpty()) {
            return metrics;
        }

        long highConfidence = entities.stream()
                .filter(e -> e.consistencyScore() > HIGH_CONSISTENCY)
                .count();
        metrics.put(COMPONENT_IDENTIFICATION, (double) highConfidence / entities.size());

        List<Double> agreements = new ArrayList<>();
        for (CanonicalEntity entity : entities) {
            if (entity.isMultiSource()) {
                agreements.add(sourceAgreement(entity));
            }
        }
        metrics.put(SOURCE_AGREEMENT, agreements.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));

        double avgAssociations = entities.stream()
                .mapToInt(e -> e.failureAssociations().size())
                .average()
                .orElse(0.0);
        metrics.put(FAILURE_PATTERN_COVERAGE, Math.min(1.0, avgAssociations / EXPECTED_FAILURE_ASSOCIATIONS));

        return metrics;
    }

    /**
     * Share of source pairs that report at least one pair of similar aliases.
     */
    double sourceAgreement(CanonicalEntity entity) {
        List<List<String>> references = new ArrayList<>(entity.sourceReferences().values());
        int comparisons = 0;
        int agreements = 0;
        for (int i = 0; i < references.size(); i++) {
            for (int j = i + 1; j < references.size(); j++) {
                comparisons++;
                if (anySimilar(references.get(i), references.get(j))) {
                    agreements++;
                }
            }
        }
        return comparisons == 0 ? 0.0 : (double) agreements / comparisons;
    }

    private boolean anySimilar(List<String> refs1, List<String> refs2) {
        for (String ref1 : refs1) {
            for (String ref2 : refs2) {
                if (similarity.compute(ref1, ref2) > AGREEMENT_SIMILARITY) {
                    return true;
                }
            }
        }
        return false;
    }
}
