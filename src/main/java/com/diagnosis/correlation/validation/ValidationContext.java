package com.diagnosis.correlation.validation;

import com.diagnosis.correlation.core.model.CanonicalEntity;
import com.diagnosis.correlation.core.model.FailurePatternCorrelation;
import com.diagnosis.correlation.core.model.ModelCollections;
import com.diagnosis.correlation.graph.CorrelationGraph;
import com.diagnosis.correlation.graph.DanglingReference;

import java.util.List;

/**
 * Everything a consistency rule may inspect.
 *
 * @param entities           canonical entities of the run
 * @param failures           failure pattern correlations of the run
 * @param danglingReferences documented relationships with an unresolved endpoint
 */
public record ValidationContext(
        List<CanonicalEntity> entities,
        List<FailurePatternCorrelation> failures,
        List<DanglingReference> danglingReferences
) {
    public ValidationContext {
        entities = ModelCollections.listCopy(entities);
        failures = ModelCollections.listCopy(failures);
        danglingReferences = ModelCollections.listCopy(danglingReferences);
    }

    public static ValidationContext of(CorrelationGraph graph, List<FailurePatternCorrelation> failures) {
        return new ValidationContext(graph.entities(), failures, graph.danglingReferences());
    }

    public static ValidationContext of(List<CanonicalEntity> entities, List<FailurePatternCorrelation> failures) {
        return new ValidationContext(entities, failures, List.of());
    }
}
