package com.diagnosis.correlation.validation;

import com.diagnosis.correlation.core.model.CanonicalEntity;
import com.diagnosis.correlation.core.model.ConsistencyViolation;
import com.diagnosis.correlation.core.model.CrossReference;
import com.diagnosis.correlation.core.model.FailurePatternCorrelation;
import com.diagnosis.correlation.core.model.ValidationStatus;
import com.diagnosis.correlation.core.model.ViolationTypes;
import com.diagnosis.correlation.graph.DanglingReference;
import com.diagnosis.correlation.similarity.NameSimilarity;
import com.diagnosis.correlation.similarity.SimilarityAlgorithm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the component names carried by failure patterns against the canonical
 * entities and grades each reference.
 *
 * <p>A name resolves to the first entity whose canonical name, original name or any
 * source alias equals it ignoring case, or whose canonical or original name has a
 * name similarity of at least 0.8. Resolved references get strength
 * {@code 0.7 x similarity(name, canonical) + 0.3 x mean source confidence}; unresolved
 * ones are INVALID and produce a broken cross-reference violation.</p>
 */
public class CrossReferenceValidator {

    static final double MATCH_SIMILARITY = 0.8;
    static final double VALID_STRENGTH = 0.7;
    static final double DEFAULT_SOURCE_CONFIDENCE = 0.5;

    private static final List<String> AFFECTED_SOURCES = List.of("failure_correlation", "component_correlation");

    private final SimilarityAlgorithm nameSimilarity;

    public CrossReferenceValidator() {
        this(new NameSimilarity());
    }

    public CrossReferenceValidator(SimilarityAlgorithm nameSimilarity) {
        this.nameSimilarity = nameSimilarity;
    }

    /**
     * Cross-references found and the violations raised for the broken ones.
     */
    public record Result(List<CrossReference> crossReferences, List<ConsistencyViolation> violations) {
    }

    public Result validate(ValidationContext context) {
        List<CrossReference> references = new ArrayList<>();
        List<ConsistencyViolation> violations = new ArrayList<>();

        for (FailurePatternCorrelation failure : context.failures()) {
            for (String component : failure.associatedComponents()) {
                Optional<CanonicalEntity> match = findMatch(component, context.entities());
                if (match.isPresent()) {
                    references.add(resolvedReference(failure, component, match.get()));
                } else {
                    references.add(brokenReference(failure, component));
                    violations.add(brokenFailureReference(failure, component));
                }
            }
        }

        for (DanglingReference dangling : context.danglingReferences()) {
            violations.add(brokenRelationship(dangling));
        }

        return new Result(references, violations);
    }

    Optional<CanonicalEntity> findMatch(String component, List<CanonicalEntity> entities) {
        String lower = component.toLowerCase(Locale.ROOT);
        for (CanonicalEntity entity : entities) {
            if (lower.equals(entity.canonicalName().toLowerCase(Locale.ROOT))
                    || lower.equals(entity.originalName().toLowerCase(Locale.ROOT))
                    || entity.aliases().stream().anyMatch(alias -> alias.equalsIgnoreCase(component))) {
                return Optional.of(entity);
            }
            double similarity = Math.max(
                    nameSimilarity.compute(component, entity.canonicalName()),
                    nameSimilarity.compute(component, entity.originalName()));
            if (similarity >= MATCH_SIMILARITY) {
                return Optional.of(entity);
            }
        }
        return Optional.empty();
    }

    double referenceStrength(String component, CanonicalEntity entity) {
        double similarity = nameSimilarity.compute(component, entity.canonicalName());
        double avgConfidence = entity.confidenceScores().values().stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(DEFAULT_SOURCE_CONFIDENCE);
        return Math.min(1.0, similarity * 0.7 + avgConfidence * 0.3);
    }

    private CrossReference resolvedReference(FailurePatternCorrelation failure, String component,
                                             CanonicalEntity entity) {
        double strength = referenceStrength(component, entity);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("match_confidence", strength);
        details.put("source_component", component);
        details.put("target_component", entity.canonicalName());
        return CrossReference.failureToComponent(failure.failurePattern(), entity.canonicalName(), strength,
                strength > VALID_STRENGTH ? ValidationStatus.VALID : ValidationStatus.UNCERTAIN, details);
    }

    private CrossReference brokenReference(FailurePatternCorrelation failure, String component) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", "Component not found in component correlations");
        details.put("missing_component", component);
        return CrossReference.failureToComponent(failure.failurePattern(), component, 0.0,
                ValidationStatus.INVALID, details);
    }

    private ConsistencyViolation brokenFailureReference(FailurePatternCorrelation failure, String component) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("missing_component", component);
        values.put("failure_pattern", failure.failurePattern());
        return brokenCrossReference("Failure pattern references unknown component \"" + component + "\"",
                AFFECTED_SOURCES, values);
    }

    private ConsistencyViolation brokenRelationship(DanglingReference dangling) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("missing_component", dangling.missingItem());
        values.put("referencing_component", dangling.referencingItem());
        values.put("relationship_type", dangling.relationshipType().getWireName());
        return brokenCrossReference("Relationship from \"" + dangling.referencingItem()
                        + "\" references unknown component \"" + dangling.missingItem() + "\"",
                List.of("component_inventory", "component_correlation"), values);
    }

    private ConsistencyViolation brokenCrossReference(String description, List<String> sources,
                                                      Map<String, Object> values) {
        String type = ViolationTypes.BROKEN_CROSS_REFERENCE;
        return new ConsistencyViolation(type, description, sources, values,
                ResolutionSuggestions.severityFor(type), ResolutionSuggestions.suggestionFor(type), 0.9);
    }
}
