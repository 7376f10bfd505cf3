package com.diagnosis.correlation.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The single resolved identity chosen to represent all mentions judged to refer
 * to the same real component.
 *
 * <p>Created once per resolved mention group; a canonical name is never duplicated
 * within one run.</p>
 *
 * @param canonicalName      resolved canonical name
 * @param originalName       the mention that seeded this entity
 * @param sourceReferences   per-source raw aliases that matched this entity
 * @param confidenceScores   per-source best match score
 * @param failureAssociations failure pattern descriptions linked to this entity
 * @param relatedProcedures  titles of documented procedures mentioning this entity
 * @param consistencyScore   mean of the per-source confidence scores
 */
public record CanonicalEntity(
        String canonicalName,
        String originalName,
        Map<String, List<String>> sourceReferences,
        Map<String, Double> confidenceScores,
        List<String> failureAssociations,
        List<String> relatedProcedures,
        double consistencyScore
) {
    public CanonicalEntity {
        Objects.requireNonNull(canonicalName, "canonicalName is required");
        Objects.requireNonNull(originalName, "originalName is required");
        sourceReferences = ModelCollections.multimapCopy(sourceReferences);
        confidenceScores = ModelCollections.mapCopy(confidenceScores);
        failureAssociations = ModelCollections.listCopy(failureAssociations);
        relatedProcedures = ModelCollections.listCopy(relatedProcedures);
        ModelCollections.checkUnitInterval(consistencyScore, "consistencyScore");
        confidenceScores.forEach((source, score) ->
                ModelCollections.checkUnitInterval(score, "confidenceScores[" + source + "]"));
    }

    /**
     * Returns the distinct raw aliases across all sources, in first-seen order.
     */
    @JsonIgnore
    public Set<String> aliases() {
        Set<String> aliases = new LinkedHashSet<>();
        sourceReferences.values().forEach(aliases::addAll);
        return aliases;
    }

    /**
     * Returns true if mentions from more than one source resolved to this entity.
     */
    @JsonIgnore
    public boolean isMultiSource() {
        return sourceReferences.size() > 1;
    }

    /**
     * Returns the aliases reported by a single source, or an empty list.
     */
    public List<String> referencesFrom(String sourceType) {
        return sourceReferences.getOrDefault(sourceType, List.of());
    }

    /**
     * Returns a copy of this entity with the given failure associations and procedures.
     */
    public CanonicalEntity withAssociations(List<String> failures, List<String> procedures) {
        return new CanonicalEntity(canonicalName, originalName, sourceReferences, confidenceScores,
                failures, procedures, consistencyScore);
    }
}
