package com.diagnosis.correlation.graph;

import com.diagnosis.correlation.core.model.CanonicalEntity;
import com.diagnosis.correlation.core.model.Procedure;
import com.diagnosis.correlation.core.model.RelationshipEdge;
import com.diagnosis.correlation.core.model.RelationshipType;
import com.diagnosis.correlation.extraction.SourceMentionCollector;
import com.diagnosis.correlation.matching.ComponentMatcher;
import com.diagnosis.correlation.matching.ConflictResolver;
import com.diagnosis.correlation.matching.MatchCandidate;
import com.diagnosis.correlation.matching.Resolution;
import com.diagnosis.correlation.source.ComponentInventory;
import com.diagnosis.correlation.source.ComponentRecord;
import com.diagnosis.correlation.source.LogIssue;
import com.diagnosis.correlation.source.SourceData;
import com.diagnosis.correlation.source.SourceTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Assembles the correlation graph: canonical entities resolved from the mentions of
 * every source, and the relationships between them.
 *
 * <p>Each distinct mention, in sorted order, is matched against the candidates of every
 * source and resolved to a canonical name. Resolutions below the correlation threshold
 * are discarded. A canonical name is created once per run; later mention groups that
 * resolve to an already claimed name are merged into the existing entity.</p>
 */
public class CorrelationGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(CorrelationGraphBuilder.class);

    private final SourceMentionCollector mentionCollector;
    private final ComponentMatcher matcher;
    private final ConflictResolver conflictResolver;
    private final RelationshipInferrer relationshipInferrer;

    public CorrelationGraphBuilder(SourceMentionCollector mentionCollector, ComponentMatcher matcher,
                                   ConflictResolver conflictResolver, RelationshipInferrer relationshipInferrer) {
        this.mentionCollector = mentionCollector;
        this.matcher = matcher;
        this.conflictResolver = conflictResolver;
        this.relationshipInferrer = relationshipInferrer;
    }

    /**
     * Builds the graph for one run.
     *
     * @param sources              extractor outputs
     * @param matchThreshold       minimum similarity for a candidate to count as a match
     * @param correlationThreshold minimum resolution confidence for an entity to be kept
     * @param includeInferred      whether function-based relationships are inferred
     */
    public CorrelationGraph build(SourceData sources, double matchThreshold, double correlationThreshold,
                                  boolean includeInferred) {
        Map<String, List<String>> sourceMentions = mentionCollector.collect(sources);
        Set<String> allMentions = new TreeSet<>();
        sourceMentions.values().forEach(allMentions::addAll);

        Map<String, EntityDraft> drafts = new LinkedHashMap<>();
        for (String mention : allMentions) {
            Map<String, List<MatchCandidate>> matches = matcher.findMatches(mention, sourceMentions, matchThreshold);
            Resolution resolution = conflictResolver.resolve(matches);
            if (!resolution.isResolved() || resolution.confidence() < correlationThreshold) {
                log.debug("Discarded mention '{}' with confidence {}", mention, resolution.confidence());
                continue;
            }
            String canonical = resolution.canonicalName().isEmpty() ? mention : resolution.canonicalName();
            drafts.computeIfAbsent(canonical, name -> new EntityDraft(name, mention)).absorb(matches);
        }

        List<CanonicalEntity> entities = new ArrayList<>();
        for (EntityDraft draft : drafts.values()) {
            entities.add(draft.toEntity(
                    failureAssociations(draft, sources.logAnalysis().topIssues()),
                    relatedProcedures(draft, sources.documentAnalysis().procedures())));
        }

        List<RelationshipEdge> edges = new ArrayList<>();
        List<DanglingReference> dangling = new ArrayList<>();
        ComponentInventory inventory = sources.componentInventory();
        Map<String, String> entityByName = indexEntityNames(entities, inventory);

        inventory.relationships().forEach((name, targets) -> {
            String sourceEntity = entityByName.get(name.toLowerCase(Locale.ROOT));
            for (String target : targets) {
                String targetEntity = entityByName.get(target.toLowerCase(Locale.ROOT));
                if (sourceEntity == null || targetEntity == null) {
                    dangling.add(new DanglingReference(name, sourceEntity == null ? name : target,
                            RelationshipType.EXPLICITLY_RELATED));
                } else if (!sourceEntity.equals(targetEntity)) {
                    edges.add(relationshipInferrer.explicitEdge(sourceEntity, targetEntity));
                }
            }
        });

        if (includeInferred) {
            edges.addAll(relationshipInferrer.inferFromFunctions(functionsByEntity(entities, inventory)));
        }

        log.info("graph.built mentions={} entities={} edges={} dangling={}",
                allMentions.size(), entities.size(), edges.size(), dangling.size());
        return new CorrelationGraph(entities, edges, dangling, sourceMentions, allMentions.size());
    }

    private List<String> failureAssociations(EntityDraft draft, List<LogIssue> issues) {
        List<String> aliases = lowerCase(draft.references.getOrDefault(SourceTypes.LOG_ANALYSIS, List.of()));
        Set<String> failures = new LinkedHashSet<>();
        if (aliases.isEmpty()) {
            return List.of();
        }
        for (LogIssue issue : issues) {
            String description = issue.description().toLowerCase(Locale.ROOT);
            if (aliases.stream().anyMatch(description::contains)) {
                failures.add(issue.description());
            }
        }
        return new ArrayList<>(failures);
    }

    private List<String> relatedProcedures(EntityDraft draft, List<Procedure> procedures) {
        List<String> aliases = lowerCase(draft.references.getOrDefault(SourceTypes.DOCUMENT_ANALYSIS, List.of()));
        Set<String> titles = new LinkedHashSet<>();
        if (aliases.isEmpty()) {
            return List.of();
        }
        for (Procedure procedure : procedures) {
            String text = procedure.searchableText();
            if (aliases.stream().anyMatch(text::contains)) {
                titles.add(procedure.title());
            }
        }
        return new ArrayList<>(titles);
    }

    /**
     * Maps lower-cased names to the canonical name of the entity that carries them.
     * Inventory names and their alias targets are indexed first, then every entity's
     * canonical name, original name and aliases from all sources. The first entity to
     * claim a name keeps it.
     */
    private Map<String, String> indexEntityNames(List<CanonicalEntity> entities, ComponentInventory inventory) {
        Map<String, String> index = new LinkedHashMap<>();
        for (CanonicalEntity entity : entities) {
            for (String reference : entity.referencesFrom(SourceTypes.COMPONENT_INVENTORY)) {
                index.putIfAbsent(reference.toLowerCase(Locale.ROOT), entity.canonicalName());
                String aliasTarget = inventory.aliases().get(reference);
                if (aliasTarget != null) {
                    index.putIfAbsent(aliasTarget.toLowerCase(Locale.ROOT), entity.canonicalName());
                }
            }
        }
        for (CanonicalEntity entity : entities) {
            index.putIfAbsent(entity.canonicalName().toLowerCase(Locale.ROOT), entity.canonicalName());
            index.putIfAbsent(entity.originalName().toLowerCase(Locale.ROOT), entity.canonicalName());
            for (String alias : entity.aliases()) {
                index.putIfAbsent(alias.toLowerCase(Locale.ROOT), entity.canonicalName());
            }
        }
        return index;
    }

    private Map<String, String> functionsByEntity(List<CanonicalEntity> entities, ComponentInventory inventory) {
        Map<String, String> functions = new LinkedHashMap<>();
        for (CanonicalEntity entity : entities) {
            Set<String> parts = new LinkedHashSet<>();
            for (String reference : entity.referencesFrom(SourceTypes.COMPONENT_INVENTORY)) {
                String componentName = inventory.aliases().getOrDefault(reference, reference);
                ComponentRecord record = inventory.components().get(componentName);
                if (record != null && !record.function().isBlank()) {
                    parts.add(record.function());
                }
            }
            functions.put(entity.canonicalName(), String.join(" ", parts));
        }
        return functions;
    }

    private static List<String> lowerCase(List<String> values) {
        return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).toList();
    }

    /**
     * Mutable accumulator for one canonical entity while mentions are being resolved.
     */
    private static final class EntityDraft {
        private final String canonicalName;
        private final String originalName;
        private final Map<String, List<String>> references = new LinkedHashMap<>();
        private final Map<String, Double> confidences = new LinkedHashMap<>();

        EntityDraft(String canonicalName, String originalName) {
            this.canonicalName = canonicalName;
            this.originalName = originalName;
        }

        void absorb(Map<String, List<MatchCandidate>> matches) {
            matches.forEach((source, candidates) -> {
                if (candidates.isEmpty()) {
                    return;
                }
                List<String> aliases = references.computeIfAbsent(source, s -> new ArrayList<>());
                for (MatchCandidate candidate : candidates) {
                    if (!aliases.contains(candidate.candidate())) {
                        aliases.add(candidate.candidate());
                    }
                }
                double best = candidates.get(0).score();
                confidences.merge(source, best, Math::max);
            });
        }

        CanonicalEntity toEntity(List<String> failures, List<String> procedures) {
            double consistency = confidences.values().stream()
                    .mapToDouble(Double::doubleValue)
                    .average()
                    .orElse(0.0);
            return new CanonicalEntity(canonicalName, originalName, references, confidences,
                    failures, procedures, Math.min(1.0, consistency));
        }
    }
}
