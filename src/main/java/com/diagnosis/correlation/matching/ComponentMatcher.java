package com.diagnosis.correlation.matching;

import com.diagnosis.correlation.rules.NormalizationEngine;
import com.diagnosis.correlation.similarity.ComponentNameSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds, per source, the candidate mentions most similar to a target mention.
 * Candidates scoring below the threshold are dropped; the rest are ranked by
 * descending score and truncated to the per-source limit.
 */
public class ComponentMatcher {
    private static final Logger log = LoggerFactory.getLogger(ComponentMatcher.class);

    public static final double DEFAULT_THRESHOLD = 0.6;
    public static final int DEFAULT_MAX_MATCHES_PER_SOURCE = 5;

    private final ComponentNameSimilarity similarity;
    private final int maxMatchesPerSource;

    public ComponentMatcher(ComponentNameSimilarity similarity) {
        this(similarity, DEFAULT_MAX_MATCHES_PER_SOURCE);
    }

    public ComponentMatcher(ComponentNameSimilarity similarity, int maxMatchesPerSource) {
        if (maxMatchesPerSource <= 0) {
            throw new IllegalArgumentException("maxMatchesPerSource must be > 0");
        }
        this.similarity = similarity;
        this.maxMatchesPerSource = maxMatchesPerSource;
    }

    public Map<String, List<MatchCandidate>> findMatches(String target, Map<String, List<String>> candidatesBySource) {
        return findMatches(target, candidatesBySource, DEFAULT_THRESHOLD);
    }

    /**
     * Scores every candidate of every source against the target.
     *
     * @param target             the mention to match
     * @param candidatesBySource candidate mentions keyed by source type
     * @param threshold          minimum score for a candidate to be kept
     * @return ranked matches keyed by source type, in the iteration order of the input;
     *         a source with no surviving candidate maps to an empty list
     */
    public Map<String, List<MatchCandidate>> findMatches(String target, Map<String, List<String>> candidatesBySource,
                                                         double threshold) {
        NormalizationEngine normalizer = similarity.getNormalizationEngine();
        String normalizedTarget = normalizer.normalize(target);
        Map<String, List<MatchCandidate>> matches = new LinkedHashMap<>();

        for (Map.Entry<String, List<String>> entry : candidatesBySource.entrySet()) {
            String sourceType = entry.getKey();
            List<MatchCandidate> sourceMatches = new ArrayList<>();
            for (String candidate : entry.getValue()) {
                double score = similarity.computeNormalized(normalizedTarget, normalizer.normalize(candidate));
                if (score >= threshold) {
                    sourceMatches.add(new MatchCandidate(candidate, sourceType, score));
                }
            }
            sourceMatches.sort(MatchCandidate.BY_SCORE_DESC);
            if (sourceMatches.size() > maxMatchesPerSource) {
                sourceMatches = new ArrayList<>(sourceMatches.subList(0, maxMatchesPerSource));
            }
            matches.put(sourceType, Collections.unmodifiableList(sourceMatches));
        }

        log.debug("Matched '{}' against {} sources", target, matches.size());
        return Collections.unmodifiableMap(matches);
    }

    public int getMaxMatchesPerSource() {
        return maxMatchesPerSource;
    }
}
