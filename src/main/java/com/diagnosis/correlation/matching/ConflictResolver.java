package com.diagnosis.correlation.matching;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Picks one canonical name from per-source matches by weighting each candidate's
 * score with the priority of its source.
 *
 * <p>The highest {@code score x priority} wins. Ties go to the higher-priority source,
 * then to the lexicographically smaller name.</p>
 */
public class ConflictResolver {
    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    private static final Comparator<Resolution> WINNER_FIRST =
            Comparator.comparingDouble(Resolution::confidence).reversed()
                    .thenComparing(Comparator.comparingDouble(
                            (Resolution r) -> SourcePriorities.priorityOf(r.sourceType())).reversed())
                    .thenComparing(Resolution::canonicalName);

    public Resolution resolve(Map<String, List<MatchCandidate>> matchesBySource) {
        if (matchesBySource == null || matchesBySource.isEmpty()) {
            return Resolution.none();
        }

        Resolution best = null;
        for (Map.Entry<String, List<MatchCandidate>> entry : matchesBySource.entrySet()) {
            double priority = SourcePriorities.priorityOf(entry.getKey());
            for (MatchCandidate match : entry.getValue()) {
                Resolution weighted = new Resolution(match.candidate(), match.score() * priority, entry.getKey());
                if (best == null || WINNER_FIRST.compare(weighted, best) < 0) {
                    best = weighted;
                }
            }
        }

        if (best == null) {
            return Resolution.none();
        }
        log.debug("Resolved canonical '{}' from {} with confidence {}",
                best.canonicalName(), best.sourceType(), best.confidence());
        return best;
    }
}
