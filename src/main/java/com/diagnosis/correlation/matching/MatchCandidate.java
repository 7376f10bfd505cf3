package com.diagnosis.correlation.matching;

import java.util.Comparator;
import java.util.Objects;

/**
 * A candidate mention from one source with its similarity to the target mention.
 *
 * @param candidate  the candidate mention text, as reported by the source
 * @param sourceType the source the candidate came from
 * @param score      similarity to the target (0.0-1.0)
 */
public record MatchCandidate(String candidate, String sourceType, double score) {

    /**
     * Highest score first. {@link java.util.List#sort} is stable, so ties keep input order.
     */
    public static final Comparator<MatchCandidate> BY_SCORE_DESC =
            Comparator.comparingDouble(MatchCandidate::score).reversed();

    public MatchCandidate {
        Objects.requireNonNull(candidate, "candidate is required");
        Objects.requireNonNull(sourceType, "sourceType is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0");
        }
    }
}
