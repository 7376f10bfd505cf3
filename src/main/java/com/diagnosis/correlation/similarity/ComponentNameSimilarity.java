package com.diagnosis.correlation.similarity;

import com.diagnosis.correlation.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Similarity of two component names, computed on their normalized forms.
 *
 * <ol>
 *   <li>Exact match after normalization: 1.0</li>
 *   <li>One normalized name contains the other: 0.9</li>
 *   <li>Otherwise word Jaccard, plus 0.1 (capped at 1.0) if the shared words
 *       include a key technical term</li>
 * </ol>
 *
 * A blank name against a non-blank one scores 0.0; two blank names score 1.0.
 */
public class ComponentNameSimilarity implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(ComponentNameSimilarity.class);

    public static final Set<String> KEY_TECHNICAL_TERMS = Set.of(
            "laser", "detector", "sensor", "controller", "optical", "temperature", "pressure");

    static final double CONTAINMENT_SCORE = 0.9;
    static final double KEY_TERM_BOOST = 0.1;

    private final NormalizationEngine normalizationEngine;
    private final JaccardSimilarity jaccard = new JaccardSimilarity();

    public ComponentNameSimilarity(NormalizationEngine normalizationEngine) {
        this.normalizationEngine = normalizationEngine;
    }

    @Override
    public double compute(String s1, String s2) {
        return computeNormalized(normalizationEngine.normalize(s1), normalizationEngine.normalize(s2));
    }

    /**
     * Computes the score for names that are already normalized.
     */
    public double computeNormalized(String n1, String n2) {
        if (n1.equals(n2)) {
            return 1.0;
        }
        if (n1.isEmpty() || n2.isEmpty()) {
            return 0.0;
        }
        if (n1.contains(n2) || n2.contains(n1)) {
            return CONTAINMENT_SCORE;
        }

        Set<String> words1 = JaccardSimilarity.tokenize(n1);
        Set<String> words2 = JaccardSimilarity.tokenize(n2);
        double score = jaccard.compute(words1, words2);

        Set<String> shared = JaccardSimilarity.intersection(words1, words2);
        if (shared.stream().anyMatch(KEY_TECHNICAL_TERMS::contains)) {
            score += KEY_TERM_BOOST;
            log.debug("Key term boost for '{}' vs '{}'", n1, n2);
        }
        return Math.min(1.0, score);
    }

    public NormalizationEngine getNormalizationEngine() {
        return normalizationEngine;
    }

    @Override
    public String getName() {
        return "ComponentName";
    }
}
