package com.diagnosis.correlation.similarity;

import java.util.Locale;

/**
 * Plain name similarity used when validating cross-references: lower-cased exact
 * match 1.0, substring match 0.9, otherwise word Jaccard. No normalization and no
 * technical-term boost. Empty names score 0.0.
 */
public class NameSimilarity implements SimilarityAlgorithm {

    static final double CONTAINMENT_SCORE = 0.9;

    private final JaccardSimilarity jaccard = new JaccardSimilarity();

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isBlank() || s2.isBlank()) {
            return 0.0;
        }
        String a = s1.toLowerCase(Locale.ROOT).trim();
        String b = s2.toLowerCase(Locale.ROOT).trim();
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.contains(b) || b.contains(a)) {
            return CONTAINMENT_SCORE;
        }
        return jaccard.compute(a, b);
    }

    @Override
    public String getName() {
        return "Name";
    }
}
