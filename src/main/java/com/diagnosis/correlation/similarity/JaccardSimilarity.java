package com.diagnosis.correlation.similarity;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Jaccard similarity (token overlap).
 * Computes similarity as |intersection| / |union| of whitespace-separated tokens.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return compute(tokenize(s1), tokenize(s2));
    }

    /**
     * Computes the Jaccard index of two token sets; 0.0 if either is empty.
     */
    public double compute(Set<String> tokens1, Set<String> tokens2) {
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }
        int intersectionSize = intersection(tokens1, tokens2).size();
        // |union| = |A| + |B| - |intersection|
        int unionSize = tokens1.size() + tokens2.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    /**
     * Tokenizes a string into a lower-cased set of tokens, in first-seen order.
     */
    public static Set<String> tokenize(String s) {
        Set<String> tokenSet = new LinkedHashSet<>();
        if (s == null) {
            return tokenSet;
        }
        for (String token : WHITESPACE.split(s.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokenSet.add(token);
            }
        }
        return tokenSet;
    }

    /**
     * Returns the tokens present in both sets, in the order of the first set.
     */
    public static Set<String> intersection(Set<String> tokens1, Set<String> tokens2) {
        Set<String> common = new LinkedHashSet<>();
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                common.add(token);
            }
        }
        return common;
    }
}
