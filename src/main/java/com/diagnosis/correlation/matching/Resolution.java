package com.diagnosis.correlation.matching;

/**
 * Outcome of conflict resolution: the chosen canonical name and its weighted confidence.
 * Finding no match is a normal outcome, represented by {@link #none()}.
 *
 * @param canonicalName chosen canonical name, empty when nothing matched
 * @param confidence    winning {@code score x source priority}
 * @param sourceType    source of the winning candidate, empty when nothing matched
 */
public record Resolution(String canonicalName, double confidence, String sourceType) {

    private static final Resolution NONE = new Resolution("", 0.0, "");

    public static Resolution none() {
        return NONE;
    }

    public boolean isResolved() {
        return !canonicalName.isEmpty();
    }
}
