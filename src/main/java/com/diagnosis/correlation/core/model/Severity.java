package com.diagnosis.correlation.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Collection;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * Severity of a failure pattern or consistency violation.
 * Totally ordered: CRITICAL > HIGH > MEDIUM > LOW.
 */
public enum Severity {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    /**
     * Orders the most severe value first.
     */
    public static final Comparator<Severity> MOST_SEVERE_FIRST =
            Comparator.comparingInt(Severity::getWeight).reversed();

    private final int weight;

    Severity(int weight) {
        this.weight = weight;
    }

    /**
     * Weight used by severity-weighted scoring (CRITICAL=4 ... LOW=1).
     */
    public int getWeight() {
        return weight;
    }

    public boolean isMoreSevereThan(Severity other) {
        return other == null || weight > other.weight;
    }

    /**
     * Returns the most severe value of the collection, if any.
     */
    public static Optional<Severity> mostSevere(Collection<Severity> severities) {
        return severities.stream()
                .filter(s -> s != null)
                .max(Comparator.comparingInt(Severity::getWeight));
    }

    /**
     * Parses a severity label case-insensitively.
     *
     * @throws IllegalArgumentException if the label is not a known severity
     */
    @JsonCreator
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Parses a severity label, falling back to the given default for blank or unknown labels.
     */
    public static Severity parseOrDefault(String value, Severity defaultSeverity) {
        if (value == null || value.isBlank()) {
            return defaultSeverity;
        }
        try {
            return parse(value);
        } catch (IllegalArgumentException e) {
            return defaultSeverity;
        }
    }
}
