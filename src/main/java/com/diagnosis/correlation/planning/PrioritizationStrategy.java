package com.diagnosis.correlation.planning;

import com.diagnosis.correlation.core.model.ResolutionItem;
import com.diagnosis.correlation.core.model.Severity;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;
import java.util.Locale;

/**
 * Ordering applied to the generated resolutions. Sorting is stable, so resolutions that
 * compare equal keep their generation order.
 */
public enum PrioritizationStrategy {
    /**
     * Most severe first, then the most confident violation first.
     */
    CRITICAL_FIRST("critical_first",
            Comparator.comparing(ResolutionItem::priority, Severity.MOST_SEVERE_FIRST)
                    .thenComparing(Comparator.comparingDouble(ResolutionItem::confidence).reversed())),

    /**
     * Resolutions touching the most sources first, then most severe.
     */
    HIGH_IMPACT("high_impact",
            Comparator.comparingInt((ResolutionItem r) -> r.affectedSources().size()).reversed()
                    .thenComparing(ResolutionItem::priority, Severity.MOST_SEVERE_FIRST)),

    /**
     * Quick-win resolution types first, then most severe.
     */
    QUICK_WINS("quick_wins",
            Comparator.comparing((ResolutionItem r) -> r.resolutionType().isQuickWin() ? 0 : 1)
                    .thenComparing(ResolutionItem::priority, Severity.MOST_SEVERE_FIRST));

    private final String wireName;
    private final Comparator<ResolutionItem> comparator;

    PrioritizationStrategy(String wireName, Comparator<ResolutionItem> comparator) {
        this.wireName = wireName;
        this.comparator = comparator;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public Comparator<ResolutionItem> comparator() {
        return comparator;
    }

    /**
     * Parses a strategy name such as {@code quick_wins}, ignoring case.
     *
     * @throws IllegalArgumentException for unknown names
     */
    @JsonCreator
    public static PrioritizationStrategy fromWireName(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (PrioritizationStrategy strategy : values()) {
                if (strategy.wireName.equals(normalized)) {
                    return strategy;
                }
            }
        }
        throw new IllegalArgumentException("Unknown prioritization strategy: " + value);
    }
}
