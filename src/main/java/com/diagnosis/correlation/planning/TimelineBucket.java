package com.diagnosis.correlation.planning;

import com.diagnosis.correlation.core.model.ResolutionItem;
import com.diagnosis.correlation.core.model.Severity;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Implementation time window of a resolution.
 */
public enum TimelineBucket {
    IMMEDIATE("immediate", "0-1 hours"),
    SHORT_TERM("short_term", "1-8 hours"),
    MEDIUM_TERM("medium_term", "1-3 days"),
    LONG_TERM("long_term", "1+ weeks");

    private final String wireName;
    private final String timeframe;

    TimelineBucket(String wireName, String timeframe) {
        this.wireName = wireName;
        this.timeframe = timeframe;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getTimeframe() {
        return timeframe;
    }

    /**
     * CRITICAL goes immediate; HIGH and quick-win types short term; MEDIUM medium term;
     * everything else long term.
     */
    public static TimelineBucket of(ResolutionItem resolution) {
        Severity priority = resolution.priority();
        if (priority == Severity.CRITICAL) {
            return IMMEDIATE;
        }
        if (priority == Severity.HIGH || resolution.resolutionType().isQuickWin()) {
            return SHORT_TERM;
        }
        if (priority == Severity.MEDIUM) {
            return MEDIUM_TERM;
        }
        return LONG_TERM;
    }
}
