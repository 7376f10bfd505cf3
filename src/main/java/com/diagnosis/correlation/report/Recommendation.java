package com.diagnosis.correlation.report;

import java.util.Objects;

/**
 * A single recommended action in a diagnostic report.
 *
 * @param priority    urgency
 * @param category    SAFETY, COMPONENT, TROUBLESHOOTING or CONSISTENCY
 * @param action      the action; recommendations are unique by action
 * @param description why the action is recommended
 * @param source      the analysis the recommendation came from
 * @param subject     component name or procedure title the action refers to, may be null
 */
public record Recommendation(
        RecommendationPriority priority,
        String category,
        String action,
        String description,
        String source,
        String subject
) {
    public static final String CATEGORY_SAFETY = "SAFETY";
    public static final String CATEGORY_COMPONENT = "COMPONENT";
    public static final String CATEGORY_TROUBLESHOOTING = "TROUBLESHOOTING";
    public static final String CATEGORY_CONSISTENCY = "CONSISTENCY";

    public Recommendation {
        Objects.requireNonNull(priority, "priority is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(action, "action is required");
        description = description != null ? description : "";
        source = source != null ? source : "";
    }
}
