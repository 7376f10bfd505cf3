package com.diagnosis.correlation.planning;

import com.diagnosis.correlation.core.model.ResolutionItem;
import com.diagnosis.correlation.core.model.ResolutionType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One implementation step covering every resolution of a type.
 *
 * @param step             short step title with item count
 * @param description      what the step does
 * @param prerequisites    what is needed before starting
 * @param estimatedMinutes estimated time for all items
 * @param riskLevel        LOW, MEDIUM or HIGH
 */
public record ImplementationGuidance(
        String step,
        String description,
        List<String> prerequisites,
        int estimatedMinutes,
        String riskLevel
) {
    public ImplementationGuidance {
        prerequisites = List.copyOf(prerequisites);
    }

    /**
     * Guidance for the canonical name, severity and reference repair groups.
     * Manual reviews get no step.
     */
    public static List<ImplementationGuidance> of(List<ResolutionItem> resolutions) {
        Map<ResolutionType, Integer> counts = new LinkedHashMap<>();
        resolutions.forEach(r -> counts.merge(r.resolutionType(), 1, Integer::sum));

        List<ImplementationGuidance> guidance = new ArrayList<>();
        counts.forEach((type, count) -> {
            switch (type) {
                case CANONICAL_NAME_ASSIGNMENT -> guidance.add(new ImplementationGuidance(
                        "Standardize component names (" + count + " items)",
                        "Update component inventory with canonical names",
                        List.of("Access to component inventory system"), count * 5, "LOW"));
                case SEVERITY_STANDARDIZATION -> guidance.add(new ImplementationGuidance(
                        "Standardize failure severities (" + count + " items)",
                        "Review and update failure pattern severity levels",
                        List.of("Domain expertise in failure analysis"), count * 15, "MEDIUM"));
                case REFERENCE_REPAIR -> guidance.add(new ImplementationGuidance(
                        "Repair broken references (" + count + " items)",
                        "Update or remove invalid cross-references",
                        List.of("Access to all data sources"), count * 10, "MEDIUM"));
                default -> {
                    // manual review has no generic guidance
                }
            }
        });
        return guidance;
    }
}
