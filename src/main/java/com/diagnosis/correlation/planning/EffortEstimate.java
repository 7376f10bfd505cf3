package com.diagnosis.correlation.planning;

import com.diagnosis.correlation.core.model.ResolutionItem;

import java.util.List;

/**
 * Effort of a plan from fixed per-type costs: canonical name assignment 0.5h,
 * severity standardization and reference repair 2h, manual review 8h.
 *
 * @param totalResolutions number of resolutions
 * @param lowEffort        resolutions with LOW effort
 * @param mediumEffort     resolutions with MEDIUM effort
 * @param highEffort       resolutions with HIGH effort
 * @param estimatedHours   summed hour cost
 */
public record EffortEstimate(int totalResolutions, int lowEffort, int mediumEffort, int highEffort,
                             double estimatedHours) {

    public static EffortEstimate of(List<ResolutionItem> resolutions) {
        int low = 0;
        int medium = 0;
        int high = 0;
        double hours = 0.0;
        for (ResolutionItem resolution : resolutions) {
            switch (resolution.resolutionType().getEffortLevel()) {
                case "LOW" -> low++;
                case "MEDIUM" -> medium++;
                default -> high++;
            }
            hours += resolution.resolutionType().getEffortHours();
        }
        return new EffortEstimate(resolutions.size(), low, medium, high, hours);
    }
}
