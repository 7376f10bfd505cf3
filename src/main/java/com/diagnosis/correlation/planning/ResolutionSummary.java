package com.diagnosis.correlation.planning;

import java.util.List;

/**
 * Aggregate figures of a resolution plan.
 *
 * @param totalResolutions        number of resolutions
 * @param criticalResolutions     resolutions with CRITICAL priority
 * @param highPriorityResolutions resolutions with HIGH priority
 * @param resolutionTypes         distinct resolution types, in plan order
 * @param estimatedEffort         effort estimate
 * @param successProbability      estimated probability that the plan succeeds
 */
public record ResolutionSummary(
        int totalResolutions,
        int criticalResolutions,
        int highPriorityResolutions,
        List<String> resolutionTypes,
        EffortEstimate estimatedEffort,
        double successProbability
) {
    public ResolutionSummary {
        resolutionTypes = List.copyOf(resolutionTypes);
    }
}
