package com.diagnosis.correlation.planning;

import com.diagnosis.correlation.core.model.ModelCollections;
import com.diagnosis.correlation.core.model.ResolutionItem;

import java.util.List;
import java.util.Objects;

/**
 * Ordered remediation plan for the violations of one validation pass.
 *
 * @param resolutions          resolutions in strategy order
 * @param strategy             strategy used to order them
 * @param timeline             resolutions grouped by time window
 * @param summary              aggregate figures
 * @param guidance             implementation steps per resolution type
 * @param violationsProcessed  number of violations the plan was built from
 * @param status               {@code action_required} or {@code no_action_required}
 * @param message              human-readable status message
 */
public record ResolutionPlan(
        List<ResolutionItem> resolutions,
        PrioritizationStrategy strategy,
        ImplementationTimeline timeline,
        ResolutionSummary summary,
        List<ImplementationGuidance> guidance,
        int violationsProcessed,
        String status,
        String message
) {
    public static final String ACTION_REQUIRED = "action_required";
    public static final String NO_ACTION_REQUIRED = "no_action_required";
    public static final String CONSISTENT_MESSAGE = "No consistency violations found - system is consistent";

    public ResolutionPlan {
        resolutions = ModelCollections.listCopy(resolutions);
        Objects.requireNonNull(strategy, "strategy is required");
        Objects.requireNonNull(timeline, "timeline is required");
        Objects.requireNonNull(summary, "summary is required");
        guidance = ModelCollections.listCopy(guidance);
    }

    /**
     * The plan for a pass that found nothing to fix.
     */
    public static ResolutionPlan noActionRequired(PrioritizationStrategy strategy) {
        return new ResolutionPlan(List.of(), strategy, ImplementationTimeline.empty(),
                new ResolutionSummary(0, 0, 0, List.of(), EffortEstimate.of(List.of()), 1.0),
                List.of(), 0, NO_ACTION_REQUIRED, CONSISTENT_MESSAGE);
    }

    public boolean isActionRequired() {
        return !resolutions.isEmpty();
    }
}
