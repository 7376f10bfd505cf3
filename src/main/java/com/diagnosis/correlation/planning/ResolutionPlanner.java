package com.diagnosis.correlation.planning;

import com.diagnosis.correlation.core.model.ConsistencyViolation;
import com.diagnosis.correlation.core.model.ResolutionItem;
import com.diagnosis.correlation.core.model.ResolutionType;
import com.diagnosis.correlation.core.model.Severity;
import com.diagnosis.correlation.core.model.ViolationTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns consistency violations into an ordered remediation plan.
 *
 * <p>Violations are grouped by type, in first-seen order. Name conflicts resolve to the
 * shortest name variant, severity mismatches to the most severe reported severity,
 * broken references to a reference repair with three alternative actions. Every other
 * type becomes a manual review carrying the violation's own suggestion.</p>
 */
public class ResolutionPlanner {
    private static final Logger log = LoggerFactory.getLogger(ResolutionPlanner.class);

    static final double DEFAULT_SUCCESS_RATE = 0.7;

    static final Map<String, Double> SUCCESS_RATES = Map.of(
            ViolationTypes.COMPONENT_NAME_CONFLICT, 0.9,
            ViolationTypes.FAILURE_SEVERITY_MISMATCH, 0.7,
            ViolationTypes.BROKEN_CROSS_REFERENCE, 0.8,
            ViolationTypes.MISSING_CANONICAL_NAME, 0.95,
            ViolationTypes.INCONSISTENT_FAILURE_ASSOCIATION, 0.6,
            ViolationTypes.DATA_SOURCE_MISMATCH, 0.5
    );

    static final List<String> REPAIR_ACTIONS = List.of(
            "Add missing component to component inventory",
            "Update failure pattern to reference existing component",
            "Remove invalid component reference"
    );

    public ResolutionPlan plan(List<ConsistencyViolation> violations, PrioritizationStrategy strategy) {
        if (violations.isEmpty()) {
            log.info("planning.completed resolutions=0 status={}", ResolutionPlan.NO_ACTION_REQUIRED);
            return ResolutionPlan.noActionRequired(strategy);
        }

        List<ResolutionItem> resolutions = generateResolutions(violations);
        resolutions.sort(strategy.comparator());

        ResolutionSummary summary = summarize(resolutions, violations);
        log.info("planning.completed violations={} resolutions={} strategy={} hours={}",
                violations.size(), resolutions.size(), strategy.getWireName(),
                summary.estimatedEffort().estimatedHours());

        return new ResolutionPlan(resolutions, strategy, ImplementationTimeline.of(resolutions), summary,
                ImplementationGuidance.of(resolutions), violations.size(), ResolutionPlan.ACTION_REQUIRED,
                resolutions.size() + " resolutions planned for " + violations.size() + " violations");
    }

    /**
     * Generates one resolution per violation, grouped by violation type.
     */
    List<ResolutionItem> generateResolutions(List<ConsistencyViolation> violations) {
        Map<String, List<ConsistencyViolation>> byType = new LinkedHashMap<>();
        violations.forEach(v -> byType.computeIfAbsent(v.violationType(), t -> new ArrayList<>()).add(v));

        List<ResolutionItem> resolutions = new ArrayList<>();
        byType.forEach((type, group) -> {
            for (ConsistencyViolation violation : group) {
                resolutions.add(resolve(violation));
            }
        });
        return resolutions;
    }

    ResolutionItem resolve(ConsistencyViolation violation) {
        return switch (violation.violationType()) {
            case ViolationTypes.COMPONENT_NAME_CONFLICT -> resolveNameConflict(violation)
                    .orElseGet(() -> manualReview(violation));
            case ViolationTypes.FAILURE_SEVERITY_MISMATCH -> resolveSeverityMismatch(violation)
                    .orElseGet(() -> manualReview(violation));
            case ViolationTypes.BROKEN_CROSS_REFERENCE -> resolveBrokenReference(violation);
            default -> manualReview(violation);
        };
    }

    private Optional<ResolutionItem> resolveNameConflict(ConsistencyViolation violation) {
        List<String> variations = stringList(violation.conflictingValues().get("name_variations"));
        // min keeps the first of equally short names
        Optional<String> shortest = variations.stream().min(Comparator.comparingInt(String::length));
        return shortest.map(canonical -> {
            Map<String, Object> items = new LinkedHashMap<>();
            items.put("name_variations", variations);
            items.put("suggested_canonical", canonical);
            items.put("affected_sources", violation.affectedSources());
            return item(violation, ResolutionType.CANONICAL_NAME_ASSIGNMENT,
                    "Set canonical name to \"" + canonical + "\"",
                    "Resolve naming conflict by standardizing on \"" + canonical + "\"", items);
        });
    }

    private Optional<ResolutionItem> resolveSeverityMismatch(ConsistencyViolation violation) {
        List<String> labels = stringList(violation.conflictingValues().get("severities"));
        List<Severity> known = new ArrayList<>();
        for (String label : labels) {
            Severity severity = Severity.parseOrDefault(label, null);
            if (severity != null) {
                known.add(severity);
            }
        }
        Object patternType = violation.conflictingValues().getOrDefault("pattern_type", "");
        return Severity.mostSevere(known).map(suggested -> {
            Map<String, Object> items = new LinkedHashMap<>();
            items.put("pattern_type", patternType);
            items.put("conflicting_severities", labels);
            items.put("suggested_severity", suggested.name());
            return item(violation, ResolutionType.SEVERITY_STANDARDIZATION,
                    "Standardize severity for pattern \"" + patternType + "\" to \"" + suggested.name() + "\"",
                    "Use conservative approach and set severity to highest level: " + suggested.name(), items);
        });
    }

    private ResolutionItem resolveBrokenReference(ConsistencyViolation violation) {
        Object missing = violation.conflictingValues().getOrDefault("missing_component", "");
        Map<String, Object> items = new LinkedHashMap<>();
        items.put("missing_component", missing);
        items.put("failure_pattern", violation.conflictingValues().getOrDefault("failure_pattern", ""));
        items.put("suggested_actions", REPAIR_ACTIONS);
        return item(violation, ResolutionType.REFERENCE_REPAIR,
                "Add component \"" + missing + "\" to component inventory or update reference",
                "Repair broken reference from failure pattern to component", items);
    }

    private ResolutionItem manualReview(ConsistencyViolation violation) {
        return item(violation, ResolutionType.MANUAL_REVIEW, violation.resolutionSuggestion(),
                violation.description(), violation.conflictingValues());
    }

    private ResolutionItem item(ConsistencyViolation violation, ResolutionType type, String action,
                                String description, Map<String, Object> affectedItems) {
        return new ResolutionItem(ViolationIdGenerator.idFor(violation), violation.violationType(), type,
                violation.severity(), action, description, affectedItems, violation.affectedSources(),
                violation.confidence());
    }

    ResolutionSummary summarize(List<ResolutionItem> resolutions, List<ConsistencyViolation> violations) {
        int critical = (int) resolutions.stream().filter(r -> r.priority() == Severity.CRITICAL).count();
        int high = (int) resolutions.stream().filter(r -> r.priority() == Severity.HIGH).count();
        LinkedHashSet<String> types = new LinkedHashSet<>();
        resolutions.forEach(r -> types.add(r.resolutionType().getWireName()));
        return new ResolutionSummary(resolutions.size(), critical, high, new ArrayList<>(types),
                EffortEstimate.of(resolutions), successProbability(violations));
    }

    /**
     * Confidence-weighted mean of the base success rate of each violation type.
     * 1.0 when there is nothing to resolve.
     */
    public static double successProbability(List<ConsistencyViolation> violations) {
        if (violations.isEmpty()) {
            return 1.0;
        }
        double totalWeight = 0.0;
        double weightedSuccess = 0.0;
        for (ConsistencyViolation violation : violations) {
            double rate = SUCCESS_RATES.getOrDefault(violation.violationType(), DEFAULT_SUCCESS_RATE);
            weightedSuccess += rate * violation.confidence();
            totalWeight += violation.confidence();
        }
        return totalWeight > 0 ? weightedSuccess / totalWeight : DEFAULT_SUCCESS_RATE;
    }

    private static List<String> stringList(Object value) {
        List<String> strings = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            collection.forEach(item -> {
                if (item != null) {
                    strings.add(item.toString());
                }
            });
        }
        return strings;
    }
}
