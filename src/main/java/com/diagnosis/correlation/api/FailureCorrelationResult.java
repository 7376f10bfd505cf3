package com.diagnosis.correlation.api;

import com.diagnosis.correlation.core.model.FailurePatternCorrelation;
import com.diagnosis.correlation.core.model.ModelCollections;
import com.diagnosis.correlation.core.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of correlating failure patterns with troubleshooting procedures.
 *
 * <p>{@link #allCorrelations()} holds one entry per failure pattern and feeds validation;
 * {@link #correlations()} keeps only those whose strength reaches the threshold.</p>
 *
 * @param allCorrelations    one correlation per failure pattern, in collection order
 * @param threshold          minimum strength for a reported correlation
 * @param proceduresAnalyzed number of procedures the patterns were matched against
 */
public record FailureCorrelationResult(
        List<FailurePatternCorrelation> allCorrelations,
        double threshold,
        int proceduresAnalyzed
) {
    public FailureCorrelationResult {
        allCorrelations = ModelCollections.listCopy(allCorrelations);
    }

    public List<FailurePatternCorrelation> correlations() {
        return allCorrelations.stream()
                .filter(c -> c.correlationStrength() >= threshold)
                .toList();
    }

    /**
     * Reported correlations grouped by severity, most severe first.
     */
    public Map<Severity, List<FailurePatternCorrelation>> correlationsBySeverity() {
        Map<Severity, List<FailurePatternCorrelation>> bySeverity = new TreeMap<>(Severity.MOST_SEVERE_FIRST);
        for (FailurePatternCorrelation correlation : correlations()) {
            bySeverity.computeIfAbsent(correlation.severity(), s -> new ArrayList<>()).add(correlation);
        }
        return bySeverity;
    }

    public int patternsAnalyzed() {
        return allCorrelations.size();
    }

    public double correlationRate() {
        return allCorrelations.isEmpty() ? 0.0 : (double) correlations().size() / allCorrelations.size();
    }

    public double avgCorrelationStrength() {
        return correlations().stream()
                .mapToDouble(FailurePatternCorrelation::correlationStrength)
                .average()
                .orElse(0.0);
    }
}
