package com.diagnosis.correlation.api;

import com.diagnosis.correlation.planning.PrioritizationStrategy;
import com.diagnosis.correlation.report.ReportFormat;

import java.util.Objects;

/**
 * Options for a correlation engine.
 * Configures matching and correlation thresholds, relationship inference and planning.
 */
public class EngineOptions {

    private static final double DEFAULT_MATCH_THRESHOLD = 0.6;
    private static final double DEFAULT_CORRELATION_THRESHOLD = 0.6;
    private static final double DEFAULT_CONSISTENCY_THRESHOLD = 0.7;
    private static final double DEFAULT_FAILURE_PROCEDURE_THRESHOLD = 0.5;
    private static final int DEFAULT_MAX_MATCHES_PER_SOURCE = 5;

    private final double matchThreshold;
    private final double correlationThreshold;
    private final double consistencyThreshold;
    private final double failureProcedureThreshold;
    private final int maxMatchesPerSource;
    private final boolean includeInferredRelationships;
    private final PrioritizationStrategy prioritizationStrategy;
    private final ReportFormat reportFormat;

    private EngineOptions(Builder builder) {
        this.matchThreshold = builder.matchThreshold;
        this.correlationThreshold = builder.correlationThreshold;
        this.consistencyThreshold = builder.consistencyThreshold;
        this.failureProcedureThreshold = builder.failureProcedureThreshold;
        this.maxMatchesPerSource = builder.maxMatchesPerSource;
        this.includeInferredRelationships = builder.includeInferredRelationships;
        this.prioritizationStrategy = builder.prioritizationStrategy;
        this.reportFormat = builder.reportFormat;
    }

    public double getMatchThreshold() {
        return matchThreshold;
    }

    public double getCorrelationThreshold() {
        return correlationThreshold;
    }

    public double getConsistencyThreshold() {
        return consistencyThreshold;
    }

    /**
     * Minimum strength for a failure correlation to be reported as a correlation.
     */
    public double getFailureProcedureThreshold() {
        return failureProcedureThreshold;
    }

    public int getMaxMatchesPerSource() {
        return maxMatchesPerSource;
    }

    public boolean isIncludeInferredRelationships() {
        return includeInferredRelationships;
    }

    public PrioritizationStrategy getPrioritizationStrategy() {
        return prioritizationStrategy;
    }

    public ReportFormat getReportFormat() {
        return reportFormat;
    }

    /**
     * Creates default options.
     */
    public static EngineOptions defaults() {
        return builder().build();
    }

    /**
     * Creates strict options (higher thresholds, documented relationships only).
     */
    public static EngineOptions strict() {
        return builder()
                .matchThreshold(0.8)
                .correlationThreshold(0.8)
                .consistencyThreshold(0.85)
                .includeInferredRelationships(false)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double matchThreshold = DEFAULT_MATCH_THRESHOLD;
        private double correlationThreshold = DEFAULT_CORRELATION_THRESHOLD;
        private double consistencyThreshold = DEFAULT_CONSISTENCY_THRESHOLD;
        private double failureProcedureThreshold = DEFAULT_FAILURE_PROCEDURE_THRESHOLD;
        private int maxMatchesPerSource = DEFAULT_MAX_MATCHES_PER_SOURCE;
        private boolean includeInferredRelationships = true;
        private PrioritizationStrategy prioritizationStrategy = PrioritizationStrategy.CRITICAL_FIRST;
        private ReportFormat reportFormat = ReportFormat.COMPREHENSIVE;

        public Builder matchThreshold(double matchThreshold) {
            validateThreshold(matchThreshold, "matchThreshold");
            this.matchThreshold = matchThreshold;
            return this;
        }

        public Builder correlationThreshold(double correlationThreshold) {
            validateThreshold(correlationThreshold, "correlationThreshold");
            this.correlationThreshold = correlationThreshold;
            return this;
        }

        public Builder consistencyThreshold(double consistencyThreshold) {
            validateThreshold(consistencyThreshold, "consistencyThreshold");
            this.consistencyThreshold = consistencyThreshold;
            return this;
        }

        public Builder failureProcedureThreshold(double failureProcedureThreshold) {
            validateThreshold(failureProcedureThreshold, "failureProcedureThreshold");
            this.failureProcedureThreshold = failureProcedureThreshold;
            return this;
        }

        public Builder maxMatchesPerSource(int maxMatchesPerSource) {
            if (maxMatchesPerSource <= 0) {
                throw new IllegalArgumentException("maxMatchesPerSource must be positive");
            }
            this.maxMatchesPerSource = maxMatchesPerSource;
            return this;
        }

        public Builder includeInferredRelationships(boolean includeInferredRelationships) {
            this.includeInferredRelationships = includeInferredRelationships;
            return this;
        }

        public Builder prioritizationStrategy(PrioritizationStrategy prioritizationStrategy) {
            this.prioritizationStrategy = Objects.requireNonNull(prioritizationStrategy,
                    "prioritizationStrategy is required");
            return this;
        }

        public Builder reportFormat(ReportFormat reportFormat) {
            this.reportFormat = Objects.requireNonNull(reportFormat, "reportFormat is required");
            return this;
        }

        public EngineOptions build() {
            return new EngineOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "EngineOptions{" +
                "matchThreshold=" + matchThreshold +
                ", correlationThreshold=" + correlationThreshold +
                ", consistencyThreshold=" + consistencyThreshold +
                ", failureProcedureThreshold=" + failureProcedureThreshold +
                ", maxMatchesPerSource=" + maxMatchesPerSource +
                ", includeInferredRelationships=" + includeInferredRelationships +
                ", prioritizationStrategy=" + prioritizationStrategy.getWireName() +
                ", reportFormat=" + reportFormat.getWireName() +
                '}';
    }
}
