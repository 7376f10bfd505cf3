package com.diagnosis.correlation.metrics;

import com.diagnosis.correlation.core.model.Severity;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}. All methods are empty.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStageDuration(String stage, Duration duration) {
    }

    @Override
    public void incrementEntitiesResolved(int count) {
    }

    @Override
    public void incrementViolation(String violationType, Severity severity) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordResolutionsPlanned(int count) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
