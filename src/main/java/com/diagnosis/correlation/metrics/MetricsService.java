package com.diagnosis.correlation.metrics;

import com.diagnosis.correlation.core.model.Severity;

import java.time.Duration;

/**
 * Interface for recording correlation engine metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works without a
 * meter registry.
 */
public interface MetricsService {

    /**
     * Records how long one pipeline stage took.
     *
     * @param stage stage name, e.g. {@code correlation} or {@code validation}
     */
    void recordStageDuration(String stage, Duration duration);

    void incrementEntitiesResolved(int count);

    void incrementViolation(String violationType, Severity severity);

    void recordSimilarityScore(double score);

    void recordResolutionsPlanned(int count);

    void recordCacheHit();

    void recordCacheMiss();
}
