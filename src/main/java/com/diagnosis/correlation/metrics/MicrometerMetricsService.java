package com.diagnosis.correlation.metrics;

import com.diagnosis.correlation.core.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code correlation.stage.duration}: Timer (tag: stage)</li>
 *   <li>{@code correlation.entities.resolved}: Counter</li>
 *   <li>{@code correlation.violations}: Counter (tags: type, severity)</li>
 *   <li>{@code correlation.similarity.score}: DistributionSummary</li>
 *   <li>{@code correlation.resolutions.planned}: DistributionSummary</li>
 *   <li>{@code correlation.cache.hit}: Counter</li>
 *   <li>{@code correlation.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> violationCounters = new ConcurrentHashMap<>();
    private final Counter entitiesResolvedCounter;
    private final DistributionSummary similarityScoreSummary;
    private final DistributionSummary resolutionsPlannedSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.entitiesResolvedCounter = Counter.builder("correlation.entities.resolved")
                .description("Number of canonical entities resolved")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("correlation.similarity.score")
                .description("Distribution of accepted match scores")
                .register(registry);
        this.resolutionsPlannedSummary = DistributionSummary.builder("correlation.resolutions.planned")
                .description("Number of resolutions per plan")
                .register(registry);
        this.cacheHitCounter = Counter.builder("correlation.cache.hit")
                .description("Number of normalization cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("correlation.cache.miss")
                .description("Number of normalization cache misses")
                .register(registry);
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(stage, k ->
                Timer.builder("correlation.stage.duration")
                        .description("Duration of correlation pipeline stages")
                        .tag("stage", stage)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementEntitiesResolved(int count) {
        entitiesResolvedCounter.increment(count);
    }

    @Override
    public void incrementViolation(String violationType, Severity severity) {
        String key = violationType + ":" + severity.name();
        Counter counter = violationCounters.computeIfAbsent(key, k ->
                Counter.builder("correlation.violations")
                        .description("Number of consistency violations found")
                        .tag("type", violationType)
                        .tag("severity", severity.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordResolutionsPlanned(int count) {
        resolutionsPlannedSummary.record(count);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
