package com.diagnosis.correlation.rules;

import com.diagnosis.correlation.cache.NoOpNormalizationCache;
import com.diagnosis.correlation.cache.NormalizationCache;
import com.diagnosis.correlation.metrics.MetricsService;
import com.diagnosis.correlation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Engine for applying normalization rules to component names.
 * Rules are applied in priority order (lower priority number = higher precedence).
 *
 * <p>The input is lower-cased and trimmed before any rule runs, and whitespace is
 * collapsed after the last rule. The rule list is fixed at construction, so an
 * engine can be shared between threads.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;
    private final NormalizationCache cache;
    private final MetricsService metricsService;

    public NormalizationEngine(List<NormalizationRule> rules) {
        this(rules, new NoOpNormalizationCache(), new NoOpMetricsService());
    }

    public NormalizationEngine(List<NormalizationRule> rules, NormalizationCache cache,
                               MetricsService metricsService) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = List.copyOf(sorted);
        this.cache = cache != null ? cache : new NoOpNormalizationCache();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Gets all rules of this engine in application order.
     */
    public List<NormalizationRule> getRules() {
        return rules;
    }

    public NormalizationCache getCache() {
        return cache;
    }

    /**
     * Normalizes the given name. Never throws; blank input yields an empty string.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        Optional<String> cached = cache.get(name);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached.get();
        }
        metricsService.recordCacheMiss();

        String result = name.toLowerCase(Locale.ROOT).trim();

        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (!before.equals(result)) {
                log.debug("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        result = result.trim().replaceAll("\\s+", " ");
        cache.put(name, result);
        return result;
    }

    /**
     * Checks if two names are equivalent after normalization.
     */
    public boolean areEquivalent(String name1, String name2) {
        return normalize(name1).equals(normalize(name2));
    }
}
