package com.diagnosis.correlation.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed normalization cache. Thread-safe; owned by one engine instance.
 */
public class CaffeineNormalizationCache implements NormalizationCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineNormalizationCache.class);

    private final Cache<String, String> cache;

    public CaffeineNormalizationCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterAccess(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("cache.init maxSize={} ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<String> get(String rawName) {
        if (rawName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(rawName));
    }

    @Override
    public void put(String rawName, String normalizedName) {
        if (rawName != null && normalizedName != null) {
            cache.put(rawName, normalizedName);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("cache.invalidated all");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
