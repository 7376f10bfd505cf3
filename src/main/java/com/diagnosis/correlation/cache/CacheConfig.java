package com.diagnosis.correlation.cache;

/**
 * Configuration for the normalization cache.
 *
 * @param maxSize    maximum number of cached names
 * @param ttlSeconds time-to-live in seconds after an entry is last read
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 5,000 names, 10 minutes after last access, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(5_000, 600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }

    /**
     * Creates the cache described by this configuration.
     */
    public NormalizationCache createCache() {
        return enabled ? new CaffeineNormalizationCache(this) : new NoOpNormalizationCache();
    }
}
