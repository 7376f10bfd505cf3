package com.diagnosis.correlation.cache;

import java.util.Optional;

/**
 * No-op cache implementation, used when caching is disabled.
 */
public class NoOpNormalizationCache implements NormalizationCache {

    @Override
    public Optional<String> get(String rawName) {
        return Optional.empty();
    }

    @Override
    public void put(String rawName, String normalizedName) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
