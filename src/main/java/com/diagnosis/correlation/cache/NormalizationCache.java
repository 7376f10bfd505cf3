package com.diagnosis.correlation.cache;

import java.util.Optional;

/**
 * Cache of normalized component names keyed by the raw name.
 * Normalization is a pure function, so entries never need targeted invalidation.
 */
public interface NormalizationCache {

    /**
     * Gets the cached normalized form of a raw name.
     *
     * @param rawName the name as it was passed to the normalizer
     * @return the normalized name, or empty if not cached
     */
    Optional<String> get(String rawName);

    /**
     * Caches the normalized form of a raw name.
     */
    void put(String rawName, String normalizedName);

    void invalidateAll();

    CacheStats getStats();
}
