package com.diagnosis.correlation.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationCacheTest {

    @Nested
    @DisplayName("NoOpNormalizationCache")
    class NoOpTests {

        @Test
        @DisplayName("Should always return empty on get")
        void testGetAlwaysEmpty() {
            NoOpNormalizationCache cache = new NoOpNormalizationCache();
            cache.put("Temp Sensor", "temperature sensor");
            assertTrue(cache.get("Temp Sensor").isEmpty());
        }

        @Test
        @DisplayName("Should return empty stats")
        void testEmptyStats() {
            CacheStats stats = new NoOpNormalizationCache().getStats();
            assertEquals(0, stats.hitCount());
            assertEquals(0, stats.missCount());
            assertEquals(0, stats.size());
            assertEquals(0.0, stats.hitRate());
        }
    }

    @Nested
    @DisplayName("CaffeineNormalizationCache")
    class CaffeineTests {

        private final CaffeineNormalizationCache cache = new CaffeineNormalizationCache(CacheConfig.defaults());

        @Test
        @DisplayName("Should return a cached name and count hits and misses")
        void testPutAndGet() {
            assertTrue(cache.get("Temp Sensor").isEmpty());

            cache.put("Temp Sensor", "temperature sensor");

            assertEquals("temperature sensor", cache.get("Temp Sensor").orElseThrow());
            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(0.5, stats.hitRate());
        }

        @Test
        @DisplayName("Should ignore null keys and values")
        void testNulls() {
            cache.put(null, "x");
            cache.put("x", null);

            assertTrue(cache.get(null).isEmpty());
            assertTrue(cache.get("x").isEmpty());
        }

        @Test
        @DisplayName("Should drop every entry on invalidateAll")
        void testInvalidateAll() {
            cache.put("Ctrl Board", "control board");
            cache.invalidateAll();

            assertTrue(cache.get("Ctrl Board").isEmpty());
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class ConfigTests {

        @Test
        @DisplayName("Should create the cache matching the enabled flag")
        void testCreateCache() {
            assertInstanceOf(CaffeineNormalizationCache.class, CacheConfig.defaults().createCache());
            assertInstanceOf(NoOpNormalizationCache.class, CacheConfig.disabled().createCache());
        }

        @Test
        @DisplayName("Should reject non-positive sizes and TTLs")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        }
    }
}
