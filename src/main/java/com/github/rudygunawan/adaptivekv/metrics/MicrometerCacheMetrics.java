package com.github.rudygunawan.adaptivekv.metrics;

import com.github.rudygunawan.adaptivekv.api.AdaptiveCache;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Micrometer integration for adaptive cache metrics.
 * Binds cache statistics to a MeterRegistry for monitoring and observability.
 *
 * <p>Exposes the following metrics, all tagged with {@code cache=<name>}:
 * <ul>
 *   <li>cache.size - Current number of entries
 *   <li>cache.capacity - Current adaptive entry ceiling
 *   <li>cache.hits - Total number of cache hits
 *   <li>cache.misses - Total number of cache misses
 *   <li>cache.evictions - Total number of evictions
 *   <li>cache.expirations - Total number of expired entries removed
 *   <li>cache.quantizations - Total number of values stored quantized
 *   <li>cache.quantization.errors - Total number of failed quantizations
 *   <li>cache.hit.ratio - Cache hit rate (0.0 to 1.0)
 *   <li>cache.memory.usage - Accounted memory in bytes
 *   <li>cache.memory.usage.ratio - Memory usage as a fraction of the ceiling
 *   <li>cache.compression.ratio - Original bytes held per stored byte
 *   <li>cache.alerts.active - Number of unresolved alerts
 *   <li>cache.prediction.accuracy - Share of hit predictions that turned out right
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * AdaptiveKVCache cache = CacheBuilder.newBuilder()
 *     .name("analysis")
 *     .build();
 *
 * MicrometerCacheMetrics.monitor(registry, cache, "analysis");
 * }</pre>
 */
public class MicrometerCacheMetrics implements MeterBinder {

    private final CacheMetrics cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    /**
     * Creates a new MicrometerCacheMetrics instance.
     *
     * @param cache the cache to monitor
     * @param cacheName the name of the cache for metric tags
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerCacheMetrics(CacheMetrics cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Convenience method to monitor a cache with Micrometer.
     *
     * @return the cache (for chaining)
     */
    public static <C extends AdaptiveCache & CacheMetrics> C monitor(
            MeterRegistry registry, C cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    /**
     * Convenience method to monitor a cache with Micrometer with additional tags.
     *
     * @return the cache (for chaining)
     */
    public static <C extends AdaptiveCache & CacheMetrics> C monitor(
            MeterRegistry registry, C cache, String cacheName, Iterable<Tag> tags) {
        new MicrometerCacheMetrics(cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        Gauge.builder("cache.size", cache, CacheMetrics::entryCount)
                .tags(allTags)
                .description("Current number of entries in the cache")
                .register(registry);

        Gauge.builder("cache.capacity", cache, CacheMetrics::capacity)
                .tags(allTags)
                .description("Current adaptive entry ceiling")
                .register(registry);

        FunctionCounter.builder("cache.hits", cache, CacheMetrics::hitCount)
                .tags(allTags)
                .description("Total number of cache hits")
                .register(registry);

        FunctionCounter.builder("cache.misses", cache, CacheMetrics::missCount)
                .tags(allTags)
                .description("Total number of cache misses")
                .register(registry);

        FunctionCounter.builder("cache.evictions", cache, CacheMetrics::evictionCount)
                .tags(allTags)
                .description("Total number of cache evictions")
                .register(registry);

        FunctionCounter.builder("cache.expirations", cache, CacheMetrics::expirationCount)
                .tags(allTags)
                .description("Total number of entries removed after their time-to-live")
                .register(registry);

        FunctionCounter.builder("cache.quantizations", cache, CacheMetrics::quantizationCount)
                .tags(allTags)
                .description("Total number of values stored quantized")
                .register(registry);

        FunctionCounter.builder("cache.quantization.errors", cache, CacheMetrics::quantizationErrorCount)
                .tags(allTags)
                .description("Total number of values that could not be quantized")
                .register(registry);

        // Lifetime hit ratio
        Gauge.builder("cache.hit.ratio", cache, c -> {
                    long hits = c.hitCount();
                    long total = hits + c.missCount();
                    return total == 0 ? 0.0 : (double) hits / total;
                })
                .tags(allTags)
                .description("Cache hit ratio (0.0 to 1.0)")
                .register(registry);

        Gauge.builder("cache.memory.usage", cache, CacheMetrics::memoryUsageBytes)
                .tags(allTags)
                .baseUnit("bytes")
                .description("Accounted memory usage of the cache")
                .register(registry);

        Gauge.builder("cache.memory.usage.ratio", cache, CacheMetrics::memoryUsageRatio)
                .tags(allTags)
                .description("Memory usage as a fraction of the configured ceiling")
                .register(registry);

        Gauge.builder("cache.compression.ratio", cache, CacheMetrics::compressionRatio)
                .tags(allTags)
                .description("Original bytes held per stored byte")
                .register(registry);

        Gauge.builder("cache.alerts.active", cache, CacheMetrics::activeAlertCount)
                .tags(allTags)
                .description("Number of unresolved alerts")
                .register(registry);

        Gauge.builder("cache.prediction.accuracy", cache, CacheMetrics::predictionAccuracy)
                .tags(allTags)
                .description("Share of scored hit predictions that were right")
                .register(registry);
    }
}
