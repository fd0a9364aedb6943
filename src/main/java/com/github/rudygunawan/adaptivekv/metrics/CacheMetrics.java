package com.github.rudygunawan.adaptivekv.metrics;

/**
 * Interface for cache implementations to provide metrics data.
 * This is used by {@link MicrometerCacheMetrics} to collect and expose metrics.
 */
public interface CacheMetrics {

    /**
     * Returns the current number of entries in the cache.
     */
    long entryCount();

    /**
     * Returns the current entry ceiling.
     */
    long capacity();

    long hitCount();

    long missCount();

    /**
     * Returns the number of entries removed for space: size limit, memory limit, or memory pressure.
     */
    long evictionCount();

    long expirationCount();

    long quantizationCount();

    /**
     * Returns the number of values that could not be quantized and were stored raw.
     */
    long quantizationErrorCount();

    /**
     * Returns the sum of the accounted sizes of all entries, in bytes.
     */
    long memoryUsageBytes();

    /**
     * Returns the configured memory ceiling, in bytes.
     */
    long maxMemoryBytes();

    /**
     * Returns total original size over total stored size, or 1.0 when empty.
     */
    double compressionRatio();

    /**
     * Returns the number of unresolved alerts.
     */
    long activeAlertCount();

    double predictionAccuracy();

    /**
     * Returns memory usage as a fraction of the ceiling.
     */
    default double memoryUsageRatio() {
        long max = maxMemoryBytes();
        return max <= 0 ? 0.0 : (double) memoryUsageBytes() / max;
    }
}
