package com.github.rudygunawan.adaptivekv.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.github.rudygunawan.adaptivekv.config.CacheConfiguration;

import java.time.Instant;
import java.util.List;

/**
 * Everything {@code exportStatistics()} reports, as a typed object. Serialized with Jackson.
 */
@JsonPropertyOrder({"timestamp", "configuration", "metrics", "memoryPressure", "cacheSize", "capacity",
        "topKeys", "alerts", "performance"})
public class StatisticsSnapshot {
    private final Instant timestamp;
    private final CacheConfiguration configuration;
    private final CacheStats metrics;
    private final MemoryPressure memoryPressure;
    private final int cacheSize;
    private final long capacity;
    private final List<KeyAccessSummary> topKeys;
    private final List<Alert> alerts;
    private final Performance performance;

    public StatisticsSnapshot(Instant timestamp, CacheConfiguration configuration, CacheStats metrics,
                              MemoryPressure memoryPressure, int cacheSize, List<KeyAccessSummary> topKeys,
                              List<Alert> alerts) {
        this.timestamp = timestamp;
        this.configuration = configuration;
        this.metrics = metrics;
        this.memoryPressure = memoryPressure;
        this.cacheSize = cacheSize;
        this.capacity = metrics.capacity();
        this.topKeys = List.copyOf(topKeys);
        this.alerts = List.copyOf(alerts);
        this.performance = new Performance(metrics);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public CacheConfiguration getConfiguration() {
        return configuration;
    }

    public CacheStats getMetrics() {
        return metrics;
    }

    public MemoryPressure getMemoryPressure() {
        return memoryPressure;
    }

    public int getCacheSize() {
        return cacheSize;
    }

    public long getCapacity() {
        return capacity;
    }

    /**
     * Returns up to ten keys with the highest access counts, most accessed first.
     */
    public List<KeyAccessSummary> getTopKeys() {
        return topKeys;
    }

    /**
     * Returns the retained alert history, oldest first.
     */
    public List<Alert> getAlerts() {
        return alerts;
    }

    public Performance getPerformance() {
        return performance;
    }

    /**
     * Headline performance figures.
     */
    @JsonPropertyOrder({"averageGetTime", "hitRate", "memoryEfficiency", "compressionRatio"})
    public static final class Performance {
        private final double averageGetTime;
        private final double hitRate;
        private final double compressionRatio;

        Performance(CacheStats stats) {
            this.averageGetTime = stats.averageAccessTime();
            this.hitRate = stats.hitRate();
            this.compressionRatio = stats.compressionRatio();
        }

        /**
         * Smoothed lookup latency in milliseconds.
         */
        public double getAverageGetTime() {
            return averageGetTime;
        }

        public double getHitRate() {
            return hitRate;
        }

        /**
         * Same as the compression ratio: original bytes held per stored byte.
         */
        public double getMemoryEfficiency() {
            return compressionRatio;
        }

        public double getCompressionRatio() {
            return compressionRatio;
        }
    }
}
