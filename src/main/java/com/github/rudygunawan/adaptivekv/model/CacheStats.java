package com.github.rudygunawan.adaptivekv.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;

/**
 * Statistics about the performance of an adaptive cache. Instances of this class are immutable.
 *
 * <p>Cache statistics are incremented according to the following rules:
 *
 * <ul>
 *   <li>When a lookup finds a live entry, {@code hits} is incremented.
 *   <li>When a lookup finds nothing, an expired entry, or an entry that can no longer be decoded,
 *       {@code misses} is incremented.
 *   <li>When an entry is removed to make room or to relieve memory pressure, {@code evictions} is
 *       incremented. Replacing a key and {@code clear()} are not evictions.
 *   <li>When an entry is removed because its time-to-live elapsed, {@code expirations} is
 *       incremented.
 *   <li>When a value is stored in encoded form, {@code quantizations} is incremented.
 * </ul>
 *
 * <p>Counters are cumulative for the lifetime of the cache. Occupancy figures ({@code memoryUsage},
 * {@code entryCount}, {@code averageEntrySize}, {@code compressionRatio}) describe the moment the
 * snapshot was taken.
 */
@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
        isGetterVisibility = Visibility.NONE)
public class CacheStats {
    private final long hits;
    private final long misses;
    private final long evictions;
    private final long expirations;
    private final long quantizations;
    private final long quantizationErrors;
    private final long totalRequests;
    private final long memoryUsage;
    private final long entryCount;
    private final long averageEntrySize;
    private final long capacity;
    private final double hitRate;
    private final double compressionRatio;
    private final double averageAccessTime;
    private final long predictedHits;
    private final double predictionAccuracy;
    private final long trainingFailures;

    private CacheStats(Builder builder) {
        this.hits = builder.hits;
        this.misses = builder.misses;
        this.evictions = builder.evictions;
        this.expirations = builder.expirations;
        this.quantizations = builder.quantizations;
        this.quantizationErrors = builder.quantizationErrors;
        this.totalRequests = builder.hits + builder.misses;
        this.memoryUsage = builder.memoryUsage;
        this.entryCount = builder.entryCount;
        this.averageEntrySize = builder.entryCount == 0 ? 0 : builder.memoryUsage / builder.entryCount;
        this.capacity = builder.capacity;
        this.hitRate = totalRequests == 0 ? 0.0 : (double) builder.hits / totalRequests;
        this.compressionRatio = builder.memoryUsage == 0 ? 1.0 : (double) builder.originalSize / builder.memoryUsage;
        this.averageAccessTime = builder.averageAccessTime;
        this.predictedHits = builder.predictedHits;
        this.predictionAccuracy = builder.scoredPredictions == 0
                ? 0.0 : (double) builder.correctPredictions / builder.scoredPredictions;
        this.trainingFailures = builder.trainingFailures;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public long hitCount() {
        return hits;
    }

    public long missCount() {
        return misses;
    }

    /**
     * Returns the number of lookups, hits plus misses.
     */
    public long requestCount() {
        return totalRequests;
    }

    /**
     * Returns {@code hits / requestCount}, or {@code 0.0} before the first lookup.
     */
    public double hitRate() {
        return hitRate;
    }

    public long evictionCount() {
        return evictions;
    }

    /**
     * Returns {@code evictions / requestCount}, or {@code 0.0} before the first lookup.
     */
    public double evictionRate() {
        return totalRequests == 0 ? 0.0 : (double) evictions / totalRequests;
    }

    public long expirationCount() {
        return expirations;
    }

    public long quantizationCount() {
        return quantizations;
    }

    /**
     * Returns the number of values that could not be quantized and were stored raw.
     */
    public long quantizationErrorCount() {
        return quantizationErrors;
    }

    /**
     * Returns the sum of the accounted sizes of all entries, in bytes.
     */
    public long memoryUsage() {
        return memoryUsage;
    }

    public long entryCount() {
        return entryCount;
    }

    public long averageEntrySize() {
        return averageEntrySize;
    }

    /**
     * Returns the current entry ceiling, which adaptive resizing moves between its bounds.
     */
    public long capacity() {
        return capacity;
    }

    /**
     * Returns total original size over total stored size, or {@code 1.0} when empty.
     */
    public double compressionRatio() {
        return compressionRatio;
    }

    /**
     * Returns the smoothed lookup latency in milliseconds.
     */
    public double averageAccessTime() {
        return averageAccessTime;
    }

    /**
     * Returns the number of entries whose seeding prediction reached the confidence threshold.
     */
    public long predictedHitCount() {
        return predictedHits;
    }

    /**
     * Returns the share of scored predictions that turned out right, or {@code 0.0} before any
     * were scored.
     */
    public double predictionAccuracy() {
        return predictionAccuracy;
    }

    public long trainingFailureCount() {
        return trainingFailures;
    }

    @Override
    public String toString() {
        return "CacheStats{"
                + "hits=" + hits
                + ", misses=" + misses
                + ", evictions=" + evictions
                + ", expirations=" + expirations
                + ", quantizations=" + quantizations
                + ", quantizationErrors=" + quantizationErrors
                + ", entryCount=" + entryCount
                + ", capacity=" + capacity
                + ", memoryUsage=" + memoryUsage
                + ", hitRate=" + String.format("%.2f%%", hitRate * 100)
                + ", compressionRatio=" + String.format("%.2f", compressionRatio)
                + '}';
    }

    /**
     * Collects raw counters; derived rates are computed by {@link #build()}.
     */
    public static final class Builder {
        private long hits;
        private long misses;
        private long evictions;
        private long expirations;
        private long quantizations;
        private long quantizationErrors;
        private long memoryUsage;
        private long originalSize;
        private long entryCount;
        private long capacity;
        private double averageAccessTime;
        private long predictedHits;
        private long scoredPredictions;
        private long correctPredictions;
        private long trainingFailures;

        private Builder() {
        }

        public Builder hits(long hits) {
            this.hits = hits;
            return this;
        }

        public Builder misses(long misses) {
            this.misses = misses;
            return this;
        }

        public Builder evictions(long evictions) {
            this.evictions = evictions;
            return this;
        }

        public Builder expirations(long expirations) {
            this.expirations = expirations;
            return this;
        }

        public Builder quantizations(long quantizations) {
            this.quantizations = quantizations;
            return this;
        }

        public Builder quantizationErrors(long quantizationErrors) {
            this.quantizationErrors = quantizationErrors;
            return this;
        }

        public Builder occupancy(long entryCount, long memoryUsage, long originalSize) {
            this.entryCount = entryCount;
            this.memoryUsage = memoryUsage;
            this.originalSize = originalSize;
            return this;
        }

        public Builder capacity(long capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder averageAccessTime(double averageAccessTime) {
            this.averageAccessTime = averageAccessTime;
            return this;
        }

        public Builder predictions(long predictedHits, long scoredPredictions, long correctPredictions) {
            this.predictedHits = predictedHits;
            this.scoredPredictions = scoredPredictions;
            this.correctPredictions = correctPredictions;
            return this;
        }

        public Builder trainingFailures(long trainingFailures) {
            this.trainingFailures = trainingFailures;
            return this;
        }

        public CacheStats build() {
            return new CacheStats(this);
        }
    }
}
