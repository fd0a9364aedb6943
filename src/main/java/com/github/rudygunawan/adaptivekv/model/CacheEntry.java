package com.github.rudygunawan.adaptivekv.model;

import com.github.rudygunawan.adaptivekv.quantization.QuantizationMetadata;
import com.github.rudygunawan.adaptivekv.quantization.QuantizationType;
import com.github.rudygunawan.adaptivekv.quantization.QuantizedValue;

import java.util.Objects;

/**
 * A cache entry that wraps a value, raw or quantized, with the metadata used for expiration,
 * priority eviction and hit prediction scoring.
 *
 * <p>Entries are mutable and not thread-safe. They are only touched while the owning cache's
 * lock is held.
 */
public class CacheEntry {
    private final String key;
    private final long sequence;
    private final long originalSize;
    private final long createdNanos;
    private final long ttlNanos;

    private Value rawValue;
    private QuantizedValue quantizedValue;
    private long size;
    private QuantizationType attemptedQuantization = QuantizationType.NONE;

    private long accessCount;
    private long lastAccessedNanos;
    private double priority;

    private boolean predictedHit;
    private boolean predictionScored;

    /**
     * Creates an entry holding {@code value} unquantized.
     *
     * @param key the entry key
     * @param sequence insertion number, unique per cache
     * @param value the raw value
     * @param nowNanos the ticker reading at insertion
     * @param ttlNanos the time-to-live in nanoseconds
     */
    public CacheEntry(String key, long sequence, Value value, long nowNanos, long ttlNanos) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
        this.sequence = sequence;
        this.rawValue = Objects.requireNonNull(value, "value cannot be null");
        this.originalSize = value.estimatedSize();
        this.size = originalSize;
        this.createdNanos = nowNanos;
        this.lastAccessedNanos = nowNanos;
        this.ttlNanos = ttlNanos;
    }

    public String getKey() {
        return key;
    }

    /**
     * Returns the insertion number, used as the last eviction tie-breaker.
     */
    public long getSequence() {
        return sequence;
    }

    /**
     * Returns the estimated size of the value before quantization.
     */
    public long getOriginalSize() {
        return originalSize;
    }

    /**
     * Returns the size the entry currently accounts for: the encoded length when quantized,
     * otherwise the original size.
     */
    public long getSize() {
        return size;
    }

    public long getCreatedNanos() {
        return createdNanos;
    }

    public long getTtlNanos() {
        return ttlNanos;
    }

    /**
     * Returns true if more than the time-to-live has elapsed since creation.
     */
    public boolean isExpired(long nowNanos) {
        return nowNanos - createdNanos > ttlNanos;
    }

    public boolean isQuantized() {
        return quantizedValue != null;
    }

    public QuantizationType getQuantizationType() {
        return quantizedValue == null ? QuantizationType.NONE : quantizedValue.getMetadata().getType();
    }

    public QuantizationMetadata getMetadata() {
        return quantizedValue == null ? QuantizationMetadata.unquantized() : quantizedValue.getMetadata();
    }

    /**
     * Returns the raw value, or null if the entry is quantized.
     */
    public Value getRawValue() {
        return rawValue;
    }

    /**
     * Returns the quantized value, or null if the entry is stored raw.
     */
    public QuantizedValue getQuantizedValue() {
        return quantizedValue;
    }

    /**
     * Replaces the stored representation with an encoded one. The raw value is released.
     *
     * @return the change in accounted size, negative when the entry shrank
     */
    public long storeQuantized(QuantizedValue quantized) {
        if (!quantized.isQuantized()) {
            throw new IllegalArgumentException("value was not quantized");
        }
        long previous = size;
        this.quantizedValue = quantized;
        this.rawValue = null;
        this.size = quantized.size();
        return size - previous;
    }

    /**
     * Returns true if encoding this entry with {@code type} was already tried, whether or not the
     * attempt kept the encoded form.
     */
    public boolean wasQuantizationAttempted(QuantizationType type) {
        return attemptedQuantization == type;
    }

    public void markQuantizationAttempted(QuantizationType type) {
        this.attemptedQuantization = type;
    }

    public long getAccessCount() {
        return accessCount;
    }

    public long getLastAccessedNanos() {
        return lastAccessedNanos;
    }

    /**
     * Records a hit on this entry.
     */
    public void recordAccess(long nowNanos) {
        accessCount++;
        lastAccessedNanos = nowNanos;
    }

    public double getPriority() {
        return priority;
    }

    public void setPriority(double priority) {
        this.priority = priority;
    }

    /**
     * Returns true if the prediction made at insertion reached the confidence threshold.
     */
    public boolean isPredictedHit() {
        return predictedHit;
    }

    public void setPredictedHit(boolean predictedHit) {
        this.predictedHit = predictedHit;
    }

    public boolean isPredictionScored() {
        return predictionScored;
    }

    public void markPredictionScored() {
        this.predictionScored = true;
    }

    @Override
    public String toString() {
        return "CacheEntry{key=" + key
                + ", size=" + size
                + ", originalSize=" + originalSize
                + ", quantization=" + getQuantizationType()
                + ", accessCount=" + accessCount
                + ", priority=" + priority
                + '}';
    }
}
