package com.github.rudygunawan.adaptivekv.config;

import com.github.rudygunawan.adaptivekv.quantization.QuantizationType;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Immutable cache configuration. Instances are created with {@link #newBuilder()} or
 * {@link #toBuilder()}, and are validated when built.
 *
 * <p>Usage example:
 * <pre>{@code
 * CacheConfiguration config = CacheConfiguration.newBuilder()
 *     .maxSize(5_000)
 *     .maxMemoryMB(256)
 *     .defaultTTL(30, TimeUnit.MINUTES)
 *     .quantizationType(QuantizationType.INT8)
 *     .quantizationThresholdBytes(2048)
 *     .build();
 * }</pre>
 */
public final class CacheConfiguration {
    private final int maxSize;
    private final double maxMemoryMB;
    private final long defaultTTL;
    private final Quantization quantization;
    private final AdaptiveResize adaptiveResize;
    private final MlPrediction mlPrediction;
    private final Monitoring monitoring;

    private CacheConfiguration(Builder builder) {
        this.maxSize = builder.maxSize;
        this.maxMemoryMB = builder.maxMemoryMB;
        this.defaultTTL = builder.defaultTTL;
        this.quantization = new Quantization(builder.quantizationEnabled, builder.quantizationType,
                builder.quantizationThresholdBytes, builder.quantizationAggressive);
        this.adaptiveResize = new AdaptiveResize(builder.resizeEnabled, builder.resizeMinSize,
                builder.resizeMaxSize, builder.resizeThreshold, builder.shrinkFactor, builder.growthFactor);
        this.mlPrediction = new MlPrediction(builder.predictionEnabled, builder.predictionWindowMs,
                builder.confidenceThreshold);
        this.monitoring = new Monitoring(builder.monitoringEnabled, builder.metricsIntervalMs,
                new AlertThresholds(builder.hitRateThreshold, builder.memoryUsageThreshold,
                        builder.evictionRateThreshold));
    }

    /**
     * Returns a builder with the default settings.
     */
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Returns a configuration with every option at its default.
     */
    public static CacheConfiguration defaults() {
        return newBuilder().build();
    }

    /**
     * Returns a builder pre-filled with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Returns the maximum number of entries the cache starts with.
     */
    public int getMaxSize() {
        return maxSize;
    }

    public double getMaxMemoryMB() {
        return maxMemoryMB;
    }

    /**
     * Returns the memory ceiling in bytes.
     */
    public long maxMemoryBytes() {
        return (long) (maxMemoryMB * 1024 * 1024);
    }

    /**
     * Returns the default time-to-live in milliseconds.
     */
    public long getDefaultTTL() {
        return defaultTTL;
    }

    public Quantization getQuantization() {
        return quantization;
    }

    public AdaptiveResize getAdaptiveResize() {
        return adaptiveResize;
    }

    public MlPrediction getMlPrediction() {
        return mlPrediction;
    }

    public Monitoring getMonitoring() {
        return monitoring;
    }

    @Override
    public String toString() {
        return "CacheConfiguration{"
                + "maxSize=" + maxSize
                + ", maxMemoryMB=" + maxMemoryMB
                + ", defaultTTL=" + defaultTTL
                + ", quantization=" + quantization
                + ", adaptiveResize=" + adaptiveResize
                + ", mlPrediction=" + mlPrediction
                + ", monitoring=" + monitoring
                + '}';
    }

    /**
     * Quantization policy: whether and how large values are encoded.
     */
    public static final class Quantization {
        private final boolean enabled;
        private final QuantizationType type;
        private final long thresholdBytes;
        private final boolean aggressive;

        Quantization(boolean enabled, QuantizationType type, long thresholdBytes, boolean aggressive) {
            this.enabled = enabled;
            this.type = type;
            this.thresholdBytes = thresholdBytes;
            this.aggressive = aggressive;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public QuantizationType getType() {
            return type;
        }

        /**
         * Values smaller than this estimated size are never quantized on insertion.
         */
        public long getThresholdBytes() {
            return thresholdBytes;
        }

        /**
         * When set, every value at or above the threshold is quantized. Otherwise only values
         * larger than twice the threshold are, unless memory pressure is high.
         */
        public boolean isAggressive() {
            return aggressive;
        }

        @Override
        public String toString() {
            return "{enabled=" + enabled + ", type=" + type + ", thresholdBytes=" + thresholdBytes
                    + ", aggressive=" + aggressive + '}';
        }
    }

    /**
     * Adaptive resize policy: bounds and factors for growing and shrinking the entry ceiling.
     */
    public static final class AdaptiveResize {
        private final boolean enabled;
        private final int minSize;
        private final int maxSize;
        private final double resizeThreshold;
        private final double shrinkFactor;
        private final double growthFactor;

        AdaptiveResize(boolean enabled, int minSize, int maxSize, double resizeThreshold,
                       double shrinkFactor, double growthFactor) {
            this.enabled = enabled;
            this.minSize = minSize;
            this.maxSize = maxSize;
            this.resizeThreshold = resizeThreshold;
            this.shrinkFactor = shrinkFactor;
            this.growthFactor = growthFactor;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public int getMinSize() {
            return minSize;
        }

        public int getMaxSize() {
            return maxSize;
        }

        /**
         * Memory usage ratio above which the cache shrinks.
         */
        public double getResizeThreshold() {
            return resizeThreshold;
        }

        public double getShrinkFactor() {
            return shrinkFactor;
        }

        public double getGrowthFactor() {
            return growthFactor;
        }

        @Override
        public String toString() {
            return "{enabled=" + enabled + ", minSize=" + minSize + ", maxSize=" + maxSize
                    + ", resizeThreshold=" + resizeThreshold + ", shrinkFactor=" + shrinkFactor
                    + ", growthFactor=" + growthFactor + '}';
        }
    }

    /**
     * Hit prediction policy.
     */
    public static final class MlPrediction {
        private final boolean enabled;
        private final long predictionWindowMs;
        private final double confidenceThreshold;

        MlPrediction(boolean enabled, long predictionWindowMs, double confidenceThreshold) {
            this.enabled = enabled;
            this.predictionWindowMs = predictionWindowMs;
            this.confidenceThreshold = confidenceThreshold;
        }

        public boolean isEnabled() {
            return enabled;
        }

        /**
         * How far back per-key access history is kept, in milliseconds.
         */
        public long getPredictionWindowMs() {
            return predictionWindowMs;
        }

        /**
         * Probability at or above which a new entry counts as a predicted hit.
         */
        public double getConfidenceThreshold() {
            return confidenceThreshold;
        }

        @Override
        public String toString() {
            return "{enabled=" + enabled + ", predictionWindowMs=" + predictionWindowMs
                    + ", confidenceThreshold=" + confidenceThreshold + '}';
        }
    }

    /**
     * Monitoring policy: maintenance interval and alert thresholds.
     */
    public static final class Monitoring {
        private final boolean enabled;
        private final long metricsIntervalMs;
        private final AlertThresholds alertThresholds;

        Monitoring(boolean enabled, long metricsIntervalMs, AlertThresholds alertThresholds) {
            this.enabled = enabled;
            this.metricsIntervalMs = metricsIntervalMs;
            this.alertThresholds = alertThresholds;
        }

        /**
         * Whether alerts are evaluated on each maintenance tick.
         */
        public boolean isEnabled() {
            return enabled;
        }

        /**
         * Interval between maintenance ticks, in milliseconds.
         */
        public long getMetricsIntervalMs() {
            return metricsIntervalMs;
        }

        public AlertThresholds getAlertThresholds() {
            return alertThresholds;
        }

        @Override
        public String toString() {
            return "{enabled=" + enabled + ", metricsIntervalMs=" + metricsIntervalMs
                    + ", alertThresholds=" + alertThresholds + '}';
        }
    }

    /**
     * Levels at which alerts are raised.
     */
    public static final class AlertThresholds {
        private final double hitRate;
        private final double memoryUsage;
        private final double evictionRate;

        AlertThresholds(double hitRate, double memoryUsage, double evictionRate) {
            this.hitRate = hitRate;
            this.memoryUsage = memoryUsage;
            this.evictionRate = evictionRate;
        }

        /**
         * Alert when the hit rate falls below this value.
         */
        public double getHitRate() {
            return hitRate;
        }

        /**
         * Alert when the memory usage ratio rises above this value.
         */
        public double getMemoryUsage() {
            return memoryUsage;
        }

        /**
         * Alert when evictions per request rise above this value.
         */
        public double getEvictionRate() {
            return evictionRate;
        }

        @Override
        public String toString() {
            return "{hitRate=" + hitRate + ", memoryUsage=" + memoryUsage + ", evictionRate=" + evictionRate + '}';
        }
    }

    /**
     * A builder of {@link CacheConfiguration} instances. Setters accept any value; range checks
     * happen in {@link #build()}, which reports every violation at once.
     */
    public static final class Builder {
        private int maxSize = 10_000;
        private double maxMemoryMB = 512;
        private long defaultTTL = 3_600_000L;

        private boolean quantizationEnabled = true;
        private QuantizationType quantizationType = QuantizationType.INT8;
        private long quantizationThresholdBytes = 1024;
        private boolean quantizationAggressive = false;

        private boolean resizeEnabled = true;
        private int resizeMinSize = 1000;
        private int resizeMaxSize = 50_000;
        private double resizeThreshold = 0.8;
        private double shrinkFactor = 0.7;
        private double growthFactor = 1.3;

        private boolean predictionEnabled = true;
        private long predictionWindowMs = 3_600_000L;
        private double confidenceThreshold = 0.7;

        private boolean monitoringEnabled = true;
        private long metricsIntervalMs = 60_000L;
        private double hitRateThreshold = 0.8;
        private double memoryUsageThreshold = 0.9;
        private double evictionRateThreshold = 0.1;

        private Builder() {
        }

        private Builder(CacheConfiguration config) {
            this.maxSize = config.maxSize;
            this.maxMemoryMB = config.maxMemoryMB;
            this.defaultTTL = config.defaultTTL;
            this.quantizationEnabled = config.quantization.enabled;
            this.quantizationType = config.quantization.type;
            this.quantizationThresholdBytes = config.quantization.thresholdBytes;
            this.quantizationAggressive = config.quantization.aggressive;
            this.resizeEnabled = config.adaptiveResize.enabled;
            this.resizeMinSize = config.adaptiveResize.minSize;
            this.resizeMaxSize = config.adaptiveResize.maxSize;
            this.resizeThreshold = config.adaptiveResize.resizeThreshold;
            this.shrinkFactor = config.adaptiveResize.shrinkFactor;
            this.growthFactor = config.adaptiveResize.growthFactor;
            this.predictionEnabled = config.mlPrediction.enabled;
            this.predictionWindowMs = config.mlPrediction.predictionWindowMs;
            this.confidenceThreshold = config.mlPrediction.confidenceThreshold;
            this.monitoringEnabled = config.monitoring.enabled;
            this.metricsIntervalMs = config.monitoring.metricsIntervalMs;
            this.hitRateThreshold = config.monitoring.alertThresholds.hitRate;
            this.memoryUsageThreshold = config.monitoring.alertThresholds.memoryUsage;
            this.evictionRateThreshold = config.monitoring.alertThresholds.evictionRate;
        }

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder maxMemoryMB(double maxMemoryMB) {
            this.maxMemoryMB = maxMemoryMB;
            return this;
        }

        public Builder defaultTTL(long defaultTTLMillis) {
            this.defaultTTL = defaultTTLMillis;
            return this;
        }

        public Builder defaultTTL(long duration, TimeUnit unit) {
            this.defaultTTL = unit.toMillis(duration);
            return this;
        }

        public Builder quantizationEnabled(boolean enabled) {
            this.quantizationEnabled = enabled;
            return this;
        }

        public Builder quantizationType(QuantizationType type) {
            this.quantizationType = type;
            return this;
        }

        public Builder quantizationThresholdBytes(long thresholdBytes) {
            this.quantizationThresholdBytes = thresholdBytes;
            return this;
        }

        public Builder quantizationAggressive(boolean aggressive) {
            this.quantizationAggressive = aggressive;
            return this;
        }

        public Builder adaptiveResizeEnabled(boolean enabled) {
            this.resizeEnabled = enabled;
            return this;
        }

        public Builder adaptiveResizeBounds(int minSize, int maxSize) {
            this.resizeMinSize = minSize;
            this.resizeMaxSize = maxSize;
            return this;
        }

        public Builder resizeThreshold(double resizeThreshold) {
            this.resizeThreshold = resizeThreshold;
            return this;
        }

        public Builder shrinkFactor(double shrinkFactor) {
            this.shrinkFactor = shrinkFactor;
            return this;
        }

        public Builder growthFactor(double growthFactor) {
            this.growthFactor = growthFactor;
            return this;
        }

        public Builder predictionEnabled(boolean enabled) {
            this.predictionEnabled = enabled;
            return this;
        }

        public Builder predictionWindowMs(long predictionWindowMs) {
            this.predictionWindowMs = predictionWindowMs;
            return this;
        }

        public Builder confidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        public Builder monitoringEnabled(boolean enabled) {
            this.monitoringEnabled = enabled;
            return this;
        }

        public Builder metricsIntervalMs(long metricsIntervalMs) {
            this.metricsIntervalMs = metricsIntervalMs;
            return this;
        }

        public Builder alertThresholds(double hitRate, double memoryUsage, double evictionRate) {
            this.hitRateThreshold = hitRate;
            this.memoryUsageThreshold = memoryUsage;
            this.evictionRateThreshold = evictionRate;
            return this;
        }

        /**
         * Validates the options and builds the configuration.
         *
         * @throws InvalidConfigurationException if any option is out of range
         */
        public CacheConfiguration build() {
            List<String> violations = new ArrayList<>();
            if (maxSize < 1) {
                violations.add("maxSize must be at least 1, was " + maxSize);
            }
            if (!(maxMemoryMB > 0) || Double.isInfinite(maxMemoryMB)) {
                violations.add("maxMemoryMB must be positive, was " + maxMemoryMB);
            }
            if (defaultTTL <= 0) {
                violations.add("defaultTTL must be positive, was " + defaultTTL);
            }
            if (quantizationType == null) {
                violations.add("quantization.type must not be null");
            }
            if (quantizationThresholdBytes < 0) {
                violations.add("quantization.thresholdBytes must not be negative, was " + quantizationThresholdBytes);
            }
            if (resizeMinSize < 1) {
                violations.add("adaptiveResize.minSize must be at least 1, was " + resizeMinSize);
            }
            if (resizeMaxSize < resizeMinSize) {
                violations.add("adaptiveResize.maxSize (" + resizeMaxSize + ") must not be below minSize ("
                        + resizeMinSize + ")");
            }
            if (!(resizeThreshold > 0 && resizeThreshold <= 1)) {
                violations.add("adaptiveResize.resizeThreshold must be in (0, 1], was " + resizeThreshold);
            }
            if (!(shrinkFactor > 0 && shrinkFactor < 1)) {
                violations.add("adaptiveResize.shrinkFactor must be in (0, 1), was " + shrinkFactor);
            }
            if (!(growthFactor > 1) || Double.isInfinite(growthFactor)) {
                violations.add("adaptiveResize.growthFactor must be greater than 1, was " + growthFactor);
            }
            if (predictionWindowMs <= 0) {
                violations.add("mlPrediction.predictionWindowMs must be positive, was " + predictionWindowMs);
            }
            checkRatio(violations, "mlPrediction.confidenceThreshold", confidenceThreshold);
            if (metricsIntervalMs <= 0) {
                violations.add("monitoring.metricsIntervalMs must be positive, was " + metricsIntervalMs);
            }
            checkRatio(violations, "monitoring.alertThresholds.hitRate", hitRateThreshold);
            checkRatio(violations, "monitoring.alertThresholds.memoryUsage", memoryUsageThreshold);
            if (!(evictionRateThreshold >= 0) || Double.isInfinite(evictionRateThreshold)) {
                violations.add("monitoring.alertThresholds.evictionRate must not be negative, was "
                        + evictionRateThreshold);
            }
            if (!violations.isEmpty()) {
                throw new InvalidConfigurationException(violations);
            }
            return new CacheConfiguration(this);
        }

        private static void checkRatio(List<String> violations, String name, double value) {
            if (!(value >= 0 && value <= 1)) {
                violations.add(name + " must be in [0, 1], was " + value);
            }
        }
    }
}
