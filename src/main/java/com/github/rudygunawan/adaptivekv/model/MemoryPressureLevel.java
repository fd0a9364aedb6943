package com.github.rudygunawan.adaptivekv.model;

/**
 * Classification of memory usage relative to the configured ceiling.
 *
 * @since 0.1.0
 */
public enum MemoryPressureLevel {
    /**
     * Usage below 70%.
     */
    LOW(RecommendedAction.NONE),

    /**
     * Usage from 70% up to 85%.
     */
    MEDIUM(RecommendedAction.QUANTIZE),

    /**
     * Usage from 85% up to 95%.
     */
    HIGH(RecommendedAction.EVICT),

    /**
     * Usage at or above 95%.
     */
    CRITICAL(RecommendedAction.EMERGENCY_CLEANUP);

    static final double MEDIUM_THRESHOLD = 0.70;
    static final double HIGH_THRESHOLD = 0.85;
    static final double CRITICAL_THRESHOLD = 0.95;

    private final RecommendedAction action;

    MemoryPressureLevel(RecommendedAction action) {
        this.action = action;
    }

    /**
     * Returns the response the cache takes at this level.
     */
    public RecommendedAction recommendedAction() {
        return action;
    }

    /**
     * Classifies a usage ratio.
     *
     * @param usageRatio memory usage divided by the memory ceiling
     */
    public static MemoryPressureLevel forUsage(double usageRatio) {
        if (usageRatio >= CRITICAL_THRESHOLD) {
            return CRITICAL;
        }
        if (usageRatio >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (usageRatio >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }
}
