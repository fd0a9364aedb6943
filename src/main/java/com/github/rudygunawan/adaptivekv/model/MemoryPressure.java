package com.github.rudygunawan.adaptivekv.model;

/**
 * A snapshot of memory usage and its classification. Instances of this class are immutable.
 */
public class MemoryPressure {
    private final MemoryPressureLevel level;
    private final double usagePercentage;
    private final long memoryUsage;
    private final long availableMemory;
    private final long criticalThreshold;

    private MemoryPressure(MemoryPressureLevel level, double usagePercentage, long memoryUsage,
                           long availableMemory, long criticalThreshold) {
        this.level = level;
        this.usagePercentage = usagePercentage;
        this.memoryUsage = memoryUsage;
        this.availableMemory = availableMemory;
        this.criticalThreshold = criticalThreshold;
    }

    /**
     * Classifies {@code memoryUsage} against {@code maxMemoryBytes}.
     */
    public static MemoryPressure of(long memoryUsage, long maxMemoryBytes) {
        double ratio = maxMemoryBytes <= 0 ? 1.0 : (double) memoryUsage / maxMemoryBytes;
        return new MemoryPressure(
                MemoryPressureLevel.forUsage(ratio),
                ratio * 100,
                memoryUsage,
                Math.max(0, maxMemoryBytes - memoryUsage),
                (long) (maxMemoryBytes * MemoryPressureLevel.CRITICAL_THRESHOLD));
    }

    public MemoryPressureLevel getLevel() {
        return level;
    }

    /**
     * Returns usage as a percentage of the memory ceiling. May exceed 100 briefly.
     */
    public double getUsagePercentage() {
        return usagePercentage;
    }

    /**
     * Returns usage as a fraction of the memory ceiling.
     */
    public double usageRatio() {
        return usagePercentage / 100;
    }

    public long getMemoryUsage() {
        return memoryUsage;
    }

    /**
     * Returns the bytes left below the memory ceiling.
     */
    public long getAvailableMemory() {
        return availableMemory;
    }

    /**
     * Returns the usage in bytes at which pressure becomes critical.
     */
    public long getCriticalThreshold() {
        return criticalThreshold;
    }

    public RecommendedAction getRecommendedAction() {
        return level.recommendedAction();
    }

    @Override
    public String toString() {
        return "MemoryPressure{level=" + level
                + ", usage=" + String.format("%.1f%%", usagePercentage)
                + ", available=" + availableMemory
                + ", action=" + getRecommendedAction()
                + '}';
    }
}
