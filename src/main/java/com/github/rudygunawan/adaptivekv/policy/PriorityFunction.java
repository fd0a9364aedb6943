package com.github.rudygunawan.adaptivekv.policy;

import com.github.rudygunawan.adaptivekv.model.CacheEntry;

import java.util.Comparator;
import java.util.concurrent.TimeUnit;

/**
 * Scores entries for eviction. Higher scores are kept longer.
 *
 * <pre>
 *   priority = 10 * ln(accessCount + 1)
 *            + max(0, 100 - minutesSinceLastAccess)
 *            + max(0, 50 - hoursSinceCreation)
 * </pre>
 */
public final class PriorityFunction {
    private static final double NANOS_PER_MINUTE = TimeUnit.MINUTES.toNanos(1);
    private static final double NANOS_PER_HOUR = TimeUnit.HOURS.toNanos(1);

    /**
     * Eviction order: lowest priority first, then least recently accessed, then oldest insertion.
     */
    public static final Comparator<CacheEntry> EVICTION_ORDER = Comparator
            .comparingDouble(CacheEntry::getPriority)
            .thenComparingLong(CacheEntry::getLastAccessedNanos)
            .thenComparingLong(CacheEntry::getSequence);

    private PriorityFunction() {
    }

    public static double priority(CacheEntry entry, long nowNanos) {
        double frequency = Math.log(entry.getAccessCount() + 1) * 10;
        double minutesSinceAccess = (nowNanos - entry.getLastAccessedNanos()) / NANOS_PER_MINUTE;
        double hoursSinceCreation = (nowNanos - entry.getCreatedNanos()) / NANOS_PER_HOUR;
        return frequency
                + Math.max(0, 100 - minutesSinceAccess)
                + Math.max(0, 50 - hoursSinceCreation);
    }
}
