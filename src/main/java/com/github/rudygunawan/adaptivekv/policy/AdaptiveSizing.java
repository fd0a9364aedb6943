package com.github.rudygunawan.adaptivekv.policy;

import com.github.rudygunawan.adaptivekv.config.CacheConfiguration;

/**
 * Decides how the entry ceiling moves in response to hit rate and memory usage.
 *
 * <p>A high hit rate with plenty of free memory grows the ceiling by the growth factor up to the
 * configured maximum. A low hit rate, or memory usage above the resize threshold, shrinks it by
 * the shrink factor down to the configured minimum. Otherwise the ceiling is left alone.
 *
 * <p>A ceiling that starts outside the resize bounds is never moved further away from them: a
 * grow step never lowers it and a shrink step never raises it.
 */
public final class AdaptiveSizing {
    static final double GROW_HIT_RATE = 0.9;
    static final double GROW_MAX_USAGE = 0.6;
    static final double SHRINK_HIT_RATE = 0.7;

    private AdaptiveSizing() {
    }

    /**
     * Returns the new entry ceiling.
     *
     * @param capacity the current ceiling
     * @param hitRate lifetime hit rate
     * @param usageRatio memory usage divided by the memory ceiling
     * @param policy the adaptive resize settings
     */
    public static int resize(int capacity, double hitRate, double usageRatio,
                             CacheConfiguration.AdaptiveResize policy) {
        if (hitRate > GROW_HIT_RATE && usageRatio < GROW_MAX_USAGE) {
            long grown = (long) Math.floor(capacity * policy.getGrowthFactor());
            return (int) Math.max(capacity, Math.min(policy.getMaxSize(), grown));
        }
        if (hitRate < SHRINK_HIT_RATE || usageRatio > policy.getResizeThreshold()) {
            long shrunk = (long) Math.floor(capacity * policy.getShrinkFactor());
            return (int) Math.min(capacity, Math.max(policy.getMinSize(), shrunk));
        }
        return capacity;
    }
}
