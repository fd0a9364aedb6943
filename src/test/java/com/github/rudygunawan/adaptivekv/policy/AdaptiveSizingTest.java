package com.github.rudygunawan.adaptivekv.policy;

import com.github.rudygunawan.adaptivekv.config.CacheConfiguration;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdaptiveSizingTest {
    private final CacheConfiguration.AdaptiveResize policy = CacheConfiguration.defaults().getAdaptiveResize();

    @Test
    void testGrowsOnHighHitRateAndLowUsage() {
        assertEquals(13_000, AdaptiveSizing.resize(10_000, 0.95, 0.3, policy));
    }

    @Test
    void testGrowthCappedAtMaximum() {
        assertEquals(50_000, AdaptiveSizing.resize(40_000, 0.95, 0.3, policy));
    }

    @Test
    void testShrinksOnLowHitRate() {
        assertEquals(7_000, AdaptiveSizing.resize(10_000, 0.5, 0.3, policy));
    }

    @Test
    void testShrinksOnHighUsageEvenWithGoodHitRate() {
        assertEquals(7_000, AdaptiveSizing.resize(10_000, 0.95, 0.85, policy));
    }

    @Test
    void testShrinkFlooredAtMinimum() {
        assertEquals(1_000, AdaptiveSizing.resize(1_200, 0.5, 0.3, policy));
    }

    @Test
    void testStableInMiddleBand() {
        assertEquals(10_000, AdaptiveSizing.resize(10_000, 0.8, 0.5, policy));
        assertEquals(10_000, AdaptiveSizing.resize(10_000, 0.95, 0.7, policy));
    }

    @Test
    void testOutOfBoundsCapacityNeverMovesAway() {
        assertEquals(500, AdaptiveSizing.resize(500, 0.5, 0.3, policy));
        assertEquals(60_000, AdaptiveSizing.resize(60_000, 0.95, 0.3, policy));
    }
}
