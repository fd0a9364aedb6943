package com.github.rudygunawan.adaptivekv.builder;

import com.github.rudygunawan.adaptivekv.config.CacheConfiguration;
import com.github.rudygunawan.adaptivekv.impl.AdaptiveKVCache;
import com.github.rudygunawan.adaptivekv.time.Ticker;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheBuilderTest {

    @Test
    void testDefaults() {
        CacheBuilder builder = CacheBuilder.newBuilder();

        assertEquals("adaptive-kv", builder.getName());
        assertSame(Ticker.systemTicker(), builder.getTicker());
        assertTrue(builder.isSchedulingMaintenance());
        assertNull(builder.getRemovalListener());
        assertTrue(builder.getAlertListeners().isEmpty());
        assertEquals(CacheConfiguration.defaults().getMaxSize(), builder.getConfiguration().getMaxSize());
    }

    @Test
    void testBuildUsesSettings() {
        try (AdaptiveKVCache cache = CacheBuilder.newBuilder()
                .name("profiles")
                .configuration(CacheConfiguration.newBuilder().maxSize(25).build())
                .scheduleMaintenance(false)
                .build()) {
            assertEquals("profiles", cache.getName());
            assertEquals(25, cache.getConfiguration().getMaxSize());
            assertEquals(25, cache.capacity());
        }
    }

    @Test
    void testAlertListenersAccumulate() {
        CacheBuilder builder = CacheBuilder.newBuilder()
                .alertListener(alert -> { })
                .alertListener(alert -> { });

        assertEquals(2, builder.getAlertListeners().size());
    }

    @Test
    void testRejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> CacheBuilder.newBuilder().name("  "));
        assertThrows(NullPointerException.class, () -> CacheBuilder.newBuilder().ticker(null));
        assertThrows(NullPointerException.class, () -> CacheBuilder.newBuilder().configuration(null));
    }
}
