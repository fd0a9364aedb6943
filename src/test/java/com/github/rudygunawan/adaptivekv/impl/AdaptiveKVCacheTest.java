package com.github.rudygunawan.adaptivekv.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.rudygunawan.adaptivekv.builder.CacheBuilder;
import com.github.rudygunawan.adaptivekv.config.CacheConfiguration;
import com.github.rudygunawan.adaptivekv.config.InvalidConfigurationException;
import com.github.rudygunawan.adaptivekv.model.Alert;
import com.github.rudygunawan.adaptivekv.model.AlertType;
import com.github.rudygunawan.adaptivekv.model.CacheStats;
import com.github.rudygunawan.adaptivekv.model.MemoryPressure;
import com.github.rudygunawan.adaptivekv.model.MemoryPressureLevel;
import com.github.rudygunawan.adaptivekv.model.OptimizationResult;
import com.github.rudygunawan.adaptivekv.model.RecommendedAction;
import com.github.rudygunawan.adaptivekv.model.StatisticsSnapshot;
import com.github.rudygunawan.adaptivekv.model.Value;
import com.github.rudygunawan.adaptivekv.policy.RemovalCause;
import com.github.rudygunawan.adaptivekv.quantization.QuantizationType;
import com.github.rudygunawan.adaptivekv.time.FakeTicker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AdaptiveKVCacheTest {
    // 10_000 bytes exactly: 10_000 / 2^20 is a finite binary fraction
    private static final double TEN_THOUSAND_BYTES_MB = 10_000 / 1_048_576.0;

    private final FakeTicker ticker = new FakeTicker();
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneOffset.UTC);
    private final List<String> removals = new ArrayList<>();
    private final List<RemovalCause> causes = new ArrayList<>();
    private final List<Alert> alerts = new ArrayList<>();

    private AdaptiveKVCache cache;

    private AdaptiveKVCache newCache(CacheConfiguration configuration) {
        cache = CacheBuilder.newBuilder()
                .name("test")
                .configuration(configuration)
                .ticker(ticker)
                .clock(clock)
                .removalListener((key, value, cause) -> {
                    removals.add(key);
                    causes.add(cause);
                })
                .alertListener(alerts::add)
                .scheduleMaintenance(false)
                .build();
        return cache;
    }

    private static Value text(int chars) {
        return Value.of("a".repeat(chars));
    }

    @AfterEach
    void tearDown() {
        if (cache != null) {
            cache.shutdown();
        }
    }

    @Test
    void testSetAndGet() {
        newCache(CacheConfiguration.defaults());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("summary", "2 hotspots");
        result.put("score", 0.87);
        Value value = Value.of(result);

        assertTrue(cache.set("fp-1", value));

        assertEquals(Optional.of(value), cache.get("fp-1"));
        assertEquals(Optional.empty(), cache.get("fp-2"));
        assertTrue(cache.has("fp-1"));
        assertEquals(1, cache.size());

        CacheStats stats = cache.getMetrics();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.5, stats.hitRate());
        assertEquals(value.estimatedSize(), stats.memoryUsage());
    }

    @Test
    void testHitRateIsOneWhenEveryLookupHits() {
        newCache(CacheConfiguration.defaults());
        for (int i = 0; i < 5; i++) {
            cache.set("fp-" + i, Value.of(i));
        }
        for (int round = 0; round < 3; round++) {
            for (int i = 0; i < 5; i++) {
                assertTrue(cache.get("fp-" + i).isPresent());
            }
        }

        CacheStats stats = cache.getMetrics();
        assertEquals(15, stats.hitCount());
        assertEquals(0, stats.missCount());
        assertEquals(1.0, stats.hitRate());
    }

    @Test
    void testHasDoesNotCountAsLookup() {
        newCache(CacheConfiguration.defaults());
        cache.set("a", Value.of("1"));

        cache.has("a");
        cache.has("b");

        assertEquals(0, cache.getMetrics().requestCount());
    }

    @Test
    void testExplicitTtl() {
        newCache(CacheConfiguration.defaults());
        cache.set("a", Value.of("1"), 1, TimeUnit.MINUTES);

        ticker.advance(59, TimeUnit.SECONDS);
        assertTrue(cache.has("a"));

        ticker.advance(2, TimeUnit.SECONDS);
        assertFalse(cache.has("a"));
        assertTrue(cache.get("a").isEmpty());

        CacheStats stats = cache.getMetrics();
        assertEquals(1, stats.expirationCount());
        assertEquals(0, stats.evictionCount());
        assertEquals(1, stats.missCount());
        assertEquals(0, cache.size());
        assertEquals(List.of(RemovalCause.EXPIRED), causes);
    }

    @Test
    void testDefaultTtl() {
        newCache(CacheConfiguration.newBuilder().defaultTTL(5, TimeUnit.MINUTES).build());
        cache.set("a", Value.of("1"));
        cache.set("b", Value.of("2"), 0, TimeUnit.SECONDS);

        ticker.advance(6, TimeUnit.MINUTES);

        assertFalse(cache.has("a"));
        assertFalse(cache.has("b"));
    }

    @Test
    void testMaintenanceSweepsExpiredEntries() {
        newCache(CacheConfiguration.defaults());
        for (int i = 0; i < 300; i++) {
            cache.set("short-" + i, Value.of(i), 1, TimeUnit.MINUTES);
        }
        cache.set("long", Value.of("kept"), 1, TimeUnit.HOURS);

        ticker.advance(2, TimeUnit.MINUTES);
        cache.runMaintenance();

        assertEquals(1, cache.size());
        assertEquals(300, cache.getMetrics().expirationCount());
    }

    @Test
    void testReplacementIsNotEviction() {
        newCache(CacheConfiguration.defaults());
        cache.set("a", Value.of("old"));
        cache.set("a", Value.of("new-value"));

        assertEquals(Optional.of(Value.of("new-value")), cache.get("a"));
        assertEquals(1, cache.size());
        assertEquals(0, cache.getMetrics().evictionCount());
        assertEquals(List.of(RemovalCause.REPLACED), causes);
        assertEquals(Value.of("new-value").estimatedSize(), cache.getMetrics().memoryUsage());
    }

    @Test
    void testCapacityEvictsLowestPriority() {
        newCache(CacheConfiguration.newBuilder().maxSize(3).build());
        cache.set("a", Value.of("1"));
        cache.set("b", Value.of("2"));
        cache.set("c", Value.of("3"));
        cache.get("a");
        cache.get("b");

        cache.set("d", Value.of("4"));

        assertEquals(3, cache.size());
        assertFalse(cache.has("c"));
        assertTrue(cache.has("a"));
        assertTrue(cache.has("b"));
        assertTrue(cache.has("d"));
        assertEquals(1, cache.getMetrics().evictionCount());
        assertEquals(List.of("c"), removals);
        assertEquals(List.of(RemovalCause.SIZE), causes);
    }

    @Test
    void testEvictionTieGoesToLeastRecentlyAccessed() {
        newCache(CacheConfiguration.newBuilder().maxSize(2).build());
        cache.set("a", Value.of("1"));
        ticker.advance(1, TimeUnit.SECONDS);
        cache.set("b", Value.of("2"));

        cache.set("c", Value.of("3"));

        assertEquals(List.of("a"), removals);
    }

    @Test
    void testLargeValuesAreQuantized() {
        newCache(CacheConfiguration.defaults());
        Value large = text(2000);   // 4000 bytes, more than twice the threshold
        Value medium = text(600);   // 1200 bytes, over the threshold only

        cache.set("large", large);
        cache.set("medium", medium);

        CacheStats stats = cache.getMetrics();
        assertEquals(1, stats.quantizationCount());
        assertEquals(2003 + 1200, stats.memoryUsage());
        assertTrue(stats.compressionRatio() > 1.0);
        assertEquals(Optional.of(large), cache.get("large"));
        assertEquals(Optional.of(medium), cache.get("medium"));
    }

    @Test
    void testInt8StringIsExactAfterQuantization() {
        newCache(CacheConfiguration.newBuilder().quantizationThresholdBytes(100).build());
        Value value = Value.of("function parse() { return tokens.map(t => t.trim()); } ".repeat(5).substring(0, 250));

        cache.set("src", value);

        assertEquals(1, cache.getMetrics().quantizationCount());
        assertTrue(cache.getMetrics().memoryUsage() < value.estimatedSize());
        assertEquals(Optional.of(value), cache.get("src"));
    }

    @Test
    void testAggressiveQuantizesAtThreshold() {
        newCache(CacheConfiguration.newBuilder().quantizationAggressive(true).build());

        cache.set("medium", text(600));

        assertEquals(1, cache.getMetrics().quantizationCount());
    }

    @Test
    void testQuantizationDisabled() {
        newCache(CacheConfiguration.newBuilder().quantizationEnabled(false).build());

        cache.set("large", text(5000));

        assertEquals(0, cache.getMetrics().quantizationCount());
        assertEquals(10_000, cache.getMetrics().memoryUsage());
    }

    @Test
    void testLossyQuantizationIsApproximate() {
        newCache(CacheConfiguration.newBuilder()
                .quantizationType(QuantizationType.FP8)
                .quantizationThresholdBytes(0)
                .build());
        List<Object> scores = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            scores.add(3.14159 + i);
        }

        cache.set("scores", Value.of(scores));

        Value.ListValue restored = (Value.ListValue) cache.get("scores").orElseThrow();
        assertEquals(3.14, ((Value.NumberValue) restored.getItems().get(0)).getValue(), 1e-9);
        assertEquals(1, cache.getMetrics().quantizationCount());
    }

    @Test
    void testFailedQuantizationStoresRaw() {
        newCache(CacheConfiguration.newBuilder()
                .quantizationType(QuantizationType.FP8)
                .quantizationThresholdBytes(0)
                .build());
        Value value = Value.of(List.of(Double.NaN, 1.0));

        assertTrue(cache.set("nan", value));

        assertEquals(Optional.of(value), cache.get("nan"));
        assertEquals(0, cache.getMetrics().quantizationCount());
        assertEquals(1, cache.getMetrics().quantizationErrorCount());

        cache.runMaintenance();
        assertEquals(AlertType.QUANTIZATION_FAILURE, cache.getAlerts().get(0).getType());
    }

    @Test
    void testFailedQuantizationIsNotRetriedUnderPressure() {
        newCache(CacheConfiguration.newBuilder()
                .maxMemoryMB(TEN_THOUSAND_BYTES_MB)
                .quantizationType(QuantizationType.FP8)
                .quantizationThresholdBytes(100)
                .build());
        List<Object> nans = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            nans.add(Double.NaN);
        }
        Value unquantizable = Value.of(nans);
        assertEquals(160, unquantizable.estimatedSize());
        cache.set("nan", unquantizable);
        // 80-byte fillers stay below the threshold
        for (int i = 0; i < 86; i++) {
            cache.set("filler-" + i, text(40));
        }
        assertEquals(MemoryPressureLevel.MEDIUM, cache.getMemoryPressure().getLevel());
        assertEquals(0, cache.getMetrics().quantizationErrorCount());

        for (int i = 0; i < 10; i++) {
            cache.set("small-" + i, Value.of(i));
        }

        assertEquals(1, cache.getMetrics().quantizationErrorCount());
        assertEquals(0, cache.getMetrics().quantizationCount());
        assertEquals(Optional.of(unquantizable), cache.get("nan"));

        cache.runMaintenance();
        assertTrue(hasActiveAlert(AlertType.QUANTIZATION_FAILURE));
        cache.set("small-10", Value.of(10));
        cache.runMaintenance();
        assertFalse(hasActiveAlert(AlertType.QUANTIZATION_FAILURE));
    }

    private boolean hasActiveAlert(AlertType type) {
        return cache.getAlerts().stream().anyMatch(alert -> alert.getType() == type);
    }

    @Test
    void testDeleteAndClear() {
        newCache(CacheConfiguration.defaults());
        cache.set("a", Value.of("1"));
        cache.set("b", Value.of("2"));
        cache.set("c", Value.of("3"));

        assertTrue(cache.delete("a"));
        assertFalse(cache.delete("a"));

        cache.clear();

        assertFalse(cache.has("b"));
        assertFalse(cache.has("c"));
        assertEquals(Optional.empty(), cache.get("b"));
        assertEquals(0, cache.size());
        assertEquals(0, cache.getMetrics().memoryUsage());
        assertEquals(0, cache.getMetrics().evictionCount());
        assertEquals(List.of(RemovalCause.EXPLICIT, RemovalCause.EXPLICIT, RemovalCause.EXPLICIT), causes);
    }

    @Test
    void testRemovalListenerReceivesDecodedValue() {
        List<Value> values = new ArrayList<>();
        cache = CacheBuilder.newBuilder()
                .ticker(ticker)
                .removalListener((key, value, cause) -> values.add(value))
                .scheduleMaintenance(false)
                .build();
        Value large = text(2000);
        cache.set("large", large);
        assertEquals(1, cache.getMetrics().quantizationCount());

        cache.delete("large");

        assertEquals(List.of(large), values);
    }

    @Test
    void testListenerExceptionIsContained() {
        cache = CacheBuilder.newBuilder()
                .removalListener((key, value, cause) -> {
                    throw new IllegalStateException("listener failure");
                })
                .scheduleMaintenance(false)
                .build();
        cache.set("a", Value.of("1"));

        assertTrue(cache.delete("a"));
        assertEquals(0, cache.size());
    }

    @Test
    void testMemoryPressureLevels() {
        newCache(CacheConfiguration.newBuilder()
                .maxMemoryMB(TEN_THOUSAND_BYTES_MB)
                .quantizationEnabled(false)
                .build());
        assertEquals(10_000, cache.maxMemoryBytes());

        for (int i = 0; i < 7; i++) {
            cache.set("k" + i, text(500));
        }

        MemoryPressure pressure = cache.getMemoryPressure();
        assertEquals(MemoryPressureLevel.MEDIUM, pressure.getLevel());
        assertEquals(70.0, pressure.getUsagePercentage(), 1e-9);
        assertEquals(3000, pressure.getAvailableMemory());
        assertEquals(RecommendedAction.QUANTIZE, pressure.getRecommendedAction());
        // classifying has no side effects
        assertEquals(7, cache.size());
    }

    @Test
    void testHighPressureEvictsOnNextWrite() {
        newCache(CacheConfiguration.newBuilder()
                .maxMemoryMB(TEN_THOUSAND_BYTES_MB)
                .quantizationEnabled(false)
                .build());
        for (int i = 0; i < 9; i++) {
            cache.set("k" + i, text(500));
        }
        assertEquals(MemoryPressureLevel.HIGH, cache.getMemoryPressure().getLevel());

        cache.set("k9", text(500));

        assertEquals(8, cache.size());
        assertEquals(2, cache.getMetrics().evictionCount());
        assertEquals(List.of(RemovalCause.PRESSURE, RemovalCause.PRESSURE), causes);
        assertEquals(8000, cache.getMetrics().memoryUsage());
    }

    @Test
    void testInsertEvictsAtMemoryCeiling() {
        newCache(CacheConfiguration.newBuilder()
                .maxMemoryMB(TEN_THOUSAND_BYTES_MB)
                .quantizationEnabled(false)
                .build());
        cache.set("huge", text(4750));
        assertEquals(MemoryPressureLevel.CRITICAL, cache.getMemoryPressure().getLevel());

        cache.set("small", Value.of("x"));

        assertFalse(cache.has("huge"));
        assertTrue(cache.has("small"));
        assertEquals(List.of(RemovalCause.SIZE), causes);
    }

    @Test
    void testMediumPressureQuantizesDuringMaintenance() {
        newCache(CacheConfiguration.newBuilder()
                .maxMemoryMB(TEN_THOUSAND_BYTES_MB)
                .quantizationThresholdBytes(500)
                .build());
        for (int i = 0; i < 7; i++) {
            cache.set("k" + i, text(500));
        }
        assertEquals(0, cache.getMetrics().quantizationCount());

        cache.runMaintenance();

        assertEquals(7, cache.getMetrics().quantizationCount());
        assertEquals(7 * 503, cache.getMetrics().memoryUsage());
        assertEquals(MemoryPressureLevel.LOW, cache.getMemoryPressure().getLevel());
        assertEquals(Optional.of(text(500)), cache.get("k3"));
    }

    @Test
    void testCriticalPressureRequantizesAndEvicts() {
        newCache(CacheConfiguration.newBuilder()
                .maxMemoryMB(TEN_THOUSAND_BYTES_MB)
                .quantizationThresholdBytes(100_000)
                .build());
        for (int i = 0; i < 4; i++) {
            cache.set("k" + i, text(1200));
        }
        assertEquals(MemoryPressureLevel.CRITICAL, cache.getMemoryPressure().getLevel());

        cache.runMaintenance();

        assertEquals(3, cache.size());
        assertEquals(4, cache.getMetrics().quantizationCount());
        assertEquals(1, cache.getMetrics().evictionCount());
        assertEquals(3 * 603, cache.getMetrics().memoryUsage());
        Value.StringValue restored = (Value.StringValue) cache.get("k3").orElseThrow();
        assertEquals(1200, restored.getValue().length());
    }

    @Test
    void testSustainedInsertsRaisePressureThenOptimize() {
        newCache(CacheConfiguration.newBuilder()
                .maxMemoryMB(TEN_THOUSAND_BYTES_MB)
                .quantizationEnabled(false)
                .build());
        List<MemoryPressureLevel> levels = new ArrayList<>();
        levels.add(cache.getMemoryPressure().getLevel());
        int i = 0;
        while (cache.getMemoryPressure().getLevel() != MemoryPressureLevel.HIGH) {
            cache.set("k" + i++, text(50));
            MemoryPressureLevel level = cache.getMemoryPressure().getLevel();
            if (level != levels.get(levels.size() - 1)) {
                levels.add(level);
            }
        }
        cache.set("report", text(4000));
        levels.add(cache.getMemoryPressure().getLevel());

        assertEquals(List.of(MemoryPressureLevel.LOW, MemoryPressureLevel.MEDIUM,
                MemoryPressureLevel.HIGH, MemoryPressureLevel.CRITICAL), levels);

        long before = cache.getMetrics().memoryUsage();
        OptimizationResult result = cache.optimizeMemory();

        assertTrue(result.getEntriesEvicted() > 0);
        assertEquals(1, result.getQuantizationsApplied());
        assertTrue(cache.getMetrics().memoryUsage() < before);
    }

    @Test
    void testOptimizeMemory() {
        newCache(CacheConfiguration.defaults());
        for (int i = 0; i < 5; i++) {
            cache.set("big-" + i, text(750));
            cache.set("small-" + i, Value.of(i));
        }
        long before = cache.getMetrics().memoryUsage();
        assertEquals(0, cache.getMetrics().quantizationCount());

        OptimizationResult result = cache.optimizeMemory();

        assertEquals(5, result.getQuantizationsApplied());
        assertEquals(2, result.getEntriesEvicted());
        assertEquals(before - cache.getMetrics().memoryUsage(), result.getMemoryFreed());
        assertTrue(result.getMemoryFreed() > 0);
        assertEquals(8, cache.size());
    }

    @Test
    void testAdaptiveGrowthAfterResizeInterval() {
        newCache(CacheConfiguration.newBuilder()
                .maxSize(100)
                .adaptiveResizeBounds(10, 200)
                .build());
        cache.set("a", Value.of("1"));
        for (int i = 0; i < 10; i++) {
            cache.get("a");
        }

        cache.runMaintenance();
        assertEquals(100, cache.getMetrics().capacity());

        ticker.advance(11, TimeUnit.MINUTES);
        cache.runMaintenance();

        assertEquals(130, cache.getMetrics().capacity());
    }

    @Test
    void testAdaptiveShrinkEvictsOverflow() {
        newCache(CacheConfiguration.newBuilder()
                .maxSize(10)
                .adaptiveResizeBounds(2, 200)
                .build());
        for (int i = 0; i < 10; i++) {
            cache.set("k" + i, Value.of(i));
        }
        for (int i = 0; i < 10; i++) {
            cache.get("missing-" + i);
        }

        ticker.advance(11, TimeUnit.MINUTES);
        cache.runMaintenance();

        assertEquals(7, cache.getMetrics().capacity());
        assertEquals(7, cache.size());
        assertEquals(3, cache.getMetrics().evictionCount());
    }

    @Test
    void testResizeDisabled() {
        newCache(CacheConfiguration.newBuilder()
                .maxSize(10)
                .adaptiveResizeEnabled(false)
                .build());
        cache.get("missing");

        ticker.advance(11, TimeUnit.MINUTES);
        cache.runMaintenance();

        assertEquals(10, cache.getMetrics().capacity());
    }

    @Test
    void testLowHitRateAlert() {
        newCache(CacheConfiguration.defaults());
        cache.set("a", Value.of("1"));
        cache.get("a");
        cache.get("b");
        cache.get("c");

        cache.runMaintenance();

        assertEquals(1, cache.getAlerts().size());
        assertEquals(AlertType.LOW_HIT_RATE, cache.getAlerts().get(0).getType());
        assertEquals(1, alerts.size());
        assertEquals(1, cache.activeAlertCount());

        for (int i = 0; i < 20; i++) {
            cache.get("a");
        }
        cache.runMaintenance();

        assertTrue(cache.getAlerts().isEmpty());
        assertEquals(1, cache.getAlertHistory().size());
    }

    @Test
    void testMonitoringDisabledRaisesNoAlerts() {
        newCache(CacheConfiguration.newBuilder().monitoringEnabled(false).build());
        cache.get("missing");

        cache.runMaintenance();

        assertTrue(cache.getAlerts().isEmpty());
    }

    @Test
    void testPredictionScoring() {
        newCache(CacheConfiguration.defaults());
        assertEquals(0.5, cache.predictHit("a"));

        // untrained predictions of 0.5 fall below the confidence threshold: predicted misses
        cache.set("a", Value.of("1"));
        cache.set("b", Value.of("2"));
        cache.get("a");
        cache.delete("b");

        CacheStats stats = cache.getMetrics();
        assertEquals(0, stats.predictedHitCount());
        assertEquals(0.5, stats.predictionAccuracy());
    }

    @Test
    void testPredictorTrainsDuringMaintenance() {
        newCache(CacheConfiguration.defaults());
        cache.set("hot", Value.of("1"));
        for (int i = 0; i < 60; i++) {
            cache.get("hot");
            cache.get("cold-" + i);
            ticker.advance(1, TimeUnit.SECONDS);
        }

        cache.runMaintenance();

        double p = cache.predictHit("hot");
        assertNotEquals(0.5, p);
        assertTrue(p >= 0.0 && p <= 1.0);
    }

    @Test
    void testExportStatistics() throws Exception {
        newCache(CacheConfiguration.defaults());
        cache.set("a", Value.of("1"));
        cache.set("b", Value.of("2"));
        cache.get("b");
        cache.get("b");
        cache.get("a");
        cache.get("missing");

        JsonNode root = new ObjectMapper().readTree(cache.exportStatistics());

        assertEquals("2024-03-01T10:15:30Z", root.get("timestamp").asText());
        assertEquals(10_000, root.path("configuration").path("maxSize").asInt());
        assertEquals("INT8", root.path("configuration").path("quantization").path("type").asText());
        assertEquals(3, root.path("metrics").path("hits").asLong());
        assertEquals(4, root.path("metrics").path("totalRequests").asLong());
        assertEquals("LOW", root.path("memoryPressure").path("level").asText());
        assertEquals(2, root.get("cacheSize").asInt());
        assertEquals(10_000, root.get("capacity").asInt());
        assertEquals("b", root.path("topKeys").get(0).path("key").asText());
        assertEquals(2, root.path("topKeys").get(0).path("accessCount").asLong());
        assertTrue(root.get("alerts").isArray());
        assertEquals(0.75, root.path("performance").path("hitRate").asDouble(), 1e-9);
        assertEquals(1.0, root.path("performance").path("compressionRatio").asDouble(), 1e-9);
    }

    @Test
    void testStatisticsSnapshot() {
        newCache(CacheConfiguration.defaults());
        for (int i = 0; i < 15; i++) {
            cache.set("k" + i, Value.of(i));
        }

        StatisticsSnapshot snapshot = cache.statisticsSnapshot();

        assertEquals(15, snapshot.getCacheSize());
        assertEquals(10, snapshot.getTopKeys().size());
        assertEquals("k0", snapshot.getTopKeys().get(0).getKey());
        assertEquals(clock.instant(), snapshot.getTimestamp());
    }

    @Test
    void testUpdateConfiguration() {
        newCache(CacheConfiguration.newBuilder().maxSize(10).build());
        for (int i = 0; i < 10; i++) {
            cache.set("k" + i, Value.of(i));
        }

        cache.updateConfiguration(b -> b.maxSize(4).quantizationType(QuantizationType.FP8));

        assertEquals(4, cache.getConfiguration().getMaxSize());
        assertEquals(QuantizationType.FP8, cache.getConfiguration().getQuantization().getType());
        assertEquals(4, cache.getMetrics().capacity());
        assertEquals(4, cache.size());
        assertEquals(6, cache.getMetrics().evictionCount());
    }

    @Test
    void testInvalidUpdateKeepsConfiguration() {
        CacheConfiguration original = CacheConfiguration.newBuilder().maxSize(10).build();
        newCache(original);

        assertThrows(InvalidConfigurationException.class, () -> cache.updateConfiguration(b -> b.maxSize(0)));

        assertSame(original, cache.getConfiguration());
    }

    @Test
    void testShutdown() {
        newCache(CacheConfiguration.defaults());
        cache.set("a", Value.of("1"));

        cache.shutdown();
        cache.shutdown();

        assertFalse(cache.set("b", Value.of("2")));
        assertEquals(0, cache.size());
        assertThrows(IllegalStateException.class, () -> cache.start());
        cache.runMaintenance();
    }

    @Test
    void testStartAndCloseWithScheduler() {
        try (AdaptiveKVCache scheduled = CacheBuilder.newBuilder()
                .configuration(CacheConfiguration.newBuilder().metricsIntervalMs(50).build())
                .build()) {
            scheduled.start();
            scheduled.updateConfiguration(b -> b.metricsIntervalMs(100));
            assertTrue(scheduled.set("a", Value.of("1")));
        }
    }
}
