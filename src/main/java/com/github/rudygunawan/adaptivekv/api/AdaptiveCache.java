package com.github.rudygunawan.adaptivekv.api;

import com.github.rudygunawan.adaptivekv.config.CacheConfiguration;
import com.github.rudygunawan.adaptivekv.model.Alert;
import com.github.rudygunawan.adaptivekv.model.CacheStats;
import com.github.rudygunawan.adaptivekv.model.MemoryPressure;
import com.github.rudygunawan.adaptivekv.model.OptimizationResult;
import com.github.rudygunawan.adaptivekv.model.StatisticsSnapshot;
import com.github.rudygunawan.adaptivekv.model.Value;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * A bounded, memory-aware mapping from fingerprints to computed values. Entries are added with
 * {@link #set(String, Value)} and stay until they expire, are evicted, or are deleted.
 *
 * <p>The cache bounds both its entry count and its accounted memory. Large values may be stored
 * quantized, in a compact and possibly lossy encoding, so a value read back is not always equal
 * to the value stored. The entry ceiling adapts to the observed hit rate and memory pressure.
 *
 * <p>Implementations of this interface are expected to be thread-safe, and can be safely accessed
 * by multiple concurrent threads.
 *
 * @since 0.1.0
 */
public interface AdaptiveCache extends AutoCloseable {

    /**
     * Returns the value stored under {@code key}, dequantized if necessary, or empty if there is no
     * live entry. An expired entry is removed and counts as a miss.
     *
     * @param key the key whose associated value is to be returned
     * @return the value, or empty on a miss
     */
    Optional<Value> get(String key);

    /**
     * Stores {@code value} under {@code key} with the default time-to-live, replacing any existing
     * entry. Lower priority entries are evicted if the cache is full.
     *
     * @return {@code true} if stored, {@code false} if the cache has been shut down
     */
    boolean set(String key, Value value);

    /**
     * Stores {@code value} under {@code key} with the given time-to-live. A non-positive
     * {@code ttl} means the default time-to-live.
     *
     * @return {@code true} if stored, {@code false} if the cache has been shut down
     */
    boolean set(String key, Value value, long ttl, TimeUnit unit);

    /**
     * Returns {@code true} if a live entry exists for {@code key}. Does not count as a lookup and
     * does not touch the entry.
     */
    boolean has(String key);

    /**
     * Removes the entry for {@code key}.
     *
     * @return {@code true} if an entry was removed
     */
    boolean delete(String key);

    /**
     * Removes every entry. Cumulative counters are kept.
     */
    void clear();

    /**
     * Returns the number of entries, including expired entries not yet swept.
     */
    int size();

    /**
     * Returns a snapshot of the cache statistics.
     */
    CacheStats getMetrics();

    /**
     * Classifies the current memory usage. Has no side effects.
     */
    MemoryPressure getMemoryPressure();

    /**
     * Returns the unresolved alerts, oldest first.
     */
    List<Alert> getAlerts();

    /**
     * Returns every retained alert, resolved or not, oldest first.
     */
    List<Alert> getAlertHistory();

    /**
     * Returns the statistics report as pretty-printed JSON.
     */
    String exportStatistics();

    /**
     * Returns the statistics report as a typed object.
     */
    StatisticsSnapshot statisticsSnapshot();

    /**
     * Quantizes large unquantized entries and evicts the lowest priority fifth of the cache.
     */
    OptimizationResult optimizeMemory();

    /**
     * Returns the estimated probability, in [0, 1], that {@code key} will be hit.
     */
    double predictHit(String key);

    CacheConfiguration getConfiguration();

    /**
     * Replaces the configuration. On an {@link IllegalArgumentException} the previous
     * configuration stays in effect.
     */
    void updateConfiguration(CacheConfiguration configuration);

    /**
     * Applies {@code changes} to a copy of the current configuration and installs the result.
     *
     * <pre>{@code
     * cache.updateConfiguration(b -> b.quantizationType(QuantizationType.FP8).quantizationAggressive(true));
     * }</pre>
     *
     * @throws com.github.rudygunawan.adaptivekv.config.InvalidConfigurationException if the changed
     *         configuration is invalid, in which case nothing is applied
     */
    default void updateConfiguration(Consumer<CacheConfiguration.Builder> changes) {
        CacheConfiguration.Builder builder = getConfiguration().toBuilder();
        changes.accept(builder);
        updateConfiguration(builder.build());
    }

    /**
     * Starts the periodic maintenance task. Calling it again has no effect.
     */
    void start();

    /**
     * Runs one maintenance tick on the calling thread: sweep expired entries, respond to memory
     * pressure, adapt capacity, train the predictor and evaluate alerts.
     */
    void runMaintenance();

    /**
     * Stops maintenance and releases all entries. Later writes are refused. Idempotent.
     */
    void shutdown();

    /**
     * Same as {@link #shutdown()}.
     */
    @Override
    void close();
}
