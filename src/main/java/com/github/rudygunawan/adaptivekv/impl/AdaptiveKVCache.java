package com.github.rudygunawan.adaptivekv.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.rudygunawan.adaptivekv.api.AdaptiveCache;
import com.github.rudygunawan.adaptivekv.builder.CacheBuilder;
import com.github.rudygunawan.adaptivekv.config.CacheConfiguration;
import com.github.rudygunawan.adaptivekv.listener.AlertListener;
import com.github.rudygunawan.adaptivekv.listener.RemovalListener;
import com.github.rudygunawan.adaptivekv.metrics.AlertMonitor;
import com.github.rudygunawan.adaptivekv.metrics.CacheMetrics;
import com.github.rudygunawan.adaptivekv.model.Alert;
import com.github.rudygunawan.adaptivekv.model.CacheEntry;
import com.github.rudygunawan.adaptivekv.model.CacheStats;
import com.github.rudygunawan.adaptivekv.model.KeyAccessSummary;
import com.github.rudygunawan.adaptivekv.model.MemoryPressure;
import com.github.rudygunawan.adaptivekv.model.MemoryPressureLevel;
import com.github.rudygunawan.adaptivekv.model.OptimizationResult;
import com.github.rudygunawan.adaptivekv.model.StatisticsSnapshot;
import com.github.rudygunawan.adaptivekv.model.Value;
import com.github.rudygunawan.adaptivekv.policy.AdaptiveSizing;
import com.github.rudygunawan.adaptivekv.policy.PriorityFunction;
import com.github.rudygunawan.adaptivekv.policy.RemovalCause;
import com.github.rudygunawan.adaptivekv.prediction.HitPredictor;
import com.github.rudygunawan.adaptivekv.quantization.QuantizationEngine;
import com.github.rudygunawan.adaptivekv.quantization.QuantizationException;
import com.github.rudygunawan.adaptivekv.quantization.QuantizationType;
import com.github.rudygunawan.adaptivekv.quantization.QuantizedValue;
import com.github.rudygunawan.adaptivekv.time.Ticker;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Adaptive quantizing cache implementation with TTL, priority eviction, memory pressure
 * responses, adaptive capacity, hit prediction, threshold alerts and Micrometer metrics support.
 *
 * <p>A single {@link ReentrantLock} guards the entry table and the memory accounting. Lookups and
 * writes hold it for the duration of the operation; the maintenance tick takes it in bounded
 * chunks so that a long sweep never stalls callers for more than one chunk.
 *
 * <p>Logging: This class uses java.util.logging for error and warning messages. Users can configure
 * logging levels using standard JUL configuration. See {@link #LOGGER} for the logger name.
 */
public class AdaptiveKVCache implements AdaptiveCache, CacheMetrics {
    /**
     * Logger for cache operations. Logger name: "com.github.rudygunawan.adaptivekv.Cache"
     *
     * <p>Log levels used:
     * <ul>
     *   <li>SEVERE: Failures that lose a cached value or stop a maintenance tick</li>
     *   <li>WARNING: Errors in listeners (operations continue)</li>
     *   <li>FINE: Evictions, resizes and memory pressure responses</li>
     *   <li>FINER: Entry-level operations (set, get, delete)</li>
     * </ul>
     */
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.adaptivekv.Cache");

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    // Inserts evict while usage is at or above this share of the memory ceiling
    static final double INSERT_MEMORY_RATIO = 0.9;
    static final double PRESSURE_EVICTION_FRACTION = 0.3;
    static final double OPTIMIZE_EVICTION_FRACTION = 0.2;
    static final long CRITICAL_QUANTIZATION_MIN_BYTES = 512;
    static final int SWEEP_CHUNK_SIZE = 256;
    static final long SWEEP_LOCK_TIMEOUT_MS = 50;
    static final long RESIZE_INTERVAL_NANOS = TimeUnit.MINUTES.toNanos(10);
    static final int TOP_KEYS = 10;

    private final String name;
    private final Ticker ticker;
    private final Clock clock;
    private final RemovalListener removalListener;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry> entries = new HashMap<>();
    private long nextSequence;
    private volatile int capacity;
    private volatile CacheConfiguration configuration;

    private final QuantizationEngine quantizer = new QuantizationEngine();
    private final HitPredictor predictor;
    private final AlertMonitor alertMonitor;

    // Statistics
    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);
    private final AtomicLong evictionCount = new AtomicLong(0);
    private final AtomicLong expirationCount = new AtomicLong(0);
    private final AtomicLong quantizationCount = new AtomicLong(0);
    private final AtomicLong memoryUsage = new AtomicLong(0);
    private final AtomicLong originalBytes = new AtomicLong(0);
    private final AtomicLong predictedHits = new AtomicLong(0);
    private final AtomicLong scoredPredictions = new AtomicLong(0);
    private final AtomicLong correctPredictions = new AtomicLong(0);
    private volatile double averageAccessTimeMs;

    // Maintenance
    private final Object maintenanceMonitor = new Object();
    private final Object schedulerMonitor = new Object();
    private long lastResizeNanos;
    private ScheduledExecutorService maintenanceScheduler;
    private ScheduledFuture<?> maintenanceTask;
    private volatile boolean shutdown;

    /**
     * Creates a cache from the settings of {@code builder}. Maintenance is not scheduled until
     * {@link #start()} is called; {@link CacheBuilder#build()} does that by default.
     */
    public AdaptiveKVCache(CacheBuilder builder) {
        this.name = builder.getName();
        this.ticker = builder.getTicker();
        this.clock = builder.getClock();
        this.removalListener = builder.getRemovalListener();
        this.configuration = builder.getConfiguration();
        this.capacity = configuration.getMaxSize();
        this.predictor = new HitPredictor(configuration.getMlPrediction(), ticker, clock);
        this.alertMonitor = new AlertMonitor(clock);
        for (AlertListener listener : builder.getAlertListeners()) {
            alertMonitor.addListener(listener);
        }
        this.lastResizeNanos = ticker.read();
    }

    public String getName() {
        return name;
    }

    @Override
    public Optional<Value> get(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        long start = ticker.read();
        Value result = null;

        lock.lock();
        try {
            long now = ticker.read();
            CacheEntry entry = entries.get(key);
            if (entry != null && entry.isExpired(now)) {
                removeEntry(entry, RemovalCause.EXPIRED);
                entry = null;
            }
            if (entry != null) {
                try {
                    result = readValue(entry);
                    entry.recordAccess(now);
                    entry.setPriority(PriorityFunction.priority(entry, now));
                    scoreOnHit(entry);
                } catch (QuantizationException e) {
                    LOGGER.log(Level.SEVERE, "Dropping undecodable entry: key=" + key
                            + ", quantization=" + entry.getQuantizationType(), e);
                    removeEntry(entry, RemovalCause.EXPLICIT);
                }
            }

            if (result != null) {
                hitCount.incrementAndGet();
            } else {
                missCount.incrementAndGet();
            }
            predictor.recordAccess(key, result != null);

            double elapsedMs = (ticker.read() - start) / 1_000_000.0;
            averageAccessTimeMs = (averageAccessTimeMs + elapsedMs) / 2;
        } finally {
            lock.unlock();
        }

        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("get key=" + key + (result != null ? " hit" : " miss"));
        }
        return Optional.ofNullable(result);
    }

    @Override
    public boolean set(String key, Value value) {
        return set(key, value, 0, TimeUnit.MILLISECONDS);
    }

    @Override
    public boolean set(String key, Value value, long ttl, TimeUnit unit) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(unit, "unit cannot be null");
        if (shutdown) {
            return false;
        }

        CacheConfiguration config = configuration;
        long ttlNanos = ttl > 0 ? unit.toNanos(ttl) : TimeUnit.MILLISECONDS.toNanos(config.getDefaultTTL());
        double prediction = predictor.predict(key);

        lock.lock();
        try {
            if (shutdown) {
                return false;
            }
            long now = ticker.read();
            MemoryPressure pressure = respondToPressure(config, now);

            CacheEntry entry = new CacheEntry(key, nextSequence++, value, now, ttlNanos);
            if (shouldQuantize(config, entry.getOriginalSize(), pressure.getLevel())) {
                quantizeEntry(entry, config.getQuantization().getType());
            }

            CacheEntry existing = entries.get(key);
            if (existing != null) {
                removeEntry(existing, RemovalCause.REPLACED);
            }
            evictForInsert(config);

            entries.put(key, entry);
            memoryUsage.addAndGet(entry.getSize());
            originalBytes.addAndGet(entry.getOriginalSize());

            entry.setPriority(prediction * 100);
            if (config.getMlPrediction().isEnabled()) {
                boolean predictedHit = prediction >= config.getMlPrediction().getConfidenceThreshold();
                entry.setPredictedHit(predictedHit);
                if (predictedHit) {
                    predictedHits.incrementAndGet();
                }
            } else {
                // Nothing was predicted, so there is nothing to score
                entry.markPredictionScored();
            }

            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer("set key=" + key + ", size=" + entry.getSize() + ", originalSize="
                        + entry.getOriginalSize() + ", quantization=" + entry.getQuantizationType());
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean has(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            return entry != null && !entry.isExpired(ticker.read());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return false;
            }
            removeEntry(entry, RemovalCause.EXPLICIT);
            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer("delete key=" + key);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            for (CacheEntry entry : new ArrayList<>(entries.values())) {
                removeEntry(entry, RemovalCause.EXPLICIT);
            }
            entries.clear();
            memoryUsage.set(0);
            originalBytes.set(0);
            predictor.clearHistories();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats getMetrics() {
        long entryCount;
        long usage;
        long original;
        lock.lock();
        try {
            entryCount = entries.size();
            usage = memoryUsage.get();
            original = originalBytes.get();
        } finally {
            lock.unlock();
        }
        return CacheStats.newBuilder()
                .hits(hitCount.get())
                .misses(missCount.get())
                .evictions(evictionCount.get())
                .expirations(expirationCount.get())
                .quantizations(quantizationCount.get())
                .quantizationErrors(quantizer.errorCount())
                .occupancy(entryCount, usage, original)
                .capacity(capacity)
                .averageAccessTime(averageAccessTimeMs)
                .predictions(predictedHits.get(), scoredPredictions.get(), correctPredictions.get())
                .trainingFailures(predictor.trainingFailureCount())
                .build();
    }

    @Override
    public MemoryPressure getMemoryPressure() {
        return MemoryPressure.of(memoryUsage.get(), configuration.maxMemoryBytes());
    }

    @Override
    public List<Alert> getAlerts() {
        return alertMonitor.activeAlerts();
    }

    @Override
    public List<Alert> getAlertHistory() {
        return alertMonitor.history();
    }

    @Override
    public String exportStatistics() {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(statisticsSnapshot());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("failed to serialize cache statistics", e);
        }
    }

    @Override
    public StatisticsSnapshot statisticsSnapshot() {
        List<KeyAccessSummary> topKeys = new ArrayList<>();
        int cacheSize;
        lock.lock();
        try {
            cacheSize = entries.size();
            List<CacheEntry> byAccess = new ArrayList<>(entries.values());
            byAccess.sort(Comparator.comparingLong(CacheEntry::getAccessCount).reversed()
                    .thenComparingLong(CacheEntry::getSequence));
            for (CacheEntry entry : byAccess.subList(0, Math.min(TOP_KEYS, byAccess.size()))) {
                topKeys.add(new KeyAccessSummary(entry.getKey(), entry.getAccessCount(), entry.getSize()));
            }
        } finally {
            lock.unlock();
        }
        return new StatisticsSnapshot(clock.instant(), configuration, getMetrics(), getMemoryPressure(),
                cacheSize, topKeys, alertMonitor.history());
    }

    @Override
    public OptimizationResult optimizeMemory() {
        CacheConfiguration config = configuration;
        lock.lock();
        try {
            int entriesBefore = entries.size();
            long memoryBefore = memoryUsage.get();

            int quantized = 0;
            QuantizationType type = config.getQuantization().getType();
            if (type != QuantizationType.NONE) {
                long threshold = config.getQuantization().getThresholdBytes();
                quantized = quantizeWhere(type, e -> e.getOriginalSize() > threshold);
            }
            int evicted = evictLowest((int) Math.floor(entries.size() * OPTIMIZE_EVICTION_FRACTION),
                    RemovalCause.PRESSURE);

            OptimizationResult result = new OptimizationResult(evicted,
                    memoryBefore - memoryUsage.get(), quantized);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Memory optimization on " + entriesBefore + " entries: " + result);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public double predictHit(String key) {
        return predictor.predict(key);
    }

    @Override
    public CacheConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public void updateConfiguration(CacheConfiguration newConfiguration) {
        Objects.requireNonNull(newConfiguration, "configuration cannot be null");
        CacheConfiguration previous;
        lock.lock();
        try {
            previous = configuration;
            configuration = newConfiguration;
            if (newConfiguration.getMaxSize() != previous.getMaxSize()) {
                capacity = newConfiguration.getMaxSize();
            }
            predictor.configure(newConfiguration.getMlPrediction());
            evictOverflow();
        } finally {
            lock.unlock();
        }

        if (previous.getMonitoring().getMetricsIntervalMs() != newConfiguration.getMonitoring().getMetricsIntervalMs()) {
            synchronized (schedulerMonitor) {
                if (maintenanceTask != null) {
                    maintenanceTask.cancel(false);
                    scheduleMaintenance();
                }
            }
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Cache " + name + " configuration updated: " + newConfiguration);
        }
    }

    @Override
    public void start() {
        synchronized (schedulerMonitor) {
            if (shutdown) {
                throw new IllegalStateException("cache " + name + " has been shut down");
            }
            if (maintenanceScheduler != null) {
                return;
            }
            maintenanceScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "adaptive-kv-maintenance-" + name);
                t.setDaemon(true);
                t.setPriority(Thread.MIN_PRIORITY);
                return t;
            });
            scheduleMaintenance();
        }
    }

    private void scheduleMaintenance() {
        long interval = configuration.getMonitoring().getMetricsIntervalMs();
        maintenanceTask = maintenanceScheduler.scheduleAtFixedRate(
                this::scheduledMaintenance,
                interval,
                interval,
                TimeUnit.MILLISECONDS
        );
    }

    private void scheduledMaintenance() {
        try {
            runMaintenance();
        } catch (RuntimeException e) {
            // A scheduled task that throws is never run again
            LOGGER.log(Level.SEVERE, "Maintenance tick failed for cache " + name, e);
        }
    }

    @Override
    public void runMaintenance() {
        if (shutdown) {
            return;
        }
        synchronized (maintenanceMonitor) {
            CacheConfiguration config = configuration;

            sweepExpired();
            predictor.pruneHistories();

            lock.lock();
            try {
                long now = ticker.read();
                respondToPressure(config, now);
                if (config.getAdaptiveResize().isEnabled() && now - lastResizeNanos >= RESIZE_INTERVAL_NANOS) {
                    lastResizeNanos = now;
                    adaptCapacity(config);
                }
            } finally {
                lock.unlock();
            }

            predictor.train();

            if (config.getMonitoring().isEnabled()) {
                alertMonitor.evaluate(getMetrics(), config.getMonitoring().getAlertThresholds(),
                        config.maxMemoryBytes());
            }
        }
    }

    @Override
    public void shutdown() {
        synchronized (schedulerMonitor) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            if (maintenanceTask != null) {
                maintenanceTask.cancel(false);
            }
            if (maintenanceScheduler != null) {
                maintenanceScheduler.shutdown();
            }
        }
        clear();
        LOGGER.fine("Cache " + name + " shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    // CacheMetrics interface implementation for Micrometer integration

    @Override
    public long entryCount() {
        return size();
    }

    @Override
    public long capacity() {
        return capacity;
    }

    @Override
    public long hitCount() {
        return hitCount.get();
    }

    @Override
    public long missCount() {
        return missCount.get();
    }

    @Override
    public long evictionCount() {
        return evictionCount.get();
    }

    @Override
    public long expirationCount() {
        return expirationCount.get();
    }

    @Override
    public long quantizationCount() {
        return quantizationCount.get();
    }

    @Override
    public long quantizationErrorCount() {
        return quantizer.errorCount();
    }

    @Override
    public long memoryUsageBytes() {
        return memoryUsage.get();
    }

    @Override
    public long maxMemoryBytes() {
        return configuration.maxMemoryBytes();
    }

    @Override
    public double compressionRatio() {
        return getMetrics().compressionRatio();
    }

    @Override
    public long activeAlertCount() {
        return alertMonitor.activeCount();
    }

    @Override
    public double predictionAccuracy() {
        long scored = scoredPredictions.get();
        return scored == 0 ? 0.0 : (double) correctPredictions.get() / scored;
    }

    // Internals. Everything below expects the lock to be held unless noted.

    private boolean shouldQuantize(CacheConfiguration config, long originalSize, MemoryPressureLevel level) {
        CacheConfiguration.Quantization policy = config.getQuantization();
        if (!policy.isEnabled() || policy.getType() == QuantizationType.NONE) {
            return false;
        }
        long threshold = policy.getThresholdBytes();
        if (originalSize < threshold) {
            return false;
        }
        return level == MemoryPressureLevel.HIGH
                || level == MemoryPressureLevel.CRITICAL
                || policy.isAggressive()
                || originalSize > 2 * threshold;
    }

    /**
     * Encodes a raw entry. A result that fails, or that would not make the entry smaller, leaves
     * the entry raw.
     *
     * @return the change in accounted size, zero if the entry was left raw
     */
    private long quantizeEntry(CacheEntry entry, QuantizationType type) {
        entry.markQuantizationAttempted(type);
        QuantizedValue quantized = quantizer.quantize(entry.getRawValue(), type);
        if (!quantized.isQuantized() || quantized.size() >= entry.getSize()) {
            return 0;
        }
        quantizationCount.incrementAndGet();
        return entry.storeQuantized(quantized);
    }

    /**
     * Quantizes the stored raw entries matching {@code filter}. Entries already tried with
     * {@code type} are skipped.
     *
     * @return the number of entries quantized
     */
    private int quantizeWhere(QuantizationType type, Predicate<CacheEntry> filter) {
        int quantized = 0;
        for (CacheEntry entry : entries.values()) {
            if (!entry.isQuantized() && !entry.wasQuantizationAttempted(type) && filter.test(entry)) {
                long delta = quantizeEntry(entry, type);
                if (entry.isQuantized()) {
                    memoryUsage.addAndGet(delta);
                    quantized++;
                }
            }
        }
        return quantized;
    }

    /**
     * Classifies current usage and applies the matching response.
     *
     * @return the pressure observed before the response
     */
    private MemoryPressure respondToPressure(CacheConfiguration config, long now) {
        MemoryPressure pressure = MemoryPressure.of(memoryUsage.get(), config.maxMemoryBytes());
        CacheConfiguration.Quantization quantization = config.getQuantization();
        boolean canQuantize = quantization.isEnabled();

        switch (pressure.getLevel()) {
            case MEDIUM -> {
                if (canQuantize && quantization.getType() != QuantizationType.NONE) {
                    long threshold = quantization.getThresholdBytes();
                    int quantized = quantizeWhere(quantization.getType(), e -> e.getOriginalSize() >= threshold);
                    logPressure(pressure, "quantized " + quantized + " entries");
                }
            }
            case HIGH -> {
                int evicted = evictLowest(pressureEvictionCount(), RemovalCause.PRESSURE);
                logPressure(pressure, "evicted " + evicted + " entries");
            }
            case CRITICAL -> {
                int expired = purgeExpired(now);
                int quantized = 0;
                if (canQuantize) {
                    long minSize = Math.min(CRITICAL_QUANTIZATION_MIN_BYTES, quantization.getThresholdBytes());
                    quantized = quantizeWhere(QuantizationType.INT4, e -> e.getOriginalSize() >= minSize);
                }
                int evicted = evictLowest(pressureEvictionCount(), RemovalCause.PRESSURE);
                logPressure(pressure, "emergency cleanup: expired " + expired + ", quantized " + quantized
                        + ", evicted " + evicted + " entries");
            }
            default -> {
                // LOW: nothing to do
            }
        }
        return pressure;
    }

    private int pressureEvictionCount() {
        return (int) Math.floor(entries.size() * PRESSURE_EVICTION_FRACTION);
    }

    private void logPressure(MemoryPressure pressure, String outcome) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Memory pressure " + pressure.getLevel() + " ("
                    + String.format("%.1f%%", pressure.getUsagePercentage()) + ") in cache " + name + ": " + outcome);
        }
    }

    private void evictForInsert(CacheConfiguration config) {
        double memoryLimit = config.maxMemoryBytes() * INSERT_MEMORY_RATIO;
        while (!entries.isEmpty() && (entries.size() >= capacity || memoryUsage.get() >= memoryLimit)) {
            CacheEntry victim = null;
            for (CacheEntry candidate : entries.values()) {
                if (victim == null || PriorityFunction.EVICTION_ORDER.compare(candidate, victim) < 0) {
                    victim = candidate;
                }
            }
            removeEntry(victim, RemovalCause.SIZE);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Evicted entry due to size limit: key=" + victim.getKey()
                        + ", priority=" + victim.getPriority());
            }
        }
    }

    /**
     * Evicts up to {@code count} entries, lowest priority first.
     *
     * @return the number of entries evicted
     */
    private int evictLowest(int count, RemovalCause cause) {
        if (count <= 0 || entries.isEmpty()) {
            return 0;
        }
        List<CacheEntry> ordered = new ArrayList<>(entries.values());
        ordered.sort(PriorityFunction.EVICTION_ORDER);
        int evicted = Math.min(count, ordered.size());
        for (CacheEntry victim : ordered.subList(0, evicted)) {
            removeEntry(victim, cause);
        }
        return evicted;
    }

    private void evictOverflow() {
        int overflow = entries.size() - capacity;
        if (overflow > 0) {
            evictLowest(overflow, RemovalCause.SIZE);
        }
    }

    private int purgeExpired(long now) {
        List<CacheEntry> expired = new ArrayList<>();
        for (CacheEntry entry : entries.values()) {
            if (entry.isExpired(now)) {
                expired.add(entry);
            }
        }
        for (CacheEntry entry : expired) {
            removeEntry(entry, RemovalCause.EXPIRED);
        }
        return expired.size();
    }

    private void adaptCapacity(CacheConfiguration config) {
        long hits = hitCount.get();
        long requests = hits + missCount.get();
        if (requests == 0) {
            return;
        }
        double hitRate = (double) hits / requests;
        double usage = (double) memoryUsage.get() / config.maxMemoryBytes();
        int current = capacity;
        int resized = AdaptiveSizing.resize(current, hitRate, usage, config.getAdaptiveResize());
        if (resized == current) {
            return;
        }
        capacity = resized;
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Cache " + name + " capacity " + (resized > current ? "grown" : "shrunk")
                    + " from " + current + " to " + resized + " (hitRate="
                    + String.format("%.2f", hitRate) + ", usage=" + String.format("%.2f", usage) + ")");
        }
        evictOverflow();
    }

    /**
     * Removes expired entries in chunks, each under a bounded lock acquisition. Called without the
     * lock held; a chunk whose lock cannot be taken in time is skipped until the next tick.
     */
    private void sweepExpired() {
        List<String> keys;
        try {
            if (!lock.tryLock(SWEEP_LOCK_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                LOGGER.fine("Expiry sweep skipped: cache lock busy");
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        try {
            keys = new ArrayList<>(entries.keySet());
        } finally {
            lock.unlock();
        }

        int removed = 0;
        for (int from = 0; from < keys.size(); from += SWEEP_CHUNK_SIZE) {
            List<String> chunk = keys.subList(from, Math.min(from + SWEEP_CHUNK_SIZE, keys.size()));
            try {
                if (!lock.tryLock(SWEEP_LOCK_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    continue;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                long now = ticker.read();
                for (String key : chunk) {
                    CacheEntry entry = entries.get(key);
                    if (entry != null && entry.isExpired(now)) {
                        removeEntry(entry, RemovalCause.EXPIRED);
                        removed++;
                    }
                }
            } finally {
                lock.unlock();
            }
        }
        if (removed > 0 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Expiry sweep removed " + removed + " entries from cache " + name);
        }
    }

    private void removeEntry(CacheEntry entry, RemovalCause cause) {
        entries.remove(entry.getKey());
        memoryUsage.addAndGet(-entry.getSize());
        originalBytes.addAndGet(-entry.getOriginalSize());

        if (cause.wasEvicted()) {
            evictionCount.incrementAndGet();
        } else if (cause == RemovalCause.EXPIRED) {
            expirationCount.incrementAndGet();
        }
        if (cause != RemovalCause.REPLACED) {
            predictor.forget(entry.getKey());
        }
        scoreOnExit(entry);
        fireRemovalEvent(entry, cause);
    }

    private void scoreOnHit(CacheEntry entry) {
        if (!entry.isPredictionScored()) {
            entry.markPredictionScored();
            scoredPredictions.incrementAndGet();
            if (entry.isPredictedHit()) {
                correctPredictions.incrementAndGet();
            }
        }
    }

    private void scoreOnExit(CacheEntry entry) {
        if (!entry.isPredictionScored()) {
            entry.markPredictionScored();
            scoredPredictions.incrementAndGet();
            if (!entry.isPredictedHit()) {
                correctPredictions.incrementAndGet();
            }
        }
    }

    /**
     * Returns the entry's value, decoding it if quantized.
     *
     * @throws QuantizationException if the encoded bytes cannot be decoded
     */
    private Value readValue(CacheEntry entry) {
        return entry.isQuantized() ? quantizer.dequantize(entry.getQuantizedValue()) : entry.getRawValue();
    }

    private void fireRemovalEvent(CacheEntry entry, RemovalCause cause) {
        if (removalListener != null) {
            Value value;
            try {
                value = readValue(entry);
            } catch (QuantizationException e) {
                value = null;
            }
            try {
                removalListener.onRemoval(entry.getKey(), value, cause);
            } catch (Exception e) {
                // Log and swallow exceptions from listener
                LOGGER.log(Level.WARNING, "RemovalListener threw exception for key: " + entry.getKey()
                        + ", cause: " + cause, e);
            }
        }
    }
}
