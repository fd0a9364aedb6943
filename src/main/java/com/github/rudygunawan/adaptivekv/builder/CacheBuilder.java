package com.github.rudygunawan.adaptivekv.builder;

import com.github.rudygunawan.adaptivekv.config.CacheConfiguration;
import com.github.rudygunawan.adaptivekv.impl.AdaptiveKVCache;
import com.github.rudygunawan.adaptivekv.listener.AlertListener;
import com.github.rudygunawan.adaptivekv.listener.RemovalListener;
import com.github.rudygunawan.adaptivekv.time.Ticker;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A builder of {@link AdaptiveKVCache} instances.
 *
 * <p>Each cache is independent; build one per logical namespace. By default the cache uses
 * {@link CacheConfiguration#defaults()}, the system ticker and clock, and starts its maintenance
 * thread on {@link #build()}.
 *
 * <p>Usage example:
 * <pre>{@code
 * AdaptiveKVCache cache = CacheBuilder.newBuilder()
 *     .name("code-analysis")
 *     .configuration(CacheConfiguration.newBuilder()
 *         .maxSize(5_000)
 *         .maxMemoryMB(256)
 *         .build())
 *     .alertListener(alert -> pager.notify(alert.getMessage()))
 *     .build();
 * }</pre>
 *
 * @since 0.1.0
 */
public class CacheBuilder {
    private static final String DEFAULT_NAME = "adaptive-kv";

    private CacheConfiguration configuration = CacheConfiguration.defaults();
    private String name = DEFAULT_NAME;
    private Ticker ticker = Ticker.systemTicker();
    private Clock clock = Clock.systemDefaultZone();
    private RemovalListener removalListener;
    private final List<AlertListener> alertListeners = new ArrayList<>();
    private boolean scheduleMaintenance = true;

    private CacheBuilder() {
    }

    /**
     * Constructs a new {@code CacheBuilder} instance with default settings.
     */
    public static CacheBuilder newBuilder() {
        return new CacheBuilder();
    }

    /**
     * Sets the cache configuration. See {@link CacheConfiguration.Builder} and
     * {@link com.github.rudygunawan.adaptivekv.config.ConfigurationLoader}.
     *
     * @return this builder instance
     */
    public CacheBuilder configuration(CacheConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
        return this;
    }

    /**
     * Sets the cache name, used in log messages and the maintenance thread name.
     *
     * @return this builder instance
     * @throws IllegalArgumentException if {@code name} is blank
     */
    public CacheBuilder name(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name;
        return this;
    }

    /**
     * Specifies a nanosecond-precision time source for TTL, recency and access history. Useful
     * for testing.
     *
     * @return this builder instance
     */
    public CacheBuilder ticker(Ticker ticker) {
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        return this;
    }

    /**
     * Specifies the wall clock used for hour-of-day prediction features and alert timestamps.
     *
     * @return this builder instance
     */
    public CacheBuilder clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        return this;
    }

    /**
     * Specifies a listener notified each time an entry is removed for any reason.
     *
     * @return this builder instance
     */
    public CacheBuilder removalListener(RemovalListener listener) {
        this.removalListener = Objects.requireNonNull(listener, "listener cannot be null");
        return this;
    }

    /**
     * Adds a listener notified each time an alert is raised. May be called more than once.
     *
     * @return this builder instance
     */
    public CacheBuilder alertListener(AlertListener listener) {
        this.alertListeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
        return this;
    }

    /**
     * Whether {@link #build()} starts the background maintenance thread. When disabled, call
     * {@code start()} later, or drive maintenance with {@code runMaintenance()}.
     *
     * @return this builder instance
     */
    public CacheBuilder scheduleMaintenance(boolean scheduleMaintenance) {
        this.scheduleMaintenance = scheduleMaintenance;
        return this;
    }

    /**
     * Builds a cache with the settings of this builder.
     */
    public AdaptiveKVCache build() {
        AdaptiveKVCache cache = new AdaptiveKVCache(this);
        if (scheduleMaintenance) {
            cache.start();
        }
        return cache;
    }

    public CacheConfiguration getConfiguration() {
        return configuration;
    }

    public String getName() {
        return name;
    }

    public Ticker getTicker() {
        return ticker;
    }

    public Clock getClock() {
        return clock;
    }

    public RemovalListener getRemovalListener() {
        return removalListener;
    }

    public List<AlertListener> getAlertListeners() {
        return List.copyOf(alertListeners);
    }

    public boolean isSchedulingMaintenance() {
        return scheduleMaintenance;
    }
}
