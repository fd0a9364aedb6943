package com.github.rudygunawan.adaptivekv.time;

/**
 * A time source that returns the current time in nanoseconds.
 *
 * <p>All durations inside the cache (TTL, recency, access history, maintenance cadence) are
 * measured with a {@code Ticker}, so tests can drive them with a fake ticker instead of sleeping.
 *
 * <p><b>Testing Usage:</b>
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 *
 * AdaptiveCache cache = CacheBuilder.newBuilder()
 *     .ticker(ticker)
 *     .build();
 *
 * cache.set("fingerprint", Value.of("result"), 10, TimeUnit.MINUTES);
 * ticker.advance(11, TimeUnit.MINUTES);
 * assertTrue(cache.get("fingerprint").isEmpty());
 * }</pre>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the number of nanoseconds elapsed since some fixed but arbitrary point in time.
     * Values must never go backwards.
     */
    long read();

    /**
     * Returns a ticker that reads the current time using {@link System#nanoTime()}.
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    /**
     * Default system ticker implementation using System.nanoTime().
     */
    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}
