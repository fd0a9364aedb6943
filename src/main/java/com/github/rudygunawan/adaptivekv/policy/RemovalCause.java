package com.github.rudygunawan.adaptivekv.policy;

/**
 * The reason why a cached entry was removed.
 *
 * @since 0.1.0
 */
public enum RemovalCause {
    /**
     * The entry was removed by {@code delete}, {@code clear} or shutdown.
     */
    EXPLICIT,

    /**
     * The entry was removed because a new value was stored under the same key.
     */
    REPLACED,

    /**
     * The entry was removed because the cache reached its entry ceiling or memory ceiling, or
     * because adaptive resizing shrank the ceiling below the current size.
     */
    SIZE,

    /**
     * The entry was removed by a memory pressure response or an explicit optimization pass.
     */
    PRESSURE,

    /**
     * The entry's time-to-live elapsed.
     */
    EXPIRED;

    /**
     * Returns {@code true} if the removal counts as an eviction (SIZE or PRESSURE), rather than
     * expiry, manual removal or replacement.
     */
    public boolean wasEvicted() {
        return this == SIZE || this == PRESSURE;
    }
}
