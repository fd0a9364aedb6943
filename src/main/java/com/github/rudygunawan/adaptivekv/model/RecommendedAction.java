package com.github.rudygunawan.adaptivekv.model;

/**
 * What the cache does about the current memory pressure.
 */
public enum RecommendedAction {
    NONE,

    /**
     * Encode large unquantized entries with the configured quantization type.
     */
    QUANTIZE,

    /**
     * Evict 30% of entries, lowest priority first.
     */
    EVICT,

    /**
     * Purge expired entries, encode large entries with INT4, then evict 30% of entries.
     */
    EMERGENCY_CLEANUP
}
