package com.github.rudygunawan.adaptivekv.model;

/**
 * Access count and size of one key, as listed among the most accessed keys in exported statistics.
 */
public class KeyAccessSummary {
    private final String key;
    private final long accessCount;
    private final long size;

    public KeyAccessSummary(String key, long accessCount, long size) {
        this.key = key;
        this.accessCount = accessCount;
        this.size = size;
    }

    public String getKey() {
        return key;
    }

    public long getAccessCount() {
        return accessCount;
    }

    public long getSize() {
        return size;
    }
}
