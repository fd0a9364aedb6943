package com.github.rudygunawan.adaptivekv.model;

/**
 * The outcome of an on-demand memory optimization pass.
 */
public class OptimizationResult {
    private final int entriesEvicted;
    private final long memoryFreed;
    private final int quantizationsApplied;

    public OptimizationResult(int entriesEvicted, long memoryFreed, int quantizationsApplied) {
        this.entriesEvicted = entriesEvicted;
        this.memoryFreed = memoryFreed;
        this.quantizationsApplied = quantizationsApplied;
    }

    public int getEntriesEvicted() {
        return entriesEvicted;
    }

    /**
     * Returns the drop in accounted memory, in bytes, from both quantization and eviction.
     */
    public long getMemoryFreed() {
        return memoryFreed;
    }

    public int getQuantizationsApplied() {
        return quantizationsApplied;
    }

    @Override
    public String toString() {
        return "OptimizationResult{entriesEvicted=" + entriesEvicted
                + ", memoryFreed=" + memoryFreed
                + ", quantizationsApplied=" + quantizationsApplied
                + '}';
    }
}
