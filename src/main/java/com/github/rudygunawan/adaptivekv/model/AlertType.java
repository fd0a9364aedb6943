package com.github.rudygunawan.adaptivekv.model;

/**
 * The condition an {@link Alert} reports.
 */
public enum AlertType {
    MEMORY_PRESSURE,
    LOW_HIT_RATE,
    HIGH_EVICTION,
    QUANTIZATION_FAILURE,
    PREDICTION_ERROR
}
