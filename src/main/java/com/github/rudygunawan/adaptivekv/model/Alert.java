package com.github.rudygunawan.adaptivekv.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A threshold alert raised by the maintenance tick. Everything except the resolved flag is fixed
 * when the alert is raised.
 */
public class Alert {
    private final AlertType type;
    private final AlertSeverity severity;
    private final String message;
    private final Instant timestamp;
    private final CacheStats stats;
    private volatile boolean resolved;

    public Alert(AlertType type, AlertSeverity severity, String message, Instant timestamp, CacheStats stats) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.severity = Objects.requireNonNull(severity, "severity cannot be null");
        this.message = Objects.requireNonNull(message, "message cannot be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp cannot be null");
        this.stats = stats;
    }

    public AlertType getType() {
        return type;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Returns the cache statistics at the time the alert was raised.
     */
    public CacheStats getStats() {
        return stats;
    }

    public boolean isResolved() {
        return resolved;
    }

    /**
     * Marks the alert resolved once its condition has cleared.
     */
    public void resolve() {
        this.resolved = true;
    }

    @Override
    public String toString() {
        return "Alert{" + severity + ' ' + type + ": " + message
                + (resolved ? ", resolved" : "")
                + ", at " + timestamp + '}';
    }
}
