package com.github.rudygunawan.adaptivekv.metrics;

import com.github.rudygunawan.adaptivekv.config.CacheConfiguration;
import com.github.rudygunawan.adaptivekv.listener.AlertListener;
import com.github.rudygunawan.adaptivekv.model.Alert;
import com.github.rudygunawan.adaptivekv.model.AlertSeverity;
import com.github.rudygunawan.adaptivekv.model.AlertType;
import com.github.rudygunawan.adaptivekv.model.CacheStats;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Raises and resolves threshold alerts from cache statistics.
 *
 * <p>Each call to {@link #evaluate} checks every condition. A condition that holds raises an alert
 * unless an unresolved alert of the same type already exists; a condition that no longer holds
 * resolves the unresolved alerts of its type. At most {@value #MAX_HISTORY} alerts are retained,
 * oldest dropped first.
 */
public class AlertMonitor {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.adaptivekv.Alerts");

    static final int MAX_HISTORY = 100;

    private final Clock clock;
    private final Deque<Alert> history = new ArrayDeque<>();
    private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();

    private long lastQuantizationErrors;
    private long lastTrainingFailures;

    public AlertMonitor(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public void addListener(AlertListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    /**
     * Checks all alert conditions against {@code stats}.
     *
     * @param stats current statistics
     * @param thresholds the configured alert thresholds
     * @param maxMemoryBytes the memory ceiling the usage ratio is measured against
     * @return the alerts raised by this evaluation
     */
    public List<Alert> evaluate(CacheStats stats, CacheConfiguration.AlertThresholds thresholds, long maxMemoryBytes) {
        List<Alert> raised = new ArrayList<>();
        synchronized (this) {
            Set<AlertType> active = EnumSet.noneOf(AlertType.class);

            if (stats.requestCount() > 0 && stats.hitRate() < thresholds.getHitRate()) {
                active.add(AlertType.LOW_HIT_RATE);
                raise(raised, stats, AlertType.LOW_HIT_RATE, AlertSeverity.WARNING,
                        "Cache hit rate " + percent(stats.hitRate()) + " below threshold "
                                + percent(thresholds.getHitRate()));
            }

            double usage = maxMemoryBytes <= 0 ? 0.0 : (double) stats.memoryUsage() / maxMemoryBytes;
            if (usage > thresholds.getMemoryUsage()) {
                active.add(AlertType.MEMORY_PRESSURE);
                raise(raised, stats, AlertType.MEMORY_PRESSURE, AlertSeverity.ERROR,
                        "Memory usage " + percent(usage) + " exceeds threshold "
                                + percent(thresholds.getMemoryUsage()));
            }

            if (stats.evictionRate() > thresholds.getEvictionRate()) {
                active.add(AlertType.HIGH_EVICTION);
                raise(raised, stats, AlertType.HIGH_EVICTION, AlertSeverity.WARNING,
                        "Eviction rate " + percent(stats.evictionRate()) + " exceeds threshold "
                                + percent(thresholds.getEvictionRate()));
            }

            long quantizationErrors = stats.quantizationErrorCount();
            if (quantizationErrors > lastQuantizationErrors) {
                active.add(AlertType.QUANTIZATION_FAILURE);
                raise(raised, stats, AlertType.QUANTIZATION_FAILURE, AlertSeverity.WARNING,
                        (quantizationErrors - lastQuantizationErrors)
                                + " value(s) could not be quantized and were stored raw");
            }
            lastQuantizationErrors = quantizationErrors;

            long trainingFailures = stats.trainingFailureCount();
            if (trainingFailures > lastTrainingFailures) {
                active.add(AlertType.PREDICTION_ERROR);
                raise(raised, stats, AlertType.PREDICTION_ERROR, AlertSeverity.WARNING,
                        "Hit predictor training failed; previous model retained");
            }
            lastTrainingFailures = trainingFailures;

            for (Alert alert : history) {
                if (!alert.isResolved() && !active.contains(alert.getType())) {
                    alert.resolve();
                    if (LOGGER.isLoggable(Level.FINE)) {
                        LOGGER.fine("Alert resolved: " + alert.getType());
                    }
                }
            }
        }

        for (Alert alert : raised) {
            notifyListeners(alert);
        }
        return raised;
    }

    /**
     * Returns the unresolved alerts, oldest first.
     */
    public synchronized List<Alert> activeAlerts() {
        List<Alert> result = new ArrayList<>();
        for (Alert alert : history) {
            if (!alert.isResolved()) {
                result.add(alert);
            }
        }
        return result;
    }

    /**
     * Returns every retained alert, resolved or not, oldest first.
     */
    public synchronized List<Alert> history() {
        return new ArrayList<>(history);
    }

    public synchronized int activeCount() {
        int count = 0;
        for (Alert alert : history) {
            if (!alert.isResolved()) {
                count++;
            }
        }
        return count;
    }

    private void raise(List<Alert> raised, CacheStats stats, AlertType type, AlertSeverity severity, String message) {
        for (Alert alert : history) {
            if (alert.getType() == type && !alert.isResolved()) {
                return;
            }
        }
        Alert alert = new Alert(type, severity, message, clock.instant(), stats);
        history.addLast(alert);
        while (history.size() > MAX_HISTORY) {
            history.removeFirst();
        }
        raised.add(alert);
        LOGGER.warning("Cache alert [" + severity + "] " + type + ": " + message);
    }

    private void notifyListeners(Alert alert) {
        for (AlertListener listener : listeners) {
            try {
                listener.onAlert(alert);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "AlertListener threw exception for alert: " + alert.getType(), e);
            }
        }
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100);
    }
}
