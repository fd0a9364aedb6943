package com.github.rudygunawan.adaptivekv.listener;

import com.github.rudygunawan.adaptivekv.model.Alert;

/**
 * Receives alerts as they are raised by the maintenance tick. Called on the maintenance thread
 * (or the thread calling {@code runMaintenance()}); exceptions are logged and ignored.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AlertListener {

    void onAlert(Alert alert);
}
