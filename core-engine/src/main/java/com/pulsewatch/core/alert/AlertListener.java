package com.pulsewatch.core.alert;

import com.pulsewatch.core.model.AlertEvent;

/**
 * Receives firing events for external delivery (message bus, webhook, ...).
 *
 * <p>
 * Called on the evaluating thread. Exceptions are logged by the
 * {@link AlertManager} and do not affect other listeners.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertListener {

    void onAlert(AlertEvent event);
}
