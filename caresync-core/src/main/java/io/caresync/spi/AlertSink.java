package io.caresync.spi;

import io.caresync.model.AlertEvent;

/**
 * Outbound notifier for freed-slot alerts. Delivery is fire-and-forget: the watcher
 * has already recorded the alert when {@link #deliver} is called and does not retry it.
 */
@FunctionalInterface
public interface AlertSink {

    void deliver(AlertEvent alert);
}
