package me.golemcore.codeshell.domain.service;

/**
 * Handle of a live pane feed. Closing it unsubscribes the pane and discards
 * its undelivered events.
 */
public interface PaneSubscription extends AutoCloseable {

    String getPaneName();

    /**
     * Events waiting for delivery to this pane.
     */
    int getBacklog();

    boolean isActive();

    @Override
    void close();
}
