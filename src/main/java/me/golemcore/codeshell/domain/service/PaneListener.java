package me.golemcore.codeshell.domain.service;

import me.golemcore.codeshell.domain.model.StreamEvent;

/**
 * Receives stream events for one pane. Calls for a given subscription never
 * overlap and arrive in publish order.
 */
@FunctionalInterface
public interface PaneListener {

    void onEvent(StreamEvent event);
}
