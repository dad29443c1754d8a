package io.eventcore.store;

import io.eventcore.Event;

/**
 * An event together with its global position in the store's log.
 *
 * @param position store-assigned, strictly increasing across all aggregates
 * @param event    the stored event
 */
public record StoredEvent(long position, Event event) {
}
