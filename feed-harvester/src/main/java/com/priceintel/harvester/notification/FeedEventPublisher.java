package com.priceintel.harvester.notification;

import com.priceintel.harvester.model.FeedEvent;

/**
 * Outbound feed notifications. Callers treat publication as best effort: an exception from
 * {@link #publish(FeedEvent)} is logged and never fails the run that raised the event.
 */
public interface FeedEventPublisher {

    void publish(FeedEvent event);
}
