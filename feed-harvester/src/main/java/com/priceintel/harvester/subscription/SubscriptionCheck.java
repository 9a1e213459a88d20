package com.priceintel.harvester.subscription;

/**
 * Outcome of a subscription evaluation for one merchant at one instant.
 *
 * @param shouldNotify true when the merchant is not ACTIVE and has not been notified within
 *                     the notification interval
 */
public record SubscriptionCheck(SubscriptionState state, boolean allowsProcessing, boolean shouldNotify) {
}
