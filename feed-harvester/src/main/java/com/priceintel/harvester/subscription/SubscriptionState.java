package com.priceintel.harvester.subscription;

public enum SubscriptionState {
    ACTIVE, GRACE_PERIOD, EXPIRED, SUSPENDED
}
