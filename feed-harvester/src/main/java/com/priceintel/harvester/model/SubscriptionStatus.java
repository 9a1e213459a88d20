package com.priceintel.harvester.model;

public enum SubscriptionStatus {
    ACTIVE, EXPIRED, SUSPENDED, CANCELLED
}
