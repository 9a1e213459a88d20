package com.priceintel.harvester.model;

public enum FeedEventType {
    FEED_FAILED, FEED_AUTO_DISABLED, FEED_RECOVERED, FEED_WARNING, SUBSCRIPTION_SKIP
}
