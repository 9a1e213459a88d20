package com.priceintel.harvester.model;

public enum FeedStatus {
    ENABLED, PAUSED, DISABLED, FAILED
}
