package com.priceintel.harvester.model;

public enum FeedType {
    RETAILER, AFFILIATE
}
