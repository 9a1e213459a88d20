package com.priceintel.harvester.model;

public enum ListingStatus {
    LISTED, UNLISTED
}
