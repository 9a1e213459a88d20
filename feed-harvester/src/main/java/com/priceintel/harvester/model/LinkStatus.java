package com.priceintel.harvester.model;

public enum LinkStatus {
    MATCHED, NEEDS_REVIEW, UNMATCHED
}
