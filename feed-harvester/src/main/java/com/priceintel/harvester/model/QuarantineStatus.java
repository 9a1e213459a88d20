package com.priceintel.harvester.model;

public enum QuarantineStatus {
    QUARANTINED, RESOLVED, DISMISSED
}
