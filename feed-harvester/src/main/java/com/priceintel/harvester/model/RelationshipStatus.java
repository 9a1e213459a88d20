package com.priceintel.harvester.model;

public enum RelationshipStatus {
    ACTIVE, SUSPENDED
}
