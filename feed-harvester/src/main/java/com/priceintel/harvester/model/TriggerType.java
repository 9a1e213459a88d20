package com.priceintel.harvester.model;

public enum TriggerType {
    SCHEDULED, MANUAL
}
