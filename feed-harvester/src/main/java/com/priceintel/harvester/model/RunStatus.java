package com.priceintel.harvester.model;

public enum RunStatus {
    RUNNING, SUCCEEDED, FAILED
}
