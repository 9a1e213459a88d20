package com.priceintel.harvester.model;

public enum RetailerEligibility {
    ELIGIBLE, INELIGIBLE, SUSPENDED
}
