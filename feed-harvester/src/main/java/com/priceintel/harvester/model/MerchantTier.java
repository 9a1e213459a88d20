package com.priceintel.harvester.model;

public enum MerchantTier {
    STANDARD, FOUNDING
}
