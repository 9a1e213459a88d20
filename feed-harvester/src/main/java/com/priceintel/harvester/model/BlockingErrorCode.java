package com.priceintel.harvester.model;

/**
 * Closed set of reasons a record is held in quarantine.
 */
public enum BlockingErrorCode {
    MISSING_IDENTIFIER,
    INVALID_UPC,
    MISSING_TITLE,
    MISSING_PRICE,
    INVALID_PRICE
}
