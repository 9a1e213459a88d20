package com.priceintel.harvester.model;

public record BlockingError(BlockingErrorCode code, String message) {
}
