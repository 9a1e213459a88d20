package com.priceintel.harvester.output;

public record WrittenProduct(String sourceProductId, boolean productChanged, boolean priceWritten) {
}
