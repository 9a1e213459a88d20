package com.priceintel.harvester.resolver;

/**
 * Matching attributes pulled from a product. Any field may be null when not determinable.
 */
public record ProductAttributes(String brand, String caliber, Integer grainWeight, Integer roundCount) {
}
