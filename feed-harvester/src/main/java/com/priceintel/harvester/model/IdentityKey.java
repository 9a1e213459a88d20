package com.priceintel.harvester.model;

/**
 * Stable identity of a source product within a retailer, rendered as {@code TYPE:value}.
 */
public record IdentityKey(IdentityType type, String value) {

    public String asString() {
        return type.name() + ":" + value;
    }

    @Override
    public String toString() {
        return asString();
    }
}
