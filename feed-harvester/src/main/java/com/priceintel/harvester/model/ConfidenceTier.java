package com.priceintel.harvester.model;

/**
 * Resolver confidence tiers, strongest first.
 */
public enum ConfidenceTier {
    HIGH(3),
    MEDIUM(2),
    LOW(1),
    NONE(0);

    private final int rank;

    ConfidenceTier(int rank) {
        this.rank = rank;
    }

    public boolean isAtLeast(ConfidenceTier other) {
        return rank >= other.rank;
    }
}
