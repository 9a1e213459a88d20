package com.priceintel.harvester.output;

import com.priceintel.harvester.model.ProvenanceType;

import java.time.Instant;

/**
 * Provenance stamped on everything one write pass produces. seenAt is the run's start time.
 */
public record WriteContext(String runId, ProvenanceType runType, String retailerId, String feedId, Instant seenAt) {
}
