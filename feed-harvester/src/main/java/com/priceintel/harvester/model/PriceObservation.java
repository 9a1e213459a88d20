package com.priceintel.harvester.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable price point. Never updated after insert.
 */
@Value
@Builder
@AllArgsConstructor
public class PriceObservation {

    String id;
    String sourceProductId;
    String retailerId;
    BigDecimal price;
    BigDecimal originalPrice;
    String currency;
    boolean inStock;
    String priceSignature;

    // ── Provenance ──────────────────────────────────────────────────────────
    ProvenanceType runType;
    String runId;
    Instant observedAt;
}
