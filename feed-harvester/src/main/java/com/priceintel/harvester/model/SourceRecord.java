package com.priceintel.harvester.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single product row as read from a feed, with its normalized values.
 * The raw field map is kept verbatim for quarantine and auditing.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SourceRecord {

    private int rowNumber;

    @Builder.Default
    private Map<String, String> rawFields = new LinkedHashMap<>();

    // ── Identity candidates ─────────────────────────────────────────────────
    private String networkItemId;
    private String sku;
    private String upc;
    private String url;

    // ── Descriptive ─────────────────────────────────────────────────────────
    private String title;
    private String brand;
    private String category;
    private String imageUrl;
    private String description;

    // ── Price / stock ───────────────────────────────────────────────────────
    private String rawPrice;
    private String rawStock;
    private BigDecimal price;
    private BigDecimal originalPrice;
    private String currency;
    private boolean inStock;
}
