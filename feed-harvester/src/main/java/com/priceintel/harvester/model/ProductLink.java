package com.priceintel.harvester.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolver output: the link between a source product and a canonical product.
 * canonicalProductId is null when UNMATCHED.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProductLink {

    private String sourceProductId;
    private String canonicalProductId;
    private LinkStatus status;
    private ConfidenceTier tier;
    private double confidence;

    @Builder.Default
    private List<String> matchedSignals = new ArrayList<>();

    private int candidateCount;
    private String resolverVersion;
    private Instant resolvedAt;
}
