package com.priceintel.harvester.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A retailer's product as identified by the identity engine. Unique per (retailerId, identityKey).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SourceProduct {

    private String id;
    private String retailerId;
    private String feedId;
    private String identityKey;
    private IdentityType identityType;

    private String title;
    private String url;
    private String brand;
    private String upc;
    private String sku;
    private String networkItemId;

    private Instant lastSeenAt;
    private Instant createdAt;
    private Instant updatedAt;
}
