package com.priceintel.harvester.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The paying account behind a retailer feed. Only subscription state is tracked here.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Merchant {

    private String id;
    private String name;
    private MerchantTier tier;
    private SubscriptionStatus subscriptionStatus;
    private Instant subscriptionExpiresAt;
    private Instant lastSubscriptionNotifyAt;
}
