package com.priceintel.harvester.repository;

import com.priceintel.harvester.model.Merchant;
import com.priceintel.harvester.model.MerchantRetailerRelationship;
import com.priceintel.harvester.model.RetailerEligibility;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RetailerRepository {

    Optional<RetailerEligibility> findEligibility(String retailerId);

    List<MerchantRetailerRelationship> findRelationships(String retailerId);

    Optional<Merchant> findMerchant(String merchantId);

    void markSubscriptionNotified(String merchantId, Instant at);
}
