package com.priceintel.harvester.model;

public record MerchantRetailerRelationship(
        String merchantId,
        String retailerId,
        RelationshipStatus status,
        ListingStatus listingStatus) {

    public boolean isActiveAndListed() {
        return status == RelationshipStatus.ACTIVE && listingStatus == ListingStatus.LISTED;
    }
}
