package com.priceintel.harvester.visibility;

import com.priceintel.harvester.model.MerchantRetailerRelationship;
import com.priceintel.harvester.model.RelationshipStatus;
import com.priceintel.harvester.model.RetailerEligibility;

import java.util.Collection;

/**
 * Decides whether a retailer's prices may be shown to consumers.
 *
 * A retailer is visible when it is ELIGIBLE and either:
 * <ul>
 *   <li>it has no merchant relationships (crawl-only retailer),</li>
 *   <li>every relationship is SUSPENDED (relationship paused, retailer keeps its listing), or</li>
 *   <li>at least one relationship is ACTIVE and LISTED.</li>
 * </ul>
 * Every read path that serves prices must apply the same predicate.
 */
public final class VisibilityPredicate {

    private VisibilityPredicate() {
    }

    public static boolean isVisible(RetailerEligibility eligibility,
                                    Collection<MerchantRetailerRelationship> relationships) {
        if (eligibility != RetailerEligibility.ELIGIBLE) return false;
        if (relationships == null || relationships.isEmpty()) return true;

        boolean allSuspended = relationships.stream()
                .allMatch(r -> r.status() == RelationshipStatus.SUSPENDED);
        if (allSuspended) return true;

        return relationships.stream().anyMatch(MerchantRetailerRelationship::isActiveAndListed);
    }
}
