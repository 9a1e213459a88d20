package com.priceintel.harvester.visibility;

import com.priceintel.harvester.model.ListingStatus;
import com.priceintel.harvester.model.MerchantRetailerRelationship;
import com.priceintel.harvester.model.RelationshipStatus;
import com.priceintel.harvester.model.RetailerEligibility;
import com.priceintel.harvester.support.InMemoryRetailerRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VisibilityPredicateTest {

    private static MerchantRetailerRelationship rel(RelationshipStatus status, ListingStatus listing) {
        return new MerchantRetailerRelationship("m-" + status + listing, "r-1", status, listing);
    }

    private static final MerchantRetailerRelationship ACTIVE_LISTED = rel(RelationshipStatus.ACTIVE, ListingStatus.LISTED);
    private static final MerchantRetailerRelationship ACTIVE_UNLISTED = rel(RelationshipStatus.ACTIVE, ListingStatus.UNLISTED);
    private static final MerchantRetailerRelationship SUSPENDED = rel(RelationshipStatus.SUSPENDED, ListingStatus.LISTED);

    @Nested
    @DisplayName("ELIGIBLE retailer")
    class Eligible {

        @Test
        @DisplayName("no relationships → visible")
        void noRelationships() {
            assertTrue(VisibilityPredicate.isVisible(RetailerEligibility.ELIGIBLE, List.of()));
            assertTrue(VisibilityPredicate.isVisible(RetailerEligibility.ELIGIBLE, null));
        }

        @Test
        @DisplayName("all relationships suspended → visible")
        void allSuspended() {
            assertTrue(VisibilityPredicate.isVisible(RetailerEligibility.ELIGIBLE, List.of(SUSPENDED, SUSPENDED)));
        }

        @Test
        @DisplayName("one active and listed among others → visible")
        void oneActiveListed() {
            assertTrue(VisibilityPredicate.isVisible(RetailerEligibility.ELIGIBLE,
                    List.of(ACTIVE_UNLISTED, SUSPENDED, ACTIVE_LISTED)));
        }

        @Test
        @DisplayName("active but unlisted only → hidden")
        void activeUnlisted() {
            assertFalse(VisibilityPredicate.isVisible(RetailerEligibility.ELIGIBLE, List.of(ACTIVE_UNLISTED)));
            assertFalse(VisibilityPredicate.isVisible(RetailerEligibility.ELIGIBLE, List.of(ACTIVE_UNLISTED, SUSPENDED)));
        }
    }

    @Test
    @DisplayName("INELIGIBLE or SUSPENDED retailers are hidden whatever their relationships")
    void ineligibleHidden() {
        for (RetailerEligibility eligibility : List.of(RetailerEligibility.INELIGIBLE, RetailerEligibility.SUSPENDED)) {
            assertFalse(VisibilityPredicate.isVisible(eligibility, List.of()));
            assertFalse(VisibilityPredicate.isVisible(eligibility, List.of(ACTIVE_LISTED)));
            assertFalse(VisibilityPredicate.isVisible(eligibility, List.of(SUSPENDED)));
        }
    }

    @Test
    @DisplayName("service loads inputs from storage; unknown retailers are hidden")
    void serviceUsesRepository() {
        InMemoryRetailerRepository retailers = new InMemoryRetailerRepository();
        retailers.putRetailer("r-1", RetailerEligibility.ELIGIBLE);
        retailers.addRelationship(ACTIVE_UNLISTED);
        RetailerVisibilityService service = new RetailerVisibilityService(retailers);

        assertFalse(service.isVisible("r-1"));
        assertFalse(service.isVisible("unknown"));

        retailers.addRelationship(ACTIVE_LISTED);
        assertTrue(service.isVisible("r-1"));
        Map<String, Object> description = service.describe("r-1");
        assertEquals(true, description.get("visible"));
        assertEquals(2, description.get("relationships"));
    }
}
