package com.priceintel.harvester.repository.jdbc;

import com.priceintel.harvester.model.ListingStatus;
import com.priceintel.harvester.model.Merchant;
import com.priceintel.harvester.model.MerchantRetailerRelationship;
import com.priceintel.harvester.model.MerchantTier;
import com.priceintel.harvester.model.RelationshipStatus;
import com.priceintel.harvester.model.RetailerEligibility;
import com.priceintel.harvester.model.SubscriptionStatus;
import com.priceintel.harvester.repository.RetailerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.priceintel.harvester.repository.jdbc.JdbcSupport.*;

@Repository
@RequiredArgsConstructor
public class JdbcRetailerRepository implements RetailerRepository {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<RetailerEligibility> findEligibility(String retailerId) {
        return jdbcTemplate.query("SELECT eligibility FROM retailers WHERE id = ?",
                (rs, i) -> RetailerEligibility.valueOf(rs.getString("eligibility")), retailerId)
                .stream().findFirst();
    }

    @Override
    public List<MerchantRetailerRelationship> findRelationships(String retailerId) {
        return jdbcTemplate.query("SELECT * FROM merchant_retailers WHERE retailer_id = ?",
                (rs, i) -> new MerchantRetailerRelationship(
                        rs.getString("merchant_id"),
                        rs.getString("retailer_id"),
                        RelationshipStatus.valueOf(rs.getString("status")),
                        ListingStatus.valueOf(rs.getString("listing_status"))),
                retailerId);
    }

    @Override
    public Optional<Merchant> findMerchant(String merchantId) {
        return jdbcTemplate.query("SELECT * FROM merchants WHERE id = ?",
                (rs, i) -> Merchant.builder()
                        .id(rs.getString("id"))
                        .name(rs.getString("name"))
                        .tier(MerchantTier.valueOf(rs.getString("tier")))
                        .subscriptionStatus(SubscriptionStatus.valueOf(rs.getString("subscription_status")))
                        .subscriptionExpiresAt(instant(rs, "subscription_expires_at"))
                        .lastSubscriptionNotifyAt(instant(rs, "last_subscription_notify_at"))
                        .build(),
                merchantId).stream().findFirst();
    }

    @Override
    public void markSubscriptionNotified(String merchantId, Instant at) {
        jdbcTemplate.update("UPDATE merchants SET last_subscription_notify_at = ? WHERE id = ?",
                ts(at), merchantId);
    }
}
