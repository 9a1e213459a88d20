package com.priceintel.harvester.subscription;

import com.priceintel.harvester.config.HarvesterProperties;
import com.priceintel.harvester.model.Merchant;
import com.priceintel.harvester.model.MerchantTier;
import com.priceintel.harvester.model.SubscriptionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionPolicyTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private HarvesterProperties properties;
    private SubscriptionPolicy policy;

    @BeforeEach
    void setUp() {
        properties = new HarvesterProperties();
        policy = new SubscriptionPolicy(properties);
    }

    private static Merchant merchant(MerchantTier tier, SubscriptionStatus status, Instant expiresAt) {
        return Merchant.builder().id("m-1").tier(tier).subscriptionStatus(status).subscriptionExpiresAt(expiresAt).build();
    }

    @Test
    @DisplayName("unexpired subscription → ACTIVE, no notification")
    void active() {
        SubscriptionCheck check = policy.evaluate(
                merchant(MerchantTier.STANDARD, SubscriptionStatus.ACTIVE, NOW.plus(Duration.ofDays(10))), NOW);

        assertEquals(SubscriptionState.ACTIVE, check.state());
        assertTrue(check.allowsProcessing());
        assertFalse(check.shouldNotify());
    }

    @Test
    @DisplayName("within the grace window → GRACE_PERIOD, still processed, notified")
    void grace() {
        SubscriptionCheck check = policy.evaluate(
                merchant(MerchantTier.STANDARD, SubscriptionStatus.ACTIVE, NOW.minus(Duration.ofDays(3))), NOW);

        assertEquals(SubscriptionState.GRACE_PERIOD, check.state());
        assertTrue(check.allowsProcessing());
        assertTrue(check.shouldNotify());
    }

    @Test
    @DisplayName("past the grace window → EXPIRED, not processed")
    void expired() {
        SubscriptionCheck check = policy.evaluate(
                merchant(MerchantTier.STANDARD, SubscriptionStatus.ACTIVE, NOW.minus(Duration.ofDays(8))), NOW);

        assertEquals(SubscriptionState.EXPIRED, check.state());
        assertFalse(check.allowsProcessing());
    }

    @Test
    @DisplayName("suspended and cancelled subscriptions are never processed")
    void suspendedAndCancelled() {
        assertEquals(SubscriptionState.SUSPENDED,
                policy.evaluate(merchant(MerchantTier.STANDARD, SubscriptionStatus.SUSPENDED, null), NOW).state());
        assertFalse(policy.evaluate(merchant(MerchantTier.STANDARD, SubscriptionStatus.CANCELLED, null), NOW).allowsProcessing());
    }

    @Test
    @DisplayName("founding tier is exempt unless the exemption is switched off")
    void foundingTier() {
        Merchant founding = merchant(MerchantTier.FOUNDING, SubscriptionStatus.EXPIRED, NOW.minus(Duration.ofDays(90)));
        assertTrue(policy.evaluate(founding, NOW).allowsProcessing());

        properties.getSubscription().setFoundingTierExempt(false);
        assertFalse(policy.evaluate(founding, NOW).allowsProcessing());
    }

    @Test
    @DisplayName("notification is rate-limited by the notify interval")
    void notifyInterval() {
        Merchant merchant = merchant(MerchantTier.STANDARD, SubscriptionStatus.EXPIRED, null);
        merchant.setLastSubscriptionNotifyAt(NOW.minus(Duration.ofHours(2)));
        assertFalse(policy.evaluate(merchant, NOW).shouldNotify());

        merchant.setLastSubscriptionNotifyAt(NOW.minus(Duration.ofHours(24)));
        assertTrue(policy.evaluate(merchant, NOW).shouldNotify());
    }
}
