package com.priceintel.harvester.subscription;

import com.priceintel.harvester.config.HarvesterProperties;
import com.priceintel.harvester.model.Merchant;
import com.priceintel.harvester.model.MerchantTier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a merchant's feeds may be processed.
 *
 * Founding-tier merchants are exempt when configured. Otherwise a merchant is ACTIVE until
 * its subscription expires, then in GRACE_PERIOD for the configured number of days (still
 * processed), then EXPIRED. SUSPENDED and CANCELLED subscriptions are never processed.
 */
@Component
@RequiredArgsConstructor
public class SubscriptionPolicy {

    private final HarvesterProperties properties;

    public SubscriptionCheck evaluate(Merchant merchant, Instant now) {
        HarvesterProperties.Subscription settings = properties.getSubscription();

        if (merchant.getTier() == MerchantTier.FOUNDING && settings.isFoundingTierExempt()) {
            return new SubscriptionCheck(SubscriptionState.ACTIVE, true, false);
        }

        SubscriptionState state = stateOf(merchant, now, Duration.ofDays(settings.getGraceDays()));
        boolean allows = state == SubscriptionState.ACTIVE || state == SubscriptionState.GRACE_PERIOD;
        return new SubscriptionCheck(state, allows,
                state != SubscriptionState.ACTIVE && notifyDue(merchant, now, settings.getNotifyInterval()));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private static SubscriptionState stateOf(Merchant merchant, Instant now, Duration grace) {
        if (merchant.getSubscriptionStatus() == null) return SubscriptionState.EXPIRED;

        switch (merchant.getSubscriptionStatus()) {
            case SUSPENDED:
                return SubscriptionState.SUSPENDED;
            case CANCELLED:
            case EXPIRED:
                return SubscriptionState.EXPIRED;
            default:
                break;
        }

        Instant expiresAt = merchant.getSubscriptionExpiresAt();
        if (expiresAt == null || now.isBefore(expiresAt)) return SubscriptionState.ACTIVE;
        if (now.isBefore(expiresAt.plus(grace))) return SubscriptionState.GRACE_PERIOD;
        return SubscriptionState.EXPIRED;
    }

    private static boolean notifyDue(Merchant merchant, Instant now, Duration interval) {
        Instant last = merchant.getLastSubscriptionNotifyAt();
        return last == null || !last.plus(interval).isAfter(now);
    }
}
