package com.priceintel.harvester.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * A retailer's configured product/price feed.
 *
 * Feeds are never deleted by the harvester; they move between statuses.
 * nextRunAt is advanced when the scheduler claims the feed, not when the run finishes.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Feed {

    private String id;
    private String retailerId;
    private String merchantId;          // null for affiliate feeds
    private String name;
    private FeedType feedType;

    // ── Retrieval ───────────────────────────────────────────────────────────
    private TransportConfig transport;
    private FeedFormat format;
    private Integer maxRowCount;        // null → harvester default

    // ── Schedule ────────────────────────────────────────────────────────────
    private int scheduleFrequencyHours;
    private Instant nextRunAt;
    private boolean manualRunPending;
    private FeedStatus status;

    // ── Run history summary ─────────────────────────────────────────────────
    private int consecutiveFailures;
    private String lastContentHash;
    private Instant lastRunAt;
    private Instant lastSuccessAt;

    /**
     * Next run after a claim at {@code now}: one period after the previous slot, or one period
     * from now when the feed has fallen more than a period behind.
     */
    public Instant computeNextRunAt(Instant now) {
        Duration period = Duration.ofHours(Math.max(1, scheduleFrequencyHours));
        Instant base = nextRunAt != null ? nextRunAt : now;
        Instant next = base.plus(period);
        return next.isAfter(now) ? next : now.plus(period);
    }

    public boolean runsOnSchedule() {
        return status == FeedStatus.ENABLED;
    }
}
