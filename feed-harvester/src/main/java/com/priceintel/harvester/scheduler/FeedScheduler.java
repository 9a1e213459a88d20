package com.priceintel.harvester.scheduler;

import com.priceintel.harvester.config.HarvesterProperties;
import com.priceintel.harvester.model.Feed;
import com.priceintel.harvester.queue.FeedJob;
import com.priceintel.harvester.queue.WorkQueue;
import com.priceintel.harvester.repository.FeedRepository;
import com.priceintel.harvester.repository.jdbc.JdbcSchemaInitializer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Turns due feeds and pending manual requests into queued jobs, and prunes old runs.
 *
 * Default cadence: claim and drain every minute; prune daily at 03:15 UTC.
 * Override with harvester.scheduling.tick-interval-ms and harvester.scheduling.prune-cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FeedScheduler {

    private final FeedRepository feedRepository;
    private final WorkQueue workQueue;
    private final JdbcSchemaInitializer schemaInitializer;
    private final HarvesterProperties properties;
    private final Clock clock;

    @PostConstruct
    public void onStartup() {
        try {
            schemaInitializer.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise database schema: {}", e.getMessage());
        }
        log.info("Feed scheduler ready. Claiming due feeds every {} ms",
                properties.getScheduling().getTickIntervalMs());
    }

    @Scheduled(fixedDelayString = "${harvester.scheduling.tick-interval-ms:60000}")
    public void scheduledTick() {
        try {
            tick();
            drainManualRuns();
        } catch (Exception e) {
            log.error("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${harvester.scheduling.prune-cron:0 15 3 * * *}", zone = "UTC")
    public void scheduledPrune() {
        try {
            pruneRuns(Duration.ofDays(properties.getScheduling().getRunRetentionDays()));
        } catch (Exception e) {
            log.error("Run pruning failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Claims due feeds and enqueues one scheduled job each. The claim already advanced each
     * feed's nextRunAt, so a feed whose enqueue fails runs at its next slot.
     *
     * @return number of jobs enqueued
     */
    public int tick() {
        Instant now = clock.instant();
        List<Feed> claimed = feedRepository.claimDueFeeds(now, properties.getScheduling().getClaimBatchSize());

        int enqueued = 0;
        for (Feed feed : claimed) {
            try {
                if (workQueue.enqueue(FeedJob.scheduled(feed.getId(), now))) {
                    enqueued++;
                }
            } catch (RuntimeException e) {
                log.error("Could not enqueue scheduled run for feed {}: {}", feed.getId(), e.getMessage());
            }
        }
        if (!claimed.isEmpty()) {
            log.info("Tick claimed {} due feeds, enqueued {}", claimed.size(), enqueued);
        }
        return enqueued;
    }

    /**
     * Claims manual runs requested by operators, in any feed status, and enqueues them. A claim
     * older than the manual claim timeout is taken again, since its job may have been lost with
     * the instance that held it.
     *
     * @return number of jobs enqueued
     */
    public int drainManualRuns() {
        Instant now = clock.instant();
        Instant reclaimBefore = now.minus(properties.getScheduling().getManualClaimTimeout());
        List<Feed> pending = feedRepository.claimManualRuns(now, reclaimBefore,
                properties.getScheduling().getManualDrainBatchSize());

        int enqueued = 0;
        for (Feed feed : pending) {
            if (workQueue.hasPending(FeedJob.manualKey(feed.getId()))) {
                log.debug("Manual run for feed {} already queued", feed.getId());
                continue;
            }
            try {
                if (workQueue.enqueue(FeedJob.manual(feed.getId()))) {
                    enqueued++;
                }
            } catch (RuntimeException e) {
                log.error("Could not enqueue manual run for feed {}: {}", feed.getId(), e.getMessage());
            }
        }
        if (enqueued > 0) {
            log.info("Enqueued {} manual runs", enqueued);
        }
        return enqueued;
    }

    /**
     * Deletes finished runs older than {@code retention}, batch by batch until a short batch.
     *
     * @return number of runs deleted
     */
    public int pruneRuns(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int batchSize = properties.getScheduling().getPruneBatchSize();

        int total = 0;
        int deleted;
        do {
            deleted = feedRepository.deleteTerminalRunsBefore(cutoff, batchSize);
            total += deleted;
            log.debug("Pruned batch of {} runs", deleted);
        } while (deleted >= batchSize);

        log.info("Pruned {} runs finished before {}", total, cutoff);
        return total;
    }
}
