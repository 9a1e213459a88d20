package com.priceintel.harvester.scheduler;

import com.priceintel.harvester.config.HarvesterProperties;
import com.priceintel.harvester.fetch.FeedFetchException;
import com.priceintel.harvester.fetch.FetchResult;
import com.priceintel.harvester.fetch.FetchRouter;
import com.priceintel.harvester.identity.IdentityEngine;
import com.priceintel.harvester.model.ErrorCode;
import com.priceintel.harvester.model.Feed;
import com.priceintel.harvester.model.FeedEvent;
import com.priceintel.harvester.model.FeedEventType;
import com.priceintel.harvester.model.FeedFormat;
import com.priceintel.harvester.model.FeedRun;
import com.priceintel.harvester.model.FeedStatus;
import com.priceintel.harvester.model.IdentityKey;
import com.priceintel.harvester.model.Merchant;
import com.priceintel.harvester.model.ParseError;
import com.priceintel.harvester.model.ParseResult;
import com.priceintel.harvester.model.ProvenanceType;
import com.priceintel.harvester.model.RunStatus;
import com.priceintel.harvester.model.SourceRecord;
import com.priceintel.harvester.model.TriggerType;
import com.priceintel.harvester.notification.FeedEventPublisher;
import com.priceintel.harvester.output.IdentifiedRecord;
import com.priceintel.harvester.output.PriceWriter;
import com.priceintel.harvester.output.WriteContext;
import com.priceintel.harvester.output.WriteResult;
import com.priceintel.harvester.parser.FeedParser;
import com.priceintel.harvester.quarantine.QuarantineService;
import com.priceintel.harvester.quarantine.ValidationResult;
import com.priceintel.harvester.queue.FeedJob;
import com.priceintel.harvester.queue.JobAttempt;
import com.priceintel.harvester.queue.ResolveJob;
import com.priceintel.harvester.queue.RetryableJobException;
import com.priceintel.harvester.queue.WorkQueue;
import com.priceintel.harvester.repository.FeedRepository;
import com.priceintel.harvester.repository.RetailerRepository;
import com.priceintel.harvester.subscription.SubscriptionCheck;
import com.priceintel.harvester.subscription.SubscriptionPolicy;
import com.priceintel.harvester.subscription.SubscriptionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Executes one feed job end to end:
 * fetch → change detection → parse → identity → validate/quarantine → write → resolve → finalize.
 *
 * A run only fails when the feed could not be retrieved. Bad rows and quarantined records are
 * counted on a successful run. Transient fetch failures are handed back to the queue for retry
 * with the same run id until the last attempt.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FeedRunProcessor {

    public static final String UNCHANGED_HASH = "UNCHANGED_HASH";

    private static final int TEST_SAMPLE_SIZE = 5;

    private final FeedRepository feedRepository;
    private final RetailerRepository retailerRepository;
    private final FetchRouter fetchRouter;
    private final FeedParser feedParser;
    private final IdentityEngine identityEngine;
    private final QuarantineService quarantineService;
    private final PriceWriter priceWriter;
    private final WorkQueue workQueue;
    private final SubscriptionPolicy subscriptionPolicy;
    private final FeedEventPublisher eventPublisher;
    private final HarvesterProperties properties;
    private final Clock clock;

    /**
     * @return the finalized run, or empty when the feed was skipped without a run
     * @throws RetryableJobException when a transient fetch failure should be retried
     */
    public Optional<FeedRun> process(FeedJob job, JobAttempt attempt) {
        Optional<Feed> found = feedRepository.findById(job.feedId());
        if (found.isEmpty()) {
            log.warn("Feed {} no longer exists; dropping job {}", job.feedId(), job.uniqueKey());
            return Optional.empty();
        }
        Feed feed = found.get();

        if (job.trigger() == TriggerType.SCHEDULED && !feed.runsOnSchedule()) {
            log.info("Skipping scheduled run of feed {}: status is {}", feed.getId(), feed.getStatus());
            return Optional.empty();
        }
        if (!subscriptionAllows(feed, job)) {
            return Optional.empty();
        }

        FeedRun run = job.runId() == null
                ? startRun(feed, job)
                : feedRepository.findRun(job.runId()).orElseGet(() -> startRun(feed, job));

        FetchResult fetched;
        try {
            fetched = fetchRouter.fetch(feed);
        } catch (FeedFetchException e) {
            if (e.isRetryable() && !attempt.isFinal()) {
                log.warn("Fetch of feed {} failed on attempt {}/{} ({}): {}", feed.getId(),
                        attempt.number(), attempt.maxAttempts(), e.getErrorCode(), e.getMessage());
                throw new RetryableJobException(job.withRunId(run.getId()), e.getMessage(), e);
            }
            log.error("Feed {} run {} failed: {} {}", feed.getId(), run.getId(), e.getErrorCode(), e.getMessage());
            failRun(feed, run, job, e.getErrorCode(), e.getMessage());
            return Optional.of(run);
        }

        try {
            processContent(feed, run, job, fetched);
        } catch (RuntimeException e) {
            log.error("Feed {} run {} failed after fetch: {}", feed.getId(), run.getId(), e.getMessage(), e);
            failRun(feed, run, job, ErrorCode.UNKNOWN_ERROR, e.getMessage());
        }
        return Optional.of(run);
    }

    /**
     * Interactive check of a feed: fetch with the short timeout and parse, writing nothing.
     */
    public Map<String, Object> testFeed(String feedId) {
        Feed feed = feedRepository.findById(feedId)
                .orElseThrow(() -> new NoSuchElementException("Feed " + feedId + " not found"));

        FetchResult fetched = fetchRouter.testFetch(feed);
        ParseResult parsed = feedParser.parse(fetched.content(), formatHint(feed, fetched), maxRows(feed));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("feedId", feedId);
        result.put("source", fetched.source());
        result.put("bytes", fetched.size());
        result.put("format", fetched.detectedFormat());
        result.put("contentHash", fetched.contentHash());
        result.put("unchanged", Objects.equals(fetched.contentHash(), feed.getLastContentHash()));
        result.put("rowsRead", parsed.rowsRead());
        result.put("rowsParsed", parsed.rowsParsed());
        result.put("errors", parsed.errors().subList(0, Math.min(20, parsed.errors().size())));
        result.put("sample", parsed.records().subList(0, Math.min(TEST_SAMPLE_SIZE, parsed.records().size())));
        return result;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void processContent(Feed feed, FeedRun run, FeedJob job, FetchResult fetched) {
        if (Objects.equals(fetched.contentHash(), feed.getLastContentHash())) {
            log.info("Feed {} content unchanged ({}); skipping writes", feed.getId(), fetched.contentHash());
            run.setSkippedReason(UNCHANGED_HASH);
            succeed(feed, run, job, fetched.contentHash());
            return;
        }

        ParseResult parsed = feedParser.parse(fetched.content(), formatHint(feed, fetched), maxRows(feed));
        List<ParseError> errors = new ArrayList<>(parsed.errors());

        // Last row wins within a file
        Map<IdentityKey, SourceRecord> byIdentity = new LinkedHashMap<>();
        for (SourceRecord record : parsed.records()) {
            try {
                byIdentity.put(identityEngine.deriveIdentity(record), record);
            } catch (IllegalArgumentException e) {
                errors.add(ParseError.row(record.getRowNumber(), ErrorCode.MISSING_REQUIRED_FIELD, e.getMessage()));
            }
        }
        int duplicates = parsed.records().size() - byIdentity.size();
        if (duplicates > 0) {
            log.debug("Feed {}: {} duplicate identities collapsed", feed.getId(), duplicates);
        }

        List<IdentifiedRecord> admitted = new ArrayList<>();
        int quarantined = 0;
        for (Map.Entry<IdentityKey, SourceRecord> entry : byIdentity.entrySet()) {
            ValidationResult validation = quarantineService.validate(entry.getValue());
            if (validation.accepted()) {
                admitted.add(new IdentifiedRecord(entry.getValue(), entry.getKey()));
            } else {
                quarantineService.quarantine(feed, run.getId(), entry.getValue(), entry.getKey(),
                        validation.blockingErrors());
                quarantined++;
            }
        }

        WriteContext context = new WriteContext(run.getId(), provenance(job.trigger()),
                feed.getRetailerId(), feed.getId(), run.getStartedAt());
        WriteResult written = priceWriter.writePrices(context, admitted);

        if (!written.changedProductIds().isEmpty()) {
            workQueue.enqueue(new ResolveJob("resolve-run-" + run.getId(), written.changedProductIds()));
        }

        run.setRowsRead(parsed.rowsRead());
        run.setRowsParsed(parsed.rowsParsed());
        run.setRowCount(written.productsWritten());
        run.setPricesWritten(written.pricesWritten());
        run.setQuarantinedCount(quarantined);
        run.setErrorCount(errors.size() + quarantined);
        run.setParseErrors(errors);
        if (!errors.isEmpty()) {
            run.setPrimaryErrorCode(errors.get(0).code());
            run.setErrorMessage(errors.get(0).message());
        }

        log.info("Feed {} run {}: {} rows read, {} parsed, {} products, {} prices, {} quarantined, {} errors",
                feed.getId(), run.getId(), parsed.rowsRead(), parsed.rowsParsed(), written.productsWritten(),
                written.pricesWritten(), quarantined, errors.size());

        succeed(feed, run, job, fetched.contentHash());
        warnOnHighQuarantineRate(feed, run);
    }

    private FeedRun startRun(Feed feed, FeedJob job) {
        FeedRun run = FeedRun.builder()
                .id(UUID.randomUUID().toString())
                .feedId(feed.getId())
                .trigger(job.trigger())
                .status(RunStatus.RUNNING)
                .startedAt(clock.instant())
                .build();
        log.info("Starting {} run {} for feed {}", job.trigger(), run.getId(), feed.getId());
        return feedRepository.createRun(run);
    }

    private void succeed(Feed feed, FeedRun run, FeedJob job, String contentHash) {
        Instant now = clock.instant();
        run.setStatus(RunStatus.SUCCEEDED);
        run.setFinishedAt(now);
        feedRepository.updateRun(run);

        int previousFailures = feed.getConsecutiveFailures();
        feedRepository.recordSuccess(feed.getId(), contentHash, now);
        feed.setLastRunAt(now);
        feed.setLastSuccessAt(now);
        feed.setLastContentHash(contentHash);
        feed.setConsecutiveFailures(0);
        if (job.trigger() == TriggerType.MANUAL) {
            feedRepository.completeManualRun(feed.getId());
        }
        if (previousFailures > 0) {
            Instant nextRunAt = now.plus(Duration.ofHours(Math.max(1, feed.getScheduleFrequencyHours())));
            if (feedRepository.markRecovered(feed.getId(), nextRunAt)) {
                feed.setStatus(FeedStatus.ENABLED);
            }
            log.info("Feed {} recovered after {} consecutive failures", feed.getId(), previousFailures);
            publish(FeedEventType.FEED_RECOVERED, feed, run, null, null, previousFailures);
        }
    }

    private void failRun(Feed feed, FeedRun run, FeedJob job, ErrorCode code, String message) {
        Instant now = clock.instant();
        run.setStatus(RunStatus.FAILED);
        run.setFinishedAt(now);
        run.setPrimaryErrorCode(code);
        run.setErrorMessage(message);
        run.setErrorCount(run.getErrorCount() + 1);
        feedRepository.updateRun(run);

        int failures = feedRepository.recordFailure(feed.getId(), now);
        feed.setConsecutiveFailures(failures);
        feed.setLastRunAt(now);
        if (job.trigger() == TriggerType.MANUAL) {
            feedRepository.completeManualRun(feed.getId());
        }
        // Only an ENABLED feed is auto-disabled; a pause or disable made during the run stands
        boolean autoDisabled = failures >= properties.getFailure().getMaxConsecutiveFailures()
                && feedRepository.markFailed(feed.getId());
        if (autoDisabled) {
            feed.setStatus(FeedStatus.FAILED);
            feed.setNextRunAt(null);
        }

        publish(FeedEventType.FEED_FAILED, feed, run, code, message, failures);
        if (autoDisabled) {
            log.warn("Feed {} disabled after {} consecutive failures", feed.getId(), failures);
            publish(FeedEventType.FEED_AUTO_DISABLED, feed, run, code, message, failures);
        }
    }

    private boolean subscriptionAllows(Feed feed, FeedJob job) {
        if (feed.getMerchantId() == null) return true;

        Optional<Merchant> merchant = retailerRepository.findMerchant(feed.getMerchantId());
        if (merchant.isEmpty()) {
            log.warn("Merchant {} of feed {} not found; processing without subscription check",
                    feed.getMerchantId(), feed.getId());
            return true;
        }

        Instant now = clock.instant();
        SubscriptionCheck check = subscriptionPolicy.evaluate(merchant.get(), now);
        if (check.allowsProcessing()) {
            if (check.state() == SubscriptionState.GRACE_PERIOD) {
                log.warn("Merchant {} is in its subscription grace period; feed {} still runs",
                        feed.getMerchantId(), feed.getId());
            }
            return true;
        }

        log.warn("Skipping feed {}: merchant {} subscription is {}", feed.getId(), feed.getMerchantId(), check.state());
        if (job.trigger() == TriggerType.MANUAL) {
            feedRepository.completeManualRun(feed.getId());
        }
        if (check.shouldNotify()) {
            publish(FeedEvent.builder()
                    .type(FeedEventType.SUBSCRIPTION_SKIP)
                    .feedId(feed.getId())
                    .feedName(feed.getName())
                    .retailerId(feed.getRetailerId())
                    .merchantId(feed.getMerchantId())
                    .errorMessage("Subscription " + check.state())
                    .lastSuccessAt(feed.getLastSuccessAt())
                    .occurredAt(now)
                    .build());
            retailerRepository.markSubscriptionNotified(feed.getMerchantId(), now);
        }
        return false;
    }

    private void warnOnHighQuarantineRate(Feed feed, FeedRun run) {
        if (run.getRowsParsed() == 0) return;
        double rate = (double) run.getQuarantinedCount() / run.getRowsParsed();
        if (rate > properties.getQuarantine().getWarningRate()) {
            log.warn("Feed {} quarantined {} of {} parsed rows", feed.getId(), run.getQuarantinedCount(), run.getRowsParsed());
            publish(FeedEventType.FEED_WARNING, feed, run, run.getPrimaryErrorCode(),
                    String.format("%d of %d rows quarantined", run.getQuarantinedCount(), run.getRowsParsed()),
                    feed.getConsecutiveFailures());
        }
    }

    private void publish(FeedEventType type, Feed feed, FeedRun run, ErrorCode code, String message, int failures) {
        publish(FeedEvent.builder()
                .type(type)
                .feedId(feed.getId())
                .feedName(feed.getName())
                .retailerId(feed.getRetailerId())
                .merchantId(feed.getMerchantId())
                .runId(run.getId())
                .errorCode(code)
                .errorMessage(message)
                .consecutiveFailures(failures)
                .lastSuccessAt(feed.getLastSuccessAt())
                .occurredAt(clock.instant())
                .build());
    }

    private void publish(FeedEvent event) {
        try {
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            log.warn("Could not publish {} for feed {}: {}", event.getType(), event.getFeedId(), e.getMessage());
        }
    }

    private int maxRows(Feed feed) {
        return feed.getMaxRowCount() != null ? feed.getMaxRowCount() : properties.getParse().getMaxRows();
    }

    private static FeedFormat formatHint(Feed feed, FetchResult fetched) {
        return feed.getFormat() == null || feed.getFormat() == FeedFormat.AUTO
                ? fetched.detectedFormat()
                : feed.getFormat();
    }

    private static ProvenanceType provenance(TriggerType trigger) {
        return trigger == TriggerType.MANUAL ? ProvenanceType.MANUAL : ProvenanceType.SCHEDULED;
    }
}
