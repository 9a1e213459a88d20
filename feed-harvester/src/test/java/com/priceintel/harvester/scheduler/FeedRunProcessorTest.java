package com.priceintel.harvester.scheduler;

import com.priceintel.harvester.fetch.FeedFetchException;
import com.priceintel.harvester.fetch.FetchFailureKind;
import com.priceintel.harvester.identity.Hashing;
import com.priceintel.harvester.model.ErrorCode;
import com.priceintel.harvester.model.Feed;
import com.priceintel.harvester.model.FeedEventType;
import com.priceintel.harvester.model.FeedRun;
import com.priceintel.harvester.model.FeedStatus;
import com.priceintel.harvester.model.IdentityType;
import com.priceintel.harvester.model.Merchant;
import com.priceintel.harvester.model.MerchantTier;
import com.priceintel.harvester.model.PriceObservation;
import com.priceintel.harvester.model.ProvenanceType;
import com.priceintel.harvester.model.QuarantineStatus;
import com.priceintel.harvester.model.QuarantinedRecord;
import com.priceintel.harvester.model.RunStatus;
import com.priceintel.harvester.model.SourceProduct;
import com.priceintel.harvester.model.SubscriptionStatus;
import com.priceintel.harvester.quarantine.ReprocessOutcome;
import com.priceintel.harvester.queue.FeedJob;
import com.priceintel.harvester.queue.JobAttempt;
import com.priceintel.harvester.queue.ResolveJob;
import com.priceintel.harvester.queue.RetryableJobException;
import com.priceintel.harvester.repository.QuarantineFilter;
import com.priceintel.harvester.support.HarvesterFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class FeedRunProcessorTest {

    private static final String SINGLE_ROW = """
            Name,URL,Price,SKU
            Federal 9mm 115gr FMJ 50rd,https://shop.example.com/p/1,18.99,FED-9-115
            """;

    private static final String NO_IDENTIFIER = """
            Name,URL,Price
            Hornady 308 Win 168gr ELD Match 20rd,https://shop.example.com/p/2,42.50
            """;

    private static final String NO_IDENTIFIER_PLUS_ONE = NO_IDENTIFIER + """
            Winchester 223 Rem 55gr FMJ 20rd,https://shop.example.com/p/3,11.25
            """;

    private static final JobAttempt FIRST = new JobAttempt(1, 3);
    private static final JobAttempt FINAL = new JobAttempt(3, 3);

    private HarvesterFixture fx;
    private Feed feed;

    @BeforeEach
    void setUp() {
        fx = new HarvesterFixture();
        feed = fx.feed("feed-1");
    }

    private FeedRun run(FeedJob job, JobAttempt attempt) {
        return fx.processor.process(job, attempt).orElseThrow();
    }

    private FeedJob scheduledJob() {
        return FeedJob.scheduled(feed.getId(), fx.clock.instant());
    }

    // ── End-to-end runs ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("successful runs")
    class SuccessfulRuns {

        @Test
        @DisplayName("single-row CSV → one source product, one price signed from 18.99|USD")
        void singleRowFeed() {
            fx.fetcher.serve(SINGLE_ROW, "text/csv");

            FeedRun run = run(scheduledJob(), FIRST);

            assertEquals(RunStatus.SUCCEEDED, run.getStatus());
            assertEquals(1, run.getRowCount());
            assertEquals(1, run.getRowsRead());
            assertEquals(1, run.getRowsParsed());
            assertEquals(0, run.getErrorCount());

            List<SourceProduct> products = fx.prices.products();
            assertEquals(1, products.size());
            assertEquals("SKU:FED-9-115", products.get(0).getIdentityKey());
            assertEquals(run.getStartedAt(), fx.prices.presenceOf(products.get(0).getId()));

            List<PriceObservation> prices = fx.prices.prices();
            assertEquals(1, prices.size());
            assertEquals(Hashing.sha256Hex("18.99|USD"), prices.get(0).getPriceSignature());
            assertEquals(0, new BigDecimal("18.99").compareTo(prices.get(0).getPrice()));
            assertEquals(ProvenanceType.SCHEDULED, prices.get(0).getRunType());
            assertEquals(run.getId(), prices.get(0).getRunId());
        }

        @Test
        @DisplayName("new products are queued for resolution")
        void enqueuesResolution() {
            fx.fetcher.serve(SINGLE_ROW, "text/csv");

            FeedRun run = run(scheduledJob(), FIRST);

            List<ResolveJob> jobs = fx.queue.jobs(ResolveJob.class);
            assertEquals(1, jobs.size());
            assertEquals("resolve-run-" + run.getId(), jobs.get(0).uniqueKey());
            assertEquals(List.of(fx.prices.products().get(0).getId()), jobs.get(0).sourceProductIds());
        }

        @Test
        @DisplayName("unchanged content → SUCCEEDED with rowCount 0 and no writes")
        void unchangedContentSkipsWrites() {
            fx.fetcher.serve(SINGLE_ROW, "text/csv");
            run(scheduledJob(), FIRST);
            int seenBefore = fx.prices.seenCount();

            fx.clock.advance(Duration.ofHours(6));
            FeedRun second = run(scheduledJob(), FIRST);

            assertEquals(RunStatus.SUCCEEDED, second.getStatus());
            assertEquals(0, second.getRowCount());
            assertEquals(FeedRunProcessor.UNCHANGED_HASH, second.getSkippedReason());
            assertEquals(1, fx.prices.prices().size());
            assertEquals(seenBefore, fx.prices.seenCount());
            assertEquals(fx.clock.instant(), fx.feeds.get(feed.getId()).getLastSuccessAt());
        }

        @Test
        @DisplayName("duplicate identities in one file → last row wins")
        void lastRowWins() {
            fx.fetcher.serve("""
                    Name,URL,Price,SKU
                    Federal 9mm 115gr,https://shop.example.com/p/1,18.99,FED-9
                    Federal 9mm 115gr,https://shop.example.com/p/1,17.49,FED-9
                    """, "text/csv");

            FeedRun run = run(scheduledJob(), FIRST);

            assertEquals(1, run.getRowCount());
            assertEquals(1, fx.prices.prices().size());
            assertEquals(0, new BigDecimal("17.49").compareTo(fx.prices.prices().get(0).getPrice()));
        }

        @Test
        @DisplayName("malformed rows are counted but do not fail the run")
        void badRowsCounted() {
            fx.fetcher.serve("""
                    Name,URL,Price,SKU
                    Federal 9mm 115gr,https://shop.example.com/p/1,18.99,FED-9
                    Broken row,https://shop.example.com/p/3,call us,BRK-1
                    ,https://shop.example.com/p/4,9.99,NONAME
                    """, "text/csv");

            FeedRun run = run(scheduledJob(), FIRST);

            assertEquals(RunStatus.SUCCEEDED, run.getStatus());
            assertEquals(3, run.getRowsRead());
            assertEquals(1, run.getRowsParsed());
            assertEquals(2, run.getErrorCount());
            assertEquals(ErrorCode.INVALID_PRICE, run.getPrimaryErrorCode());
            assertTrue(run.getRowsParsed() <= run.getRowsRead());
        }
    }

    // ── Quarantine path ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("quarantine")
    class QuarantinePath {

        @Test
        @DisplayName("record without identifier is quarantined, run still succeeds")
        void quarantinesRecord() {
            fx.fetcher.serve(NO_IDENTIFIER, "text/csv");

            FeedRun run = run(scheduledJob(), FIRST);

            assertEquals(RunStatus.SUCCEEDED, run.getStatus());
            assertEquals(1, run.getQuarantinedCount());
            assertEquals(0, run.getRowCount());
            assertTrue(fx.prices.products().isEmpty());
            assertEquals(1, fx.quarantine.all().size());
            assertEquals(QuarantineStatus.QUARANTINED, fx.quarantine.all().get(0).getStatus());
            assertTrue(fx.events.types().contains(FeedEventType.FEED_WARNING));
        }

        @Test
        @DisplayName("missing UPC corrected → RESOLVED with one new source product")
        void correctedRecordResolves() {
            fx.fetcher.serve(NO_IDENTIFIER, "text/csv");
            run(scheduledJob(), FIRST);
            QuarantinedRecord record = fx.quarantine.all().get(0);

            fx.quarantineService.applyCorrection(record.getId(), "upc", "012345678905", "ops@example.com");
            ReprocessOutcome outcome = fx.quarantineService.reprocess(record.getId());

            assertTrue(outcome.resolved());
            assertEquals(QuarantineStatus.RESOLVED, fx.quarantine.findById(record.getId()).orElseThrow().getStatus());

            List<SourceProduct> products = fx.prices.products();
            assertEquals(1, products.size());
            assertEquals(IdentityType.RECORD_HASH, products.get(0).getIdentityType());
            assertEquals("012345678905", products.get(0).getUpc());
            assertEquals(ProvenanceType.REPROCESS, fx.prices.prices().get(0).getRunType());
        }

        @Test
        @DisplayName("a dismissed record stays DISMISSED with its note when the row comes back")
        void dismissalSticks() {
            fx.fetcher.serve(NO_IDENTIFIER, "text/csv");
            run(scheduledJob(), FIRST);
            QuarantinedRecord record = fx.quarantine.all().get(0);
            fx.quarantineService.dismiss(record.getId(), "known bad row from vendor");

            fx.clock.advance(Duration.ofHours(6));
            fx.fetcher.serve(NO_IDENTIFIER_PLUS_ONE, "text/csv");
            FeedRun rerun = run(scheduledJob(), FIRST);

            assertEquals(RunStatus.SUCCEEDED, rerun.getStatus());
            QuarantinedRecord stored = fx.quarantine.findById(record.getId()).orElseThrow();
            assertEquals(QuarantineStatus.DISMISSED, stored.getStatus());
            assertEquals("known bad row from vendor", stored.getDismissNote());
            assertEquals(2, fx.quarantine.all().size());
            assertEquals(1, fx.quarantine.countQuarantined(QuarantineFilter.all()));
        }

        @Test
        @DisplayName("a resolved record is not reopened by a later run")
        void resolutionSticks() {
            fx.fetcher.serve(NO_IDENTIFIER, "text/csv");
            run(scheduledJob(), FIRST);
            QuarantinedRecord record = fx.quarantine.all().get(0);
            fx.quarantineService.applyCorrection(record.getId(), "upc", "012345678905", "ops@example.com");
            assertTrue(fx.quarantineService.reprocess(record.getId()).resolved());

            fx.clock.advance(Duration.ofHours(6));
            fx.fetcher.serve(NO_IDENTIFIER_PLUS_ONE, "text/csv");
            run(scheduledJob(), FIRST);

            assertEquals(QuarantineStatus.RESOLVED, fx.quarantine.findById(record.getId()).orElseThrow().getStatus());
        }
    }

    // ── Failures ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("fetch failures")
    class FetchFailures {

        @Test
        @DisplayName("retryable failure before the last attempt hands the run id back to the queue")
        void retryReusesRun() {
            fx.fetcher.fail(new FeedFetchException(FetchFailureKind.CONNECTION, "connection refused"))
                    .serve(SINGLE_ROW, "text/csv");
            FeedJob job = scheduledJob();

            RetryableJobException retry = assertThrows(RetryableJobException.class, () -> fx.processor.process(job, FIRST));
            FeedJob retryJob = (FeedJob) retry.getRetryJob();
            assertNotNull(retryJob.runId());
            assertEquals(job.uniqueKey(), retryJob.uniqueKey());
            assertEquals(RunStatus.RUNNING, fx.feeds.findRun(retryJob.runId()).orElseThrow().getStatus());

            FeedRun run = run(retryJob, new JobAttempt(2, 3));

            assertEquals(retryJob.runId(), run.getId());
            assertEquals(RunStatus.SUCCEEDED, run.getStatus());
            assertEquals(1, fx.feeds.runsOf(feed.getId()).size());
        }

        @Test
        @DisplayName("failure on the final attempt fails the run and emits FEED_FAILED")
        void finalAttemptFails() {
            fx.fetcher.fail(FeedFetchException.status(503, "HTTP 503"));

            FeedRun run = run(scheduledJob(), FINAL);

            assertEquals(RunStatus.FAILED, run.getStatus());
            assertEquals(ErrorCode.HTTP_STATUS, run.getPrimaryErrorCode());
            Feed stored = fx.feeds.get(feed.getId());
            assertEquals(1, stored.getConsecutiveFailures());
            assertEquals(FeedStatus.ENABLED, stored.getStatus());
            assertEquals(List.of(FeedEventType.FEED_FAILED), fx.events.types());
        }

        @Test
        @DisplayName("non-retryable failure fails on the first attempt")
        void configErrorFailsImmediately() {
            fx.fetcher.fail(new FeedFetchException(FetchFailureKind.CONFIG, "bad credentials"));

            FeedRun run = run(scheduledJob(), FIRST);

            assertEquals(RunStatus.FAILED, run.getStatus());
            assertEquals(ErrorCode.CONFIG_ERROR, run.getPrimaryErrorCode());
        }

        @Test
        @DisplayName("three consecutive failures move the feed to FAILED and clear nextRunAt")
        void autoDisable() {
            fx.fetcher.fail(new FeedFetchException(FetchFailureKind.TIMEOUT, "timed out"));

            for (int i = 0; i < 3; i++) {
                run(scheduledJob(), FINAL);
                fx.clock.advance(Duration.ofHours(6));
            }

            Feed stored = fx.feeds.get(feed.getId());
            assertEquals(FeedStatus.FAILED, stored.getStatus());
            assertNull(stored.getNextRunAt());
            assertEquals(3, stored.getConsecutiveFailures());
            assertEquals(1, fx.events.types().stream().filter(t -> t == FeedEventType.FEED_AUTO_DISABLED).count());
            assertEquals(3, fx.events.types().stream().filter(t -> t == FeedEventType.FEED_FAILED).count());

            assertEquals(Optional.empty(), fx.processor.process(scheduledJob(), FIRST));
        }

        @Test
        @DisplayName("manual success after failures restores ENABLED and emits FEED_RECOVERED")
        void recovery() {
            Feed failed = fx.feeds.get(feed.getId());
            failed.setStatus(FeedStatus.FAILED);
            failed.setConsecutiveFailures(3);
            failed.setNextRunAt(null);
            fx.feeds.save(failed);
            fx.feeds.requestManualRun(feed.getId());
            fx.feeds.claimManualRuns(fx.clock.instant(), fx.clock.instant(), 10);
            fx.fetcher.serve(SINGLE_ROW, "text/csv");

            FeedRun run = run(FeedJob.manual(feed.getId()), FIRST);

            assertEquals(RunStatus.SUCCEEDED, run.getStatus());
            Feed stored = fx.feeds.get(feed.getId());
            assertEquals(FeedStatus.ENABLED, stored.getStatus());
            assertEquals(0, stored.getConsecutiveFailures());
            assertFalse(stored.isManualRunPending());
            assertEquals(fx.clock.instant().plus(6, ChronoUnit.HOURS), stored.getNextRunAt());
            assertTrue(fx.events.types().contains(FeedEventType.FEED_RECOVERED));
            assertEquals(ProvenanceType.MANUAL, fx.prices.prices().get(0).getRunType());
        }

        @Test
        @DisplayName("an unreachable webhook never fails the run")
        void notificationFailureIgnored() {
            fx.events.failWith(true);
            fx.fetcher.fail(new FeedFetchException(FetchFailureKind.CONNECTION, "refused"));

            FeedRun run = run(scheduledJob(), FINAL);

            assertEquals(RunStatus.FAILED, run.getStatus());
            assertEquals(1, fx.feeds.get(feed.getId()).getConsecutiveFailures());
        }
    }

    // ── Changes made while a run is in flight ───────────────────────────────

    @Nested
    @DisplayName("changes made during a run")
    class ConcurrentChanges {

        private void changeFeed(Consumer<Feed> change) {
            Feed current = fx.feeds.get(feed.getId());
            change.accept(current);
            fx.feeds.save(current);
        }

        @Test
        @DisplayName("a manual request made during a scheduled run stays pending")
        void manualRequestSurvivesScheduledRun() {
            fx.fetcher.serve(SINGLE_ROW, "text/csv").onFetch(() -> fx.feeds.requestManualRun(feed.getId()));

            FeedRun run = run(scheduledJob(), FIRST);

            assertEquals(RunStatus.SUCCEEDED, run.getStatus());
            assertTrue(fx.feeds.get(feed.getId()).isManualRunPending());
        }

        @Test
        @DisplayName("a second manual request made during a manual run is claimed again afterwards")
        void manualRequestSurvivesManualRun() {
            fx.feeds.requestManualRun(feed.getId());
            assertEquals(1, fx.feeds.claimManualRuns(fx.clock.instant(), fx.clock.instant(), 10).size());
            fx.fetcher.serve(SINGLE_ROW, "text/csv").onFetch(() -> fx.feeds.requestManualRun(feed.getId()));

            run(FeedJob.manual(feed.getId()), FIRST);

            assertTrue(fx.feeds.get(feed.getId()).isManualRunPending());
            assertEquals(1, fx.feeds.claimManualRuns(fx.clock.instant(), fx.clock.instant(), 10).size());
        }

        @Test
        @DisplayName("a feed paused during its third failing run stays PAUSED and keeps nextRunAt")
        void pauseNotOverwrittenByAutoDisable() {
            changeFeed(f -> f.setConsecutiveFailures(2));
            Instant scheduled = fx.feeds.get(feed.getId()).getNextRunAt();
            fx.fetcher.fail(new FeedFetchException(FetchFailureKind.TIMEOUT, "timed out"))
                    .onFetch(() -> changeFeed(f -> f.setStatus(FeedStatus.PAUSED)));

            FeedRun run = run(scheduledJob(), FINAL);

            assertEquals(RunStatus.FAILED, run.getStatus());
            Feed stored = fx.feeds.get(feed.getId());
            assertEquals(FeedStatus.PAUSED, stored.getStatus());
            assertEquals(scheduled, stored.getNextRunAt());
            assertEquals(3, stored.getConsecutiveFailures());
            assertFalse(fx.events.types().contains(FeedEventType.FEED_AUTO_DISABLED));
        }

        @Test
        @DisplayName("a feed disabled during a recovering run is not re-enabled")
        void disableNotOverwrittenByRecovery() {
            changeFeed(f -> {
                f.setStatus(FeedStatus.FAILED);
                f.setConsecutiveFailures(3);
                f.setNextRunAt(null);
            });
            fx.fetcher.serve(SINGLE_ROW, "text/csv")
                    .onFetch(() -> changeFeed(f -> f.setStatus(FeedStatus.DISABLED)));

            FeedRun run = run(FeedJob.manual(feed.getId()), FIRST);

            assertEquals(RunStatus.SUCCEEDED, run.getStatus());
            Feed stored = fx.feeds.get(feed.getId());
            assertEquals(FeedStatus.DISABLED, stored.getStatus());
            assertNull(stored.getNextRunAt());
            assertEquals(0, stored.getConsecutiveFailures());
        }

        @Test
        @DisplayName("nextRunAt moved during a run is not rewritten from the run's snapshot")
        void rescheduleSurvivesRun() {
            Instant rescheduled = fx.clock.instant().plus(Duration.ofDays(2));
            fx.fetcher.serve(SINGLE_ROW, "text/csv")
                    .onFetch(() -> changeFeed(f -> f.setNextRunAt(rescheduled)));

            run(scheduledJob(), FIRST);

            Feed stored = fx.feeds.get(feed.getId());
            assertEquals(rescheduled, stored.getNextRunAt());
            assertEquals(fx.clock.instant(), stored.getLastSuccessAt());
        }
    }

    // ── Eligibility ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("eligibility")
    class Eligibility {

        @Test
        @DisplayName("paused feeds skip scheduled jobs but run manual ones")
        void pausedFeed() {
            Feed paused = fx.feeds.get(feed.getId());
            paused.setStatus(FeedStatus.PAUSED);
            fx.feeds.save(paused);
            fx.fetcher.serve(SINGLE_ROW, "text/csv");

            assertTrue(fx.processor.process(scheduledJob(), FIRST).isEmpty());
            assertEquals(0, fx.fetcher.calls());

            FeedRun run = run(FeedJob.manual(feed.getId()), FIRST);
            assertEquals(RunStatus.SUCCEEDED, run.getStatus());
            assertEquals(FeedStatus.PAUSED, fx.feeds.get(feed.getId()).getStatus());
        }

        @Test
        @DisplayName("expired subscription skips the feed and notifies once per interval")
        void expiredSubscription() {
            fx.retailers.putMerchant(Merchant.builder()
                    .id("m-1")
                    .tier(MerchantTier.STANDARD)
                    .subscriptionStatus(SubscriptionStatus.ACTIVE)
                    .subscriptionExpiresAt(fx.clock.instant().minus(Duration.ofDays(30)))
                    .build());
            Feed merchantFeed = fx.feeds.get(feed.getId());
            merchantFeed.setMerchantId("m-1");
            fx.feeds.save(merchantFeed);

            assertTrue(fx.processor.process(scheduledJob(), FIRST).isEmpty());
            assertTrue(fx.processor.process(scheduledJob(), FIRST).isEmpty());

            assertEquals(List.of(FeedEventType.SUBSCRIPTION_SKIP), fx.events.types());
            assertEquals(fx.clock.instant(), fx.retailers.merchant("m-1").getLastSubscriptionNotifyAt());
            assertTrue(fx.feeds.runsOf(feed.getId()).isEmpty());
            assertEquals(0, fx.fetcher.calls());
        }

        @Test
        @DisplayName("jobs for deleted feeds are dropped")
        void missingFeed() {
            assertTrue(fx.processor.process(FeedJob.manual("nope"), FIRST).isEmpty());
        }
    }
}
