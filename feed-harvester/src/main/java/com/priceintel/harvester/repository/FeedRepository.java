package com.priceintel.harvester.repository;

import com.priceintel.harvester.model.Feed;
import com.priceintel.harvester.model.FeedRun;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Feeds and their runs.
 */
public interface FeedRepository {

    Optional<Feed> findById(String feedId);

    /**
     * Claims up to {@code limit} ENABLED feeds that are due at {@code now} and have no manual run
     * pending, and advances each one's nextRunAt with {@link Feed#computeNextRunAt(Instant)}.
     * <p>
     * Select and advance happen in one transaction, with rows other callers hold locked skipped,
     * so concurrent callers never claim the same feed for the same slot.
     */
    List<Feed> claimDueFeeds(Instant now, int limit);

    /**
     * Claims up to {@code limit} feeds with a manual run requested, in any status. A feed already
     * claimed is skipped unless its claim was taken before {@code reclaimBefore}, which covers jobs
     * lost with the process that claimed them.
     * <p>
     * Select and mark happen in one transaction with locked rows skipped, so across scheduler
     * instances a request is claimed once.
     */
    List<Feed> claimManualRuns(Instant now, Instant reclaimBefore, int limit);

    /**
     * Flags a manual run. A request made while a claimed manual run is in flight stays pending
     * after that run completes.
     *
     * @return false when the feed does not exist
     */
    boolean requestManualRun(String feedId);

    /**
     * Releases the claim of a finished manual run and clears the request it consumed.
     * No-op when the feed holds no claim.
     */
    void completeManualRun(String feedId);

    /** Resets the failure count and records a successful run at {@code at}. */
    void recordSuccess(String feedId, String contentHash, Instant at);

    /**
     * Increments the failure count and records a failed run at {@code at}.
     *
     * @return the failure count after the increment
     */
    int recordFailure(String feedId, Instant at);

    /**
     * ENABLED → FAILED, clearing nextRunAt.
     *
     * @return false when the feed was no longer ENABLED
     */
    boolean markFailed(String feedId);

    /**
     * FAILED → ENABLED. nextRunAt is set to {@code nextRunAtIfUnset} only when it is null.
     *
     * @return false when the feed was no longer FAILED
     */
    boolean markRecovered(String feedId, Instant nextRunAtIfUnset);

    FeedRun createRun(FeedRun run);

    void updateRun(FeedRun run);

    Optional<FeedRun> findRun(String runId);

    /**
     * Deletes at most {@code batchSize} SUCCEEDED or FAILED runs finished before {@code cutoff}.
     * RUNNING runs are never deleted.
     *
     * @return number of runs deleted
     */
    int deleteTerminalRunsBefore(Instant cutoff, int batchSize);
}
