package com.priceintel.harvester.repository.jdbc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceintel.harvester.model.ErrorCode;
import com.priceintel.harvester.model.Feed;
import com.priceintel.harvester.model.FeedFormat;
import com.priceintel.harvester.model.FeedRun;
import com.priceintel.harvester.model.FeedStatus;
import com.priceintel.harvester.model.FeedType;
import com.priceintel.harvester.model.ParseError;
import com.priceintel.harvester.model.RunStatus;
import com.priceintel.harvester.model.TransportConfig;
import com.priceintel.harvester.model.TransportKind;
import com.priceintel.harvester.model.TriggerType;
import com.priceintel.harvester.repository.FeedRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.priceintel.harvester.repository.jdbc.JdbcSupport.*;

@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcFeedRepository implements FeedRepository {

    private static final int MAX_STORED_PARSE_ERRORS = 100;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    private Feed mapFeed(ResultSet rs, int rowNum) throws SQLException {
        return Feed.builder()
            .id(rs.getString("id"))
            .retailerId(rs.getString("retailer_id"))
            .merchantId(rs.getString("merchant_id"))
            .name(rs.getString("name"))
            .feedType(FeedType.valueOf(rs.getString("feed_type")))
            .transport(TransportConfig.builder()
                    .kind(TransportKind.valueOf(rs.getString("transport_kind")))
                    .url(rs.getString("transport_url"))
                    .host(rs.getString("transport_host"))
                    .port(nullableInt(rs, "transport_port"))
                    .path(rs.getString("transport_path"))
                    .username(rs.getString("transport_username"))
                    .password(rs.getString("transport_password"))
                    .maxFileSizeBytes(nullableLong(rs, "max_file_size_bytes"))
                    .build())
            .format(FeedFormat.valueOf(rs.getString("format")))
            .maxRowCount(nullableInt(rs, "max_row_count"))
            .scheduleFrequencyHours(rs.getInt("schedule_frequency_hours"))
            .nextRunAt(instant(rs, "next_run_at"))
            .manualRunPending(rs.getBoolean("manual_run_pending"))
            .status(FeedStatus.valueOf(rs.getString("status")))
            .consecutiveFailures(rs.getInt("consecutive_failures"))
            .lastContentHash(rs.getString("last_content_hash"))
            .lastRunAt(instant(rs, "last_run_at"))
            .lastSuccessAt(instant(rs, "last_success_at"))
            .build();
    }

    private FeedRun mapRun(ResultSet rs, int rowNum) throws SQLException {
        return FeedRun.builder()
            .id(rs.getString("id"))
            .feedId(rs.getString("feed_id"))
            .trigger(TriggerType.valueOf(rs.getString("trigger")))
            .status(RunStatus.valueOf(rs.getString("status")))
            .startedAt(instant(rs, "started_at"))
            .finishedAt(instant(rs, "finished_at"))
            .rowsRead(rs.getInt("rows_read"))
            .rowsParsed(rs.getInt("rows_parsed"))
            .rowCount(rs.getInt("row_count"))
            .pricesWritten(rs.getInt("prices_written"))
            .quarantinedCount(rs.getInt("quarantined_count"))
            .errorCount(rs.getInt("error_count"))
            .primaryErrorCode(enumOrNull(ErrorCode.class, rs.getString("primary_error_code")))
            .errorMessage(rs.getString("error_message"))
            .skippedReason(rs.getString("skipped_reason"))
            .parseErrors(new ArrayList<>(fromJson(objectMapper, rs.getString("parse_errors"),
                    new TypeReference<List<ParseError>>() {})))
            .build();
    }

    @Override
    public Optional<Feed> findById(String feedId) {
        return jdbcTemplate.query("SELECT * FROM feeds WHERE id = ?", this::mapFeed, feedId)
                .stream().findFirst();
    }

    @Override
    public List<Feed> claimDueFeeds(Instant now, int limit) {
        List<Feed> claimed = transactionTemplate.execute(tx -> {
            List<Feed> due = jdbcTemplate.query("""
                SELECT * FROM feeds
                WHERE status = 'ENABLED'
                  AND next_run_at <= ?
                  AND manual_run_pending = FALSE
                ORDER BY next_run_at
                LIMIT ?
                FOR UPDATE SKIP LOCKED
                """, this::mapFeed, ts(now), limit);

            for (Feed feed : due) {
                Instant next = feed.computeNextRunAt(now);
                jdbcTemplate.update("UPDATE feeds SET next_run_at = ? WHERE id = ?", ts(next), feed.getId());
                feed.setNextRunAt(next);
            }
            return due;
        });
        return claimed == null ? List.of() : claimed;
    }

    @Override
    public List<Feed> claimManualRuns(Instant now, Instant reclaimBefore, int limit) {
        List<Feed> claimed = transactionTemplate.execute(tx -> {
            List<Feed> requested = jdbcTemplate.query("""
                SELECT * FROM feeds
                WHERE manual_run_pending = TRUE
                  AND (manual_claimed_at IS NULL OR manual_claimed_at < ?)
                ORDER BY id
                LIMIT ?
                FOR UPDATE SKIP LOCKED
                """, this::mapFeed, ts(reclaimBefore), limit);

            for (Feed feed : requested) {
                jdbcTemplate.update("""
                    UPDATE feeds SET manual_claimed_at = ?, manual_claimed_seq = manual_request_seq
                    WHERE id = ?
                    """, ts(now), feed.getId());
            }
            return requested;
        });
        return claimed == null ? List.of() : claimed;
    }

    @Override
    public boolean requestManualRun(String feedId) {
        return jdbcTemplate.update("""
            UPDATE feeds SET manual_run_pending = TRUE, manual_request_seq = manual_request_seq + 1
            WHERE id = ?
            """, feedId) > 0;
    }

    @Override
    public void completeManualRun(String feedId) {
        jdbcTemplate.update("""
            UPDATE feeds SET
                manual_run_pending = manual_request_seq > manual_claimed_seq,
                manual_claimed_at = NULL,
                manual_claimed_seq = NULL
            WHERE id = ? AND manual_claimed_at IS NOT NULL
            """, feedId);
    }

    @Override
    public void recordSuccess(String feedId, String contentHash, Instant at) {
        jdbcTemplate.update("""
            UPDATE feeds SET
                consecutive_failures = 0, last_content_hash = ?, last_run_at = ?, last_success_at = ?
            WHERE id = ?
            """, contentHash, ts(at), ts(at), feedId);
    }

    @Override
    public int recordFailure(String feedId, Instant at) {
        List<Integer> failures = jdbcTemplate.queryForList("""
            UPDATE feeds SET consecutive_failures = consecutive_failures + 1, last_run_at = ?
            WHERE id = ?
            RETURNING consecutive_failures
            """, Integer.class, ts(at), feedId);
        return failures.isEmpty() ? 0 : failures.get(0);
    }

    @Override
    public boolean markFailed(String feedId) {
        return jdbcTemplate.update("""
            UPDATE feeds SET status = 'FAILED', next_run_at = NULL
            WHERE id = ? AND status = 'ENABLED'
            """, feedId) > 0;
    }

    @Override
    public boolean markRecovered(String feedId, Instant nextRunAtIfUnset) {
        return jdbcTemplate.update("""
            UPDATE feeds SET status = 'ENABLED', next_run_at = COALESCE(next_run_at, ?)
            WHERE id = ? AND status = 'FAILED'
            """, ts(nextRunAtIfUnset), feedId) > 0;
    }

    @Override
    public FeedRun createRun(FeedRun run) {
        jdbcTemplate.update("""
            INSERT INTO feed_runs (id, feed_id, trigger, status, started_at)
            VALUES (?, ?, ?, ?, ?)
            """,
                run.getId(), run.getFeedId(), run.getTrigger().name(), run.getStatus().name(),
                ts(run.getStartedAt()));
        return run;
    }

    @Override
    public void updateRun(FeedRun run) {
        List<ParseError> errors = run.getParseErrors();
        List<ParseError> stored = errors.size() > MAX_STORED_PARSE_ERRORS
                ? errors.subList(0, MAX_STORED_PARSE_ERRORS)
                : errors;

        jdbcTemplate.update("""
            UPDATE feed_runs SET
                status = ?, finished_at = ?, rows_read = ?, rows_parsed = ?, row_count = ?,
                prices_written = ?, quarantined_count = ?, error_count = ?, primary_error_code = ?,
                error_message = ?, skipped_reason = ?, parse_errors = CAST(? AS JSONB)
            WHERE id = ?
            """,
                run.getStatus().name(),
                ts(run.getFinishedAt()),
                run.getRowsRead(),
                run.getRowsParsed(),
                run.getRowCount(),
                run.getPricesWritten(),
                run.getQuarantinedCount(),
                run.getErrorCount(),
                name(run.getPrimaryErrorCode()),
                run.getErrorMessage(),
                run.getSkippedReason(),
                toJson(objectMapper, stored),
                run.getId());
    }

    @Override
    public Optional<FeedRun> findRun(String runId) {
        return jdbcTemplate.query("SELECT * FROM feed_runs WHERE id = ?", this::mapRun, runId)
                .stream().findFirst();
    }

    @Override
    public int deleteTerminalRunsBefore(Instant cutoff, int batchSize) {
        int deleted = jdbcTemplate.update("""
            DELETE FROM feed_runs
            WHERE id IN (
                SELECT id FROM feed_runs
                WHERE status IN ('SUCCEEDED', 'FAILED') AND finished_at < ?
                LIMIT ?
            )
            """, ts(cutoff), batchSize);
        log.debug("Pruned batch of {} runs finished before {}", deleted, cutoff);
        return deleted;
    }
}
