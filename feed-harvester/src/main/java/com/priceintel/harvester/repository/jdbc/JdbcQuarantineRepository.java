package com.priceintel.harvester.repository.jdbc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceintel.harvester.model.BlockingError;
import com.priceintel.harvester.model.FeedCorrection;
import com.priceintel.harvester.model.FeedType;
import com.priceintel.harvester.model.QuarantineStatus;
import com.priceintel.harvester.model.QuarantinedRecord;
import com.priceintel.harvester.repository.QuarantineFilter;
import com.priceintel.harvester.repository.QuarantineRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.priceintel.harvester.repository.jdbc.JdbcSupport.*;

@Repository
@RequiredArgsConstructor
public class JdbcQuarantineRepository implements QuarantineRepository {

    private static final TypeReference<LinkedHashMap<String, String>> FIELD_MAP = new TypeReference<>() {};
    private static final TypeReference<List<BlockingError>> ERROR_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private QuarantinedRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        return QuarantinedRecord.builder()
            .id(rs.getString("id"))
            .feedId(rs.getString("feed_id"))
            .retailerId(rs.getString("retailer_id"))
            .runId(rs.getString("run_id"))
            .feedType(FeedType.valueOf(rs.getString("feed_type")))
            .matchKey(rs.getString("match_key"))
            .rowNumber(rs.getInt("row_number"))
            .rawFields(fromJson(objectMapper, rs.getString("raw_fields"), FIELD_MAP))
            .parsedFields(fromJson(objectMapper, rs.getString("parsed_fields"), FIELD_MAP))
            .blockingErrors(new ArrayList<>(fromJson(objectMapper, rs.getString("blocking_errors"), ERROR_LIST)))
            .status(QuarantineStatus.valueOf(rs.getString("status")))
            .dismissNote(rs.getString("dismiss_note"))
            .createdAt(instant(rs, "created_at"))
            .updatedAt(instant(rs, "updated_at"))
            .build();
    }

    private FeedCorrection mapCorrection(ResultSet rs, int rowNum) throws SQLException {
        return FeedCorrection.builder()
            .id(rs.getString("id"))
            .quarantinedRecordId(rs.getString("quarantined_record_id"))
            .field(rs.getString("field"))
            .oldValue(rs.getString("old_value"))
            .newValue(rs.getString("new_value"))
            .author(rs.getString("author"))
            .createdAt(instant(rs, "created_at"))
            .build();
    }

    @Override
    public QuarantinedRecord upsert(QuarantinedRecord record) {
        String id = record.getId() != null ? record.getId() : UUID.randomUUID().toString();
        List<String> refreshed = jdbcTemplate.queryForList("""
            INSERT INTO quarantined_records
                (id, feed_id, retailer_id, run_id, feed_type, match_key, row_number,
                 raw_fields, parsed_fields, blocking_errors, status, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, CAST(? AS JSONB), CAST(? AS JSONB), CAST(? AS JSONB), 'QUARANTINED', ?, ?)
            ON CONFLICT (feed_id, match_key) DO UPDATE SET
                run_id = EXCLUDED.run_id,
                row_number = EXCLUDED.row_number,
                raw_fields = EXCLUDED.raw_fields,
                parsed_fields = EXCLUDED.parsed_fields,
                blocking_errors = EXCLUDED.blocking_errors,
                updated_at = EXCLUDED.updated_at
            WHERE quarantined_records.status = 'QUARANTINED'
            RETURNING id
            """, String.class,
                id,
                record.getFeedId(),
                record.getRetailerId(),
                record.getRunId(),
                record.getFeedType().name(),
                record.getMatchKey(),
                record.getRowNumber(),
                toJson(objectMapper, record.getRawFields()),
                toJson(objectMapper, record.getParsedFields()),
                toJson(objectMapper, record.getBlockingErrors()),
                ts(record.getCreatedAt()),
                ts(record.getUpdatedAt()));
        if (!refreshed.isEmpty()) {
            return findById(refreshed.get(0)).orElseThrow();
        }
        // Conflict with a RESOLVED or DISMISSED record: left as the operator closed it
        return jdbcTemplate.query("SELECT * FROM quarantined_records WHERE feed_id = ? AND match_key = ?",
                        this::mapRecord, record.getFeedId(), record.getMatchKey())
                .stream().findFirst().orElseThrow();
    }

    @Override
    public Optional<QuarantinedRecord> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM quarantined_records WHERE id = ?", this::mapRecord, id)
                .stream().findFirst();
    }

    @Override
    public void update(QuarantinedRecord record) {
        jdbcTemplate.update("""
            UPDATE quarantined_records SET
                blocking_errors = CAST(? AS JSONB), status = ?, dismiss_note = ?, updated_at = ?
            WHERE id = ?
            """,
                toJson(objectMapper, record.getBlockingErrors()),
                record.getStatus().name(),
                record.getDismissNote(),
                ts(record.getUpdatedAt()),
                record.getId());
    }

    @Override
    public List<QuarantinedRecord> findQuarantined(QuarantineFilter filter, int limit) {
        List<Object> args = new ArrayList<>();
        String where = whereClause(filter, args);
        args.add(limit);
        return jdbcTemplate.query(
                "SELECT * FROM quarantined_records " + where + " ORDER BY created_at, id LIMIT ?",
                this::mapRecord, args.toArray());
    }

    @Override
    public int countQuarantined(QuarantineFilter filter) {
        List<Object> args = new ArrayList<>();
        String where = whereClause(filter, args);
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM quarantined_records " + where, Integer.class, args.toArray());
        return count == null ? 0 : count;
    }

    @Override
    public int updateStatus(List<String> ids, QuarantineStatus status, String note, Instant at) {
        if (ids.isEmpty()) return 0;
        String placeholders = String.join(",", ids.stream().map(id -> "?").toList());

        List<Object> args = new ArrayList<>();
        args.add(status.name());
        args.add(note);
        args.add(ts(at));
        args.addAll(ids);
        return jdbcTemplate.update(
                "UPDATE quarantined_records SET status = ?, dismiss_note = COALESCE(?, dismiss_note), updated_at = ? "
                        + "WHERE status = 'QUARANTINED' AND id IN (" + placeholders + ")",
                args.toArray());
    }

    @Override
    public FeedCorrection addCorrection(FeedCorrection correction) {
        if (correction.getId() == null) correction.setId(UUID.randomUUID().toString());
        jdbcTemplate.update("""
            INSERT INTO feed_corrections
                (id, quarantined_record_id, field, old_value, new_value, author, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """,
                correction.getId(),
                correction.getQuarantinedRecordId(),
                correction.getField(),
                correction.getOldValue(),
                correction.getNewValue(),
                correction.getAuthor(),
                ts(correction.getCreatedAt()));
        return correction;
    }

    @Override
    public List<FeedCorrection> findCorrections(String quarantinedRecordId) {
        return jdbcTemplate.query(
                "SELECT * FROM feed_corrections WHERE quarantined_record_id = ? ORDER BY created_at, id",
                this::mapCorrection, quarantinedRecordId);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String whereClause(QuarantineFilter filter, List<Object> args) {
        StringBuilder where = new StringBuilder("WHERE status = 'QUARANTINED'");
        if (filter.feedType() != null) {
            where.append(" AND feed_type = ?");
            args.add(filter.feedType().name());
        }
        if (filter.feedId() != null) {
            where.append(" AND feed_id = ?");
            args.add(filter.feedId());
        }
        if (filter.reasonCode() != null) {
            where.append(" AND blocking_errors @> CAST(? AS JSONB)");
            args.add(toJson(objectMapper, List.of(Map.of("code", filter.reasonCode().name()))));
        }
        return where.toString();
    }
}
