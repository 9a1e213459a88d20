package com.priceintel.harvester.quarantine;

import com.priceintel.harvester.config.HarvesterProperties;
import com.priceintel.harvester.identity.Hashing;
import com.priceintel.harvester.model.BlockingError;
import com.priceintel.harvester.model.Feed;
import com.priceintel.harvester.model.FeedCorrection;
import com.priceintel.harvester.model.IdentityKey;
import com.priceintel.harvester.model.IdentityType;
import com.priceintel.harvester.model.ProvenanceType;
import com.priceintel.harvester.model.QuarantineStatus;
import com.priceintel.harvester.model.QuarantinedRecord;
import com.priceintel.harvester.model.SourceRecord;
import com.priceintel.harvester.output.IdentifiedRecord;
import com.priceintel.harvester.output.PriceWriter;
import com.priceintel.harvester.output.WriteContext;
import com.priceintel.harvester.output.WrittenProduct;
import com.priceintel.harvester.parser.FeedField;
import com.priceintel.harvester.parser.PriceNormalizer;
import com.priceintel.harvester.parser.SourceRecordMapper;
import com.priceintel.harvester.parser.StockStatusNormalizer;
import com.priceintel.harvester.queue.ResolveJob;
import com.priceintel.harvester.queue.WorkQueue;
import com.priceintel.harvester.repository.QuarantineFilter;
import com.priceintel.harvester.repository.QuarantineRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Holds records that fail validation and lets operators correct, reprocess or dismiss them.
 *
 * Corrections are append-only; the effective value of a field is the latest correction for it,
 * falling back to the parsed snapshot. A record is only promoted when the corrected fields pass
 * the same validation as a fresh feed row.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QuarantineService {

    private final QuarantineRepository repository;
    private final RecordValidator validator;
    private final SourceRecordMapper recordMapper;
    private final PriceWriter priceWriter;
    private final WorkQueue workQueue;
    private final HarvesterProperties properties;
    private final Clock clock;

    public ValidationResult validate(SourceRecord record) {
        return validator.validate(recordMapper.snapshot(record));
    }

    public QuarantinedRecord quarantine(Feed feed, String runId, SourceRecord record, IdentityKey matchKey,
                                        List<BlockingError> errors) {
        Instant now = clock.instant();
        QuarantinedRecord stored = repository.upsert(QuarantinedRecord.builder()
                .feedId(feed.getId())
                .retailerId(feed.getRetailerId())
                .runId(runId)
                .feedType(feed.getFeedType())
                .matchKey(matchKey.asString())
                .rowNumber(record.getRowNumber())
                .rawFields(new LinkedHashMap<>(record.getRawFields()))
                .parsedFields(recordMapper.snapshot(record))
                .blockingErrors(List.copyOf(errors))
                .status(QuarantineStatus.QUARANTINED)
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.debug("Quarantined row {} of feed {}: {}", record.getRowNumber(), feed.getId(), errors);
        return stored;
    }

    public QuarantinedRecord getRecord(String recordId) {
        return repository.findById(recordId)
                .orElseThrow(() -> new NoSuchElementException("Quarantined record " + recordId + " not found"));
    }

    public FeedCorrection applyCorrection(String recordId, String field, String newValue, String author) {
        if (StringUtils.isBlank(author)) {
            throw new IllegalArgumentException("Corrections need an author");
        }
        FeedField target = FeedField.fromKey(field)
                .orElseThrow(() -> new IllegalArgumentException("Unknown field: " + field));

        QuarantinedRecord record = getRecord(recordId);
        requireQuarantined(record);

        Map<String, String> current = effectiveFields(record);
        FeedCorrection correction = repository.addCorrection(FeedCorrection.builder()
                .quarantinedRecordId(recordId)
                .field(target.key())
                .oldValue(current.get(target.key()))
                .newValue(newValue == null ? null : newValue.trim())
                .author(author.trim())
                .createdAt(clock.instant())
                .build());

        log.info("Correction on record {}: {} '{}' → '{}' by {}", recordId, target.key(),
                correction.getOldValue(), correction.getNewValue(), correction.getAuthor());
        return correction;
    }

    /** Parsed snapshot overlaid with the latest correction per field. */
    public Map<String, String> effectiveFields(QuarantinedRecord record) {
        Map<String, String> fields = new LinkedHashMap<>(record.getParsedFields());
        for (FeedCorrection correction : repository.findCorrections(record.getId())) {
            if (StringUtils.isBlank(correction.getNewValue())) {
                fields.remove(correction.getField());
            } else {
                fields.put(correction.getField(), correction.getNewValue());
            }
        }
        return fields;
    }

    public ReprocessOutcome reprocess(String recordId) {
        QuarantinedRecord record = getRecord(recordId);
        requireQuarantined(record);

        Map<String, String> fields = effectiveFields(record);
        ValidationResult validation = validator.validate(fields);
        Instant now = clock.instant();

        if (!validation.accepted()) {
            record.setBlockingErrors(validation.blockingErrors());
            record.setUpdatedAt(now);
            repository.update(record);
            log.info("Record {} still blocked: {}", recordId, validation.blockingErrors());
            return ReprocessOutcome.stillBlocked(recordId, validation.blockingErrors());
        }

        SourceRecord corrected = toSourceRecord(record, fields);
        IdentityKey identity = new IdentityKey(IdentityType.RECORD_HASH, recordHash(corrected));
        WrittenProduct written = priceWriter.write(
                new WriteContext("reprocess-" + recordId, ProvenanceType.REPROCESS,
                        record.getRetailerId(), record.getFeedId(), now),
                new IdentifiedRecord(corrected, identity));

        repository.updateStatus(List.of(recordId), QuarantineStatus.RESOLVED, null, now);
        workQueue.enqueue(new ResolveJob("resolve-" + written.sourceProductId(), List.of(written.sourceProductId())));

        log.info("Record {} resolved into source product {}", recordId, written.sourceProductId());
        return ReprocessOutcome.resolved(recordId, written.sourceProductId());
    }

    public void dismiss(String recordId, String note) {
        int minLength = properties.getQuarantine().getMinSingleDismissNoteLength();
        requireNote(note, minLength);

        QuarantinedRecord record = getRecord(recordId);
        requireQuarantined(record);
        repository.updateStatus(List.of(recordId), QuarantineStatus.DISMISSED, note.trim(), clock.instant());
        log.info("Record {} dismissed: {}", recordId, note.trim());
    }

    public BulkResult reprocessAll(QuarantineFilter filter, Integer limit) {
        int cap = effectiveLimit(limit, properties.getQuarantine().getReprocessLimit());
        int total = repository.countQuarantined(filter);
        List<QuarantinedRecord> records = repository.findQuarantined(filter, cap);

        int resolved = 0;
        for (QuarantinedRecord record : records) {
            try {
                if (reprocess(record.getId()).resolved()) resolved++;
            } catch (IllegalStateException e) {
                // resolved or dismissed by someone else since the query
                log.debug("Skipping record {}: {}", record.getId(), e.getMessage());
            }
        }

        log.info("Bulk reprocess: {} of {} records resolved ({} matched filter)", resolved, records.size(), total);
        return new BulkResult(resolved, total > cap);
    }

    public BulkResult dismissAll(QuarantineFilter filter, String note, Integer limit) {
        requireNote(note, properties.getQuarantine().getMinDismissNoteLength());

        int cap = effectiveLimit(limit, properties.getQuarantine().getDismissLimit());
        int total = repository.countQuarantined(filter);
        List<String> ids = repository.findQuarantined(filter, cap).stream()
                .map(QuarantinedRecord::getId)
                .toList();

        int batchSize = properties.getQuarantine().getUpdateBatchSize();
        int dismissed = 0;
        Instant now = clock.instant();
        for (int i = 0; i < ids.size(); i += batchSize) {
            List<String> batch = ids.subList(i, Math.min(i + batchSize, ids.size()));
            dismissed += repository.updateStatus(batch, QuarantineStatus.DISMISSED, note.trim(), now);
        }

        log.info("Bulk dismiss: {} records dismissed ({} matched filter)", dismissed, total);
        return new BulkResult(dismissed, total > cap);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private SourceRecord toSourceRecord(QuarantinedRecord record, Map<String, String> fields) {
        String upc = fields.get(FeedField.UPC.key());
        return SourceRecord.builder()
                .rowNumber(record.getRowNumber())
                .rawFields(new LinkedHashMap<>(record.getRawFields()))
                .title(fields.get(FeedField.TITLE.key()))
                .url(fields.get(FeedField.URL.key()))
                .upc(upc == null ? null : upc.replaceAll("\\D", ""))
                .sku(fields.get(FeedField.SKU.key()))
                .networkItemId(fields.get(FeedField.NETWORK_ITEM_ID.key()))
                .brand(fields.get(FeedField.BRAND.key()))
                .category(fields.get(FeedField.CATEGORY.key()))
                .imageUrl(fields.get(FeedField.IMAGE_URL.key()))
                .description(fields.get(FeedField.DESCRIPTION.key()))
                .rawPrice(fields.get(FeedField.PRICE.key()))
                .price(PriceNormalizer.parse(fields.get(FeedField.PRICE.key())))
                .originalPrice(parseOptional(fields.get(FeedField.ORIGINAL_PRICE.key())))
                .currency(PriceNormalizer.currency(fields.get(FeedField.CURRENCY.key()), null))
                .inStock(StockStatusNormalizer.isInStock(fields.get(FeedField.STOCK.key())))
                .build();
    }

    /** Stable key for a promoted record: title, identifier, SKU and price. */
    private String recordHash(SourceRecord record) {
        String identifier = record.getUpc() != null ? record.getUpc()
                : StringUtils.defaultString(record.getNetworkItemId());
        String material = String.join("|",
                record.getTitle().trim().toLowerCase(Locale.ROOT),
                identifier,
                StringUtils.defaultString(record.getSku()),
                record.getPrice().toPlainString());
        return Hashing.sha256Hex(material).substring(0, 32);
    }

    private static BigDecimal parseOptional(String raw) {
        try {
            return PriceNormalizer.parse(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static void requireQuarantined(QuarantinedRecord record) {
        if (record.getStatus() != QuarantineStatus.QUARANTINED) {
            throw new IllegalStateException("Record " + record.getId() + " is " + record.getStatus());
        }
    }

    private static void requireNote(String note, int minLength) {
        if (note == null || note.trim().length() < minLength) {
            throw new IllegalArgumentException("A note of at least " + minLength + " characters is required");
        }
    }

    private static int effectiveLimit(Integer requested, int max) {
        if (requested == null || requested <= 0) return max;
        return Math.min(requested, max);
    }
}
