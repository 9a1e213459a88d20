package com.priceintel.harvester.output;

import com.priceintel.harvester.config.HarvesterProperties;
import com.priceintel.harvester.identity.IdentityEngine;
import com.priceintel.harvester.model.PriceObservation;
import com.priceintel.harvester.model.SourceProduct;
import com.priceintel.harvester.model.SourceRecord;
import com.priceintel.harvester.repository.PriceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persists admitted records: source product upsert, presence and seen tracking, then a price
 * observation when the price signature changed or the heartbeat interval has passed.
 *
 * Every write is idempotent within a run, so a retried run produces no duplicate rows.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PriceWriter {

    private static final int BATCH_SIZE = 1000;

    private final PriceRepository priceRepository;
    private final IdentityEngine identityEngine;
    private final HarvesterProperties properties;
    private final Clock clock;

    public WriteResult writePrices(WriteContext context, List<IdentifiedRecord> records) {
        if (records.isEmpty()) return new WriteResult(0, 0, 0, List.of());

        int total = records.size();
        log.info("Writing {} records for run {} in batches of {}", total, context.runId(), BATCH_SIZE);

        int products = 0;
        int written = 0;
        int unchanged = 0;
        List<String> changed = new ArrayList<>();

        for (int i = 0; i < total; i += BATCH_SIZE) {
            List<IdentifiedRecord> batch = records.subList(i, Math.min(i + BATCH_SIZE, total));
            for (IdentifiedRecord item : batch) {
                WrittenProduct result = write(context, item);
                products++;
                if (result.priceWritten()) written++; else unchanged++;
                if (result.productChanged()) changed.add(result.sourceProductId());
            }
            log.debug("Wrote batch {}/{}", Math.min(i + BATCH_SIZE, total), total);
        }

        log.info("Run {}: {} products, {} prices written, {} unchanged",
                context.runId(), products, written, unchanged);
        return new WriteResult(products, written, unchanged, changed);
    }

    /**
     * Writes a single record. Used directly when one corrected record is promoted out of quarantine.
     */
    public WrittenProduct write(WriteContext context, IdentifiedRecord item) {
        SourceRecord record = item.record();
        Instant now = clock.instant();
        String identityKey = item.identity().asString();

        Optional<SourceProduct> existing = priceRepository.findSourceProduct(context.retailerId(), identityKey);
        SourceProduct stored = priceRepository.upsertSourceProduct(SourceProduct.builder()
                .id(existing.map(SourceProduct::getId).orElse(null))
                .retailerId(context.retailerId())
                .feedId(context.feedId())
                .identityKey(identityKey)
                .identityType(item.identity().type())
                .title(record.getTitle())
                .url(record.getUrl())
                .brand(record.getBrand())
                .upc(record.getUpc())
                .sku(record.getSku())
                .networkItemId(record.getNetworkItemId())
                .createdAt(existing.map(SourceProduct::getCreatedAt).orElse(now))
                .updatedAt(now)
                .build());

        boolean productChanged = existing.map(before -> descriptiveFieldsDiffer(before, record)).orElse(true);

        priceRepository.recordSeen(context.runId(), stored.getId());
        priceRepository.upsertPresence(stored.getId(), context.seenAt());

        String signature = identityEngine.priceSignature(record.getPrice(), record.getCurrency(),
                record.getOriginalPrice());
        if (!isPriceDue(stored.getId(), signature, now)) {
            return new WrittenProduct(stored.getId(), productChanged, false);
        }

        boolean inserted = priceRepository.insertPrice(PriceObservation.builder()
                .sourceProductId(stored.getId())
                .retailerId(context.retailerId())
                .price(record.getPrice())
                .originalPrice(record.getOriginalPrice())
                .currency(record.getCurrency())
                .inStock(record.isInStock())
                .priceSignature(signature)
                .runType(context.runType())
                .runId(context.runId())
                .observedAt(now)
                .build());
        return new WrittenProduct(stored.getId(), productChanged, inserted);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean isPriceDue(String sourceProductId, String signature, Instant now) {
        Optional<PriceObservation> latest = priceRepository.findLatestPrice(sourceProductId);
        if (latest.isEmpty()) return true;
        if (!latest.get().getPriceSignature().equals(signature)) return true;

        Duration heartbeat = properties.getWriter().getHeartbeat();
        return !latest.get().getObservedAt().plus(heartbeat).isAfter(now);
    }

    private boolean descriptiveFieldsDiffer(SourceProduct before, SourceRecord record) {
        return !Objects.equals(before.getTitle(), record.getTitle())
                || (record.getUpc() != null && !Objects.equals(before.getUpc(), record.getUpc()))
                || (record.getBrand() != null && !Objects.equals(before.getBrand(), record.getBrand()));
    }
}
