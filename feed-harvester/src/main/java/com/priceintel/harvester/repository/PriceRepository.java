package com.priceintel.harvester.repository;

import com.priceintel.harvester.model.PriceObservation;
import com.priceintel.harvester.model.SourceProduct;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Source products, their presence tracking and price history.
 */
public interface PriceRepository {

    Optional<SourceProduct> findSourceProduct(String retailerId, String identityKey);

    Optional<SourceProduct> findSourceProductById(String id);

    List<SourceProduct> findSourceProductsByIds(Collection<String> ids);

    /** Insert or update by (retailerId, identityKey). Returns the stored product with its id. */
    SourceProduct upsertSourceProduct(SourceProduct product);

    Optional<PriceObservation> findLatestPrice(String sourceProductId);

    /**
     * Conflict-safe on (runId, sourceProductId, priceSignature).
     *
     * @return false when an identical observation for the same run already exists
     */
    boolean insertPrice(PriceObservation observation);

    /** One presence row per product, carrying the latest time it was seen. */
    void upsertPresence(String sourceProductId, Instant seenAt);

    /**
     * Insert-or-ignore per (runId, sourceProductId).
     *
     * @return false when already recorded for this run
     */
    boolean recordSeen(String runId, String sourceProductId);
}
