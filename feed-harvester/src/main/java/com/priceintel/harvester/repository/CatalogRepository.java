package com.priceintel.harvester.repository;

import com.priceintel.harvester.model.CanonicalProduct;
import com.priceintel.harvester.model.ProductLink;

import java.util.List;
import java.util.Optional;

public interface CatalogRepository {

    List<CanonicalProduct> findByUpc(String upc);

    /** Canonical products sharing the caliber or the brand, case-insensitively. */
    List<CanonicalProduct> findCandidates(String caliber, String brand, int limit);

    Optional<ProductLink> findLink(String sourceProductId);

    /** Insert or replace the link for its source product. */
    void saveLink(ProductLink link);

    /** Source products whose link needs another pass: NEEDS_REVIEW, UNMATCHED or another resolver version. */
    List<String> findSourceProductIdsToReresolve(String currentVersion, int limit);
}
