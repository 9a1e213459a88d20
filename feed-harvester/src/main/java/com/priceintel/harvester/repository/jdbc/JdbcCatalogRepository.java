package com.priceintel.harvester.repository.jdbc;

import com.priceintel.harvester.model.CanonicalProduct;
import com.priceintel.harvester.model.ConfidenceTier;
import com.priceintel.harvester.model.LinkStatus;
import com.priceintel.harvester.model.ProductLink;
import com.priceintel.harvester.repository.CatalogRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.priceintel.harvester.repository.jdbc.JdbcSupport.*;

@Repository
@RequiredArgsConstructor
public class JdbcCatalogRepository implements CatalogRepository {

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<CanonicalProduct> productMapper = (rs, i) -> CanonicalProduct.builder()
            .id(rs.getString("id"))
            .upc(rs.getString("upc"))
            .title(rs.getString("title"))
            .brand(rs.getString("brand"))
            .caliber(rs.getString("caliber"))
            .grainWeight(nullableInt(rs, "grain_weight"))
            .roundCount(nullableInt(rs, "round_count"))
            .build();

    private final RowMapper<ProductLink> linkMapper = (rs, i) -> ProductLink.builder()
            .sourceProductId(rs.getString("source_product_id"))
            .canonicalProductId(rs.getString("canonical_product_id"))
            .status(LinkStatus.valueOf(rs.getString("status")))
            .tier(ConfidenceTier.valueOf(rs.getString("tier")))
            .confidence(rs.getDouble("confidence"))
            .matchedSignals(splitSignals(rs.getString("matched_signals")))
            .candidateCount(rs.getInt("candidate_count"))
            .resolverVersion(rs.getString("resolver_version"))
            .resolvedAt(instant(rs, "resolved_at"))
            .build();

    @Override
    public List<CanonicalProduct> findByUpc(String upc) {
        return jdbcTemplate.query("SELECT * FROM canonical_products WHERE upc = ?", productMapper, upc);
    }

    @Override
    public List<CanonicalProduct> findCandidates(String caliber, String brand, int limit) {
        if (caliber == null && brand == null) return List.of();
        return jdbcTemplate.query("""
            SELECT * FROM canonical_products
            WHERE (CAST(? AS TEXT) IS NOT NULL AND LOWER(caliber) = LOWER(?))
               OR (CAST(? AS TEXT) IS NOT NULL AND LOWER(brand) = LOWER(?))
            ORDER BY id
            LIMIT ?
            """, productMapper, caliber, caliber, brand, brand, limit);
    }

    @Override
    public Optional<ProductLink> findLink(String sourceProductId) {
        return jdbcTemplate.query("SELECT * FROM product_links WHERE source_product_id = ?",
                linkMapper, sourceProductId).stream().findFirst();
    }

    @Override
    public void saveLink(ProductLink link) {
        jdbcTemplate.update("""
            INSERT INTO product_links
                (source_product_id, canonical_product_id, status, tier, confidence, matched_signals,
                 candidate_count, resolver_version, resolved_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (source_product_id) DO UPDATE SET
                canonical_product_id = EXCLUDED.canonical_product_id,
                status = EXCLUDED.status,
                tier = EXCLUDED.tier,
                confidence = EXCLUDED.confidence,
                matched_signals = EXCLUDED.matched_signals,
                candidate_count = EXCLUDED.candidate_count,
                resolver_version = EXCLUDED.resolver_version,
                resolved_at = EXCLUDED.resolved_at
            """,
                link.getSourceProductId(),
                link.getCanonicalProductId(),
                link.getStatus().name(),
                link.getTier().name(),
                link.getConfidence(),
                String.join(",", link.getMatchedSignals()),
                link.getCandidateCount(),
                link.getResolverVersion(),
                ts(link.getResolvedAt()));
    }

    @Override
    public List<String> findSourceProductIdsToReresolve(String currentVersion, int limit) {
        return jdbcTemplate.queryForList("""
            SELECT source_product_id FROM product_links
            WHERE status IN ('NEEDS_REVIEW', 'UNMATCHED') OR resolver_version <> ?
            ORDER BY resolved_at
            LIMIT ?
            """, String.class, currentVersion, limit);
    }

    private static List<String> splitSignals(String value) {
        if (StringUtils.isBlank(value)) return new ArrayList<>();
        return new ArrayList<>(Arrays.asList(value.split(",")));
    }
}
