package com.priceintel.harvester.repository.jdbc;

import com.priceintel.harvester.model.IdentityType;
import com.priceintel.harvester.model.PriceObservation;
import com.priceintel.harvester.model.ProvenanceType;
import com.priceintel.harvester.model.SourceProduct;
import com.priceintel.harvester.repository.PriceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.priceintel.harvester.repository.jdbc.JdbcSupport.*;

@Repository
@RequiredArgsConstructor
public class JdbcPriceRepository implements PriceRepository {

    private static final String PRODUCT_SELECT = """
        SELECT sp.*, p.last_seen_at
        FROM source_products sp
        LEFT JOIN source_product_presence p ON p.source_product_id = sp.id
        """;

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<SourceProduct> productMapper = (rs, i) -> SourceProduct.builder()
            .id(rs.getString("id"))
            .retailerId(rs.getString("retailer_id"))
            .feedId(rs.getString("feed_id"))
            .identityKey(rs.getString("identity_key"))
            .identityType(IdentityType.valueOf(rs.getString("identity_type")))
            .title(rs.getString("title"))
            .url(rs.getString("url"))
            .brand(rs.getString("brand"))
            .upc(rs.getString("upc"))
            .sku(rs.getString("sku"))
            .networkItemId(rs.getString("network_item_id"))
            .lastSeenAt(instant(rs, "last_seen_at"))
            .createdAt(instant(rs, "created_at"))
            .updatedAt(instant(rs, "updated_at"))
            .build();

    private final RowMapper<PriceObservation> priceMapper = (rs, i) -> PriceObservation.builder()
            .id(rs.getString("id"))
            .sourceProductId(rs.getString("source_product_id"))
            .retailerId(rs.getString("retailer_id"))
            .price(rs.getBigDecimal("price"))
            .originalPrice(rs.getBigDecimal("original_price"))
            .currency(rs.getString("currency"))
            .inStock(rs.getBoolean("in_stock"))
            .priceSignature(rs.getString("price_signature"))
            .runType(ProvenanceType.valueOf(rs.getString("run_type")))
            .runId(rs.getString("run_id"))
            .observedAt(instant(rs, "observed_at"))
            .build();

    @Override
    public Optional<SourceProduct> findSourceProduct(String retailerId, String identityKey) {
        return jdbcTemplate.query(PRODUCT_SELECT + " WHERE sp.retailer_id = ? AND sp.identity_key = ?",
                productMapper, retailerId, identityKey).stream().findFirst();
    }

    @Override
    public Optional<SourceProduct> findSourceProductById(String id) {
        return jdbcTemplate.query(PRODUCT_SELECT + " WHERE sp.id = ?", productMapper, id)
                .stream().findFirst();
    }

    @Override
    public List<SourceProduct> findSourceProductsByIds(Collection<String> ids) {
        if (ids.isEmpty()) return List.of();
        String placeholders = String.join(",", ids.stream().map(id -> "?").toList());
        return jdbcTemplate.query(PRODUCT_SELECT + " WHERE sp.id IN (" + placeholders + ")",
                productMapper, new ArrayList<Object>(ids).toArray());
    }

    @Override
    public SourceProduct upsertSourceProduct(SourceProduct product) {
        String id = product.getId() != null ? product.getId() : UUID.randomUUID().toString();
        String storedId = jdbcTemplate.queryForObject("""
            INSERT INTO source_products
                (id, retailer_id, feed_id, identity_key, identity_type, title, url, brand, upc, sku,
                 network_item_id, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (retailer_id, identity_key) DO UPDATE SET
                feed_id = EXCLUDED.feed_id,
                title = EXCLUDED.title,
                url = EXCLUDED.url,
                brand = COALESCE(EXCLUDED.brand, source_products.brand),
                upc = COALESCE(EXCLUDED.upc, source_products.upc),
                sku = COALESCE(EXCLUDED.sku, source_products.sku),
                network_item_id = COALESCE(EXCLUDED.network_item_id, source_products.network_item_id),
                updated_at = EXCLUDED.updated_at
            RETURNING id
            """, String.class,
                id,
                product.getRetailerId(),
                product.getFeedId(),
                product.getIdentityKey(),
                product.getIdentityType().name(),
                product.getTitle(),
                product.getUrl(),
                product.getBrand(),
                product.getUpc(),
                product.getSku(),
                product.getNetworkItemId(),
                ts(product.getCreatedAt()),
                ts(product.getUpdatedAt()));
        return findSourceProductById(storedId).orElseThrow();
    }

    @Override
    public Optional<PriceObservation> findLatestPrice(String sourceProductId) {
        return jdbcTemplate.query("""
            SELECT * FROM prices
            WHERE source_product_id = ?
            ORDER BY observed_at DESC
            LIMIT 1
            """, priceMapper, sourceProductId).stream().findFirst();
    }

    @Override
    public boolean insertPrice(PriceObservation o) {
        String id = o.getId() != null ? o.getId() : UUID.randomUUID().toString();
        return jdbcTemplate.update("""
            INSERT INTO prices
                (id, source_product_id, retailer_id, price, original_price, currency, in_stock,
                 price_signature, run_type, run_id, observed_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (run_id, source_product_id, price_signature) DO NOTHING
            """,
                id,
                o.getSourceProductId(),
                o.getRetailerId(),
                o.getPrice(),
                o.getOriginalPrice(),
                o.getCurrency(),
                o.isInStock(),
                o.getPriceSignature(),
                o.getRunType().name(),
                o.getRunId(),
                ts(o.getObservedAt())) > 0;
    }

    @Override
    public void upsertPresence(String sourceProductId, Instant seenAt) {
        jdbcTemplate.update("""
            INSERT INTO source_product_presence (source_product_id, last_seen_at)
            VALUES (?, ?)
            ON CONFLICT (source_product_id) DO UPDATE SET
                last_seen_at = GREATEST(source_product_presence.last_seen_at, EXCLUDED.last_seen_at)
            """, sourceProductId, ts(seenAt));
    }

    @Override
    public boolean recordSeen(String runId, String sourceProductId) {
        return jdbcTemplate.update("""
            INSERT INTO source_product_seen (run_id, source_product_id)
            VALUES (?, ?)
            ON CONFLICT DO NOTHING
            """, runId, sourceProductId) > 0;
    }
}
