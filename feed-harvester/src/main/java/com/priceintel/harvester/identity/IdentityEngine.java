package com.priceintel.harvester.identity;

import com.priceintel.harvester.model.IdentityKey;
import com.priceintel.harvester.model.IdentityType;
import com.priceintel.harvester.model.SourceRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Derives stable product identities and price signatures.
 *
 * Identity priority: network item id, then SKU, then a hash of the canonicalized product URL.
 * All functions are pure; the same record always yields the same key.
 */
@Component
@Slf4j
public class IdentityEngine {

    public static final String DEFAULT_CURRENCY = "USD";

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "gclid", "fbclid",
            "ref", "source", "partner_id", "affiliate_id",
            "clickid", "irclickid", "irgwc");

    private static final List<String> TRACKING_PREFIXES = List.of("utm_", "impactradius_");

    public IdentityKey deriveIdentity(SourceRecord record) {
        if (StringUtils.isNotBlank(record.getNetworkItemId())) {
            return new IdentityKey(IdentityType.NETWORK_ITEM_ID, record.getNetworkItemId().trim());
        }
        if (StringUtils.isNotBlank(record.getSku())) {
            return new IdentityKey(IdentityType.SKU, normalizeSku(record.getSku()));
        }
        if (StringUtils.isNotBlank(record.getUrl())) {
            return new IdentityKey(IdentityType.URL_HASH, urlHash(record.getUrl()));
        }
        throw new IllegalArgumentException("Row " + record.getRowNumber() + " has no identity source");
    }

    /**
     * Deterministic signature for change detection: {@code price|CURRENCY[|originalPrice]},
     * amounts at two decimals, hashed with SHA-256.
     */
    public String priceSignature(BigDecimal price, String currency, BigDecimal originalPrice) {
        return Hashing.sha256Hex(signatureMaterial(price, currency, originalPrice));
    }

    public String signatureMaterial(BigDecimal price, String currency, BigDecimal originalPrice) {
        StringBuilder material = new StringBuilder()
                .append(scale(price).toPlainString())
                .append('|')
                .append(StringUtils.isBlank(currency) ? DEFAULT_CURRENCY : currency.trim().toUpperCase(Locale.ROOT));
        if (originalPrice != null) {
            material.append('|').append(scale(originalPrice).toPlainString());
        }
        return material.toString();
    }

    public String urlHash(String url) {
        return Hashing.sha256Hex(canonicalizeUrl(url));
    }

    /**
     * Lower-cases scheme and host, drops tracking parameters, sorts the rest and strips trailing
     * slashes. Path and query values keep their case. Unparseable input is only trimmed.
     */
    public String canonicalizeUrl(String url) {
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return stripTrailingSlashes(trimmed);
            }

            StringBuilder out = new StringBuilder()
                    .append(uri.getScheme().toLowerCase(Locale.ROOT))
                    .append("://")
                    .append(uri.getHost().toLowerCase(Locale.ROOT));
            if (uri.getPort() != -1) {
                out.append(':').append(uri.getPort());
            }
            if (uri.getRawPath() != null) {
                out.append(stripTrailingSlashes(uri.getRawPath()));
            }

            String query = canonicalQuery(uri.getRawQuery());
            if (!query.isEmpty()) {
                out.append('?').append(query);
            }
            return stripTrailingSlashes(out.toString());
        } catch (URISyntaxException e) {
            log.debug("Could not parse URL for canonicalization: {}", trimmed);
            return stripTrailingSlashes(trimmed);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String canonicalQuery(String rawQuery) {
        if (StringUtils.isEmpty(rawQuery)) return "";

        List<String[]> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            String key = pair.contains("=") ? pair.substring(0, pair.indexOf('=')) : pair;
            if (!isTracking(key)) {
                kept.add(new String[]{key, pair});
            }
        }
        // stable sort by key keeps repeated keys in original order
        kept.sort(Comparator.comparing(p -> p[0]));

        List<String> pairs = new ArrayList<>(kept.size());
        for (String[] p : kept) pairs.add(p[1]);
        return String.join("&", pairs);
    }

    private boolean isTracking(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        if (TRACKING_PARAMS.contains(lower)) return true;
        for (String prefix : TRACKING_PREFIXES) {
            if (lower.startsWith(prefix)) return true;
        }
        return false;
    }

    private String normalizeSku(String sku) {
        return sku.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", "-");
    }

    private static String stripTrailingSlashes(String value) {
        return value.replaceAll("/+$", "");
    }

    private static BigDecimal scale(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }
}
