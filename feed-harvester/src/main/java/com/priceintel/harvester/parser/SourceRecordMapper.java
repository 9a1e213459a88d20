package com.priceintel.harvester.parser;

import com.priceintel.harvester.model.ErrorCode;
import com.priceintel.harvester.model.ParseError;
import com.priceintel.harvester.model.SourceRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps one raw feed row to a normalized {@link SourceRecord}, or explains why the row is dropped.
 *
 * A row is dropped only when it has no name, no usable URL, or no parseable price. Every other
 * problem (missing identifier, zero price) is left for validation to quarantine.
 */
@Component
@Slf4j
public class SourceRecordMapper {

    private static final Set<String> LOCAL_HOSTS = Set.of("localhost", "127.0.0.1", "0.0.0.0");

    public RowOutcome map(int rowNumber, Map<String, String> row) {
        FieldResolver fields = new FieldResolver(row);

        String title = fields.get(FeedField.TITLE);
        if (title == null) {
            return RowOutcome.dropped(ParseError.row(rowNumber, ErrorCode.MISSING_REQUIRED_FIELD,
                    "Missing product name"));
        }

        String rawUrl = fields.get(FeedField.URL);
        if (rawUrl == null) {
            return RowOutcome.dropped(ParseError.row(rowNumber, ErrorCode.MISSING_REQUIRED_FIELD,
                    "Missing product URL"));
        }
        String url = normalizeUrl(rawUrl);
        if (url == null) {
            return RowOutcome.dropped(ParseError.row(rowNumber, ErrorCode.INVALID_URL,
                    "Invalid product URL: " + rawUrl));
        }

        // sale price outranks list price; the list price then becomes the original price
        String rawSale = fields.get(FeedField.SALE_PRICE);
        String rawList = fields.get(FeedField.PRICE);
        String rawPrice = rawSale != null ? rawSale : rawList;
        if (rawPrice == null) {
            return RowOutcome.dropped(ParseError.row(rowNumber, ErrorCode.MISSING_REQUIRED_FIELD,
                    "Missing price"));
        }

        BigDecimal price;
        BigDecimal originalPrice;
        try {
            price = PriceNormalizer.parse(rawPrice);
            String rawOriginal = fields.get(FeedField.ORIGINAL_PRICE);
            if (rawOriginal == null && rawSale != null) rawOriginal = rawList;
            originalPrice = parseOptionalPrice(rawOriginal);
        } catch (NumberFormatException e) {
            return RowOutcome.dropped(ParseError.row(rowNumber, ErrorCode.INVALID_PRICE,
                    "Unparseable price: " + rawPrice));
        }

        String rawStock = fields.get(FeedField.STOCK);

        SourceRecord record = SourceRecord.builder()
                .rowNumber(rowNumber)
                .rawFields(new LinkedHashMap<>(row))
                .networkItemId(fields.get(FeedField.NETWORK_ITEM_ID))
                .sku(fields.get(FeedField.SKU))
                .upc(digitsOrNull(fields.get(FeedField.UPC)))
                .url(url)
                .title(title)
                .brand(fields.get(FeedField.BRAND))
                .category(fields.get(FeedField.CATEGORY))
                .imageUrl(fields.get(FeedField.IMAGE_URL))
                .description(fields.get(FeedField.DESCRIPTION))
                .rawPrice(rawPrice)
                .rawStock(rawStock)
                .price(price)
                .originalPrice(originalPrice)
                .currency(PriceNormalizer.currency(fields.get(FeedField.CURRENCY), rawPrice))
                .inStock(StockStatusNormalizer.isInStock(rawStock))
                .build();

        return RowOutcome.mapped(record);
    }

    /**
     * Snapshot of the logical fields of a record, keyed by {@link FeedField#key()}.
     */
    public Map<String, String> snapshot(SourceRecord record) {
        Map<String, String> fields = new LinkedHashMap<>();
        putIfPresent(fields, FeedField.TITLE, record.getTitle());
        putIfPresent(fields, FeedField.URL, record.getUrl());
        putIfPresent(fields, FeedField.PRICE, record.getPrice() == null ? null : record.getPrice().toPlainString());
        putIfPresent(fields, FeedField.ORIGINAL_PRICE,
                record.getOriginalPrice() == null ? null : record.getOriginalPrice().toPlainString());
        putIfPresent(fields, FeedField.CURRENCY, record.getCurrency());
        putIfPresent(fields, FeedField.STOCK, String.valueOf(record.isInStock()));
        putIfPresent(fields, FeedField.NETWORK_ITEM_ID, record.getNetworkItemId());
        putIfPresent(fields, FeedField.SKU, record.getSku());
        putIfPresent(fields, FeedField.UPC, record.getUpc());
        putIfPresent(fields, FeedField.BRAND, record.getBrand());
        putIfPresent(fields, FeedField.CATEGORY, record.getCategory());
        putIfPresent(fields, FeedField.IMAGE_URL, record.getImageUrl());
        putIfPresent(fields, FeedField.DESCRIPTION, record.getDescription());
        return fields;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private BigDecimal parseOptionalPrice(String raw) {
        try {
            return PriceNormalizer.parse(raw);
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparseable original price '{}'", raw);
            return null;
        }
    }

    /**
     * Adds https:// when the scheme is missing. Returns null for non-http(s), hostless or local URLs.
     */
    static String normalizeUrl(String raw) {
        String candidate = raw.trim();
        if (!candidate.matches("(?i)^[a-z][a-z0-9+.-]*://.*")) {
            candidate = "https://" + candidate;
        }
        try {
            URI uri = new URI(candidate);
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            String host = uri.getHost();
            if (!scheme.equals("http") && !scheme.equals("https")) return null;
            if (host == null || !host.contains(".") || LOCAL_HOSTS.contains(host.toLowerCase(Locale.ROOT))) {
                return null;
            }
            return candidate;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String digitsOrNull(String value) {
        if (value == null) return null;
        String digits = value.replaceAll("\\D", "");
        return digits.isEmpty() ? null : digits;
    }

    private static void putIfPresent(Map<String, String> fields, FeedField field, String value) {
        if (StringUtils.isNotBlank(value)) fields.put(field.key(), value);
    }

    // ── Inner record ──────────────────────────────────────────────────────────

    public record RowOutcome(SourceRecord record, ParseError error) {

        static RowOutcome mapped(SourceRecord record) {
            return new RowOutcome(record, null);
        }

        static RowOutcome dropped(ParseError error) {
            return new RowOutcome(null, error);
        }

        public boolean isMapped() {
            return record != null;
        }
    }
}
