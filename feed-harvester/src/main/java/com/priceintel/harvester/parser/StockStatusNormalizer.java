package com.priceintel.harvester.parser;

import java.util.Locale;
import java.util.Set;

/**
 * Maps stock indicator vocabulary to a boolean. Absent or unrecognised values count as in stock.
 */
public final class StockStatusNormalizer {

    private static final Set<String> IN_STOCK = Set.of(
            "true", "1", "yes", "y", "in stock", "instock", "in_stock", "available", "limited", "low stock");

    private static final Set<String> OUT_OF_STOCK = Set.of(
            "false", "0", "no", "n", "out of stock", "outofstock", "out_of_stock", "unavailable",
            "sold out", "discontinued", "backordered", "preorder", "pre-order");

    private StockStatusNormalizer() {
    }

    public static boolean isInStock(String raw) {
        if (raw == null) return true;
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty() || IN_STOCK.contains(value)) return true;
        return !OUT_OF_STOCK.contains(value);
    }
}
