package com.priceintel.harvester.parser;

import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Looks up logical fields in one raw row. Exact alias match first, then a match that ignores
 * case and separators, so {@code PRODUCT_NAME}, {@code productName} and {@code Product Name} agree.
 */
final class FieldResolver {

    private final Map<String, String> row;
    private final Map<String, String> loose = new HashMap<>();

    FieldResolver(Map<String, String> row) {
        this.row = row;
        row.forEach((k, v) -> loose.putIfAbsent(looseKey(k), v));
    }

    String get(FeedField field) {
        for (String alias : field.aliases()) {
            String value = row.get(alias);
            if (StringUtils.isNotBlank(value)) return value.trim();
        }
        for (String alias : field.aliases()) {
            String value = loose.get(looseKey(alias));
            if (StringUtils.isNotBlank(value)) return value.trim();
        }
        return null;
    }

    static String looseKey(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
