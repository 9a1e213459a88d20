package com.priceintel.harvester.parser;

import java.util.List;
import java.util.Map;

/**
 * Reads a whole feed body into ordered column-name → value rows.
 */
interface RowReader {

    Rows read(String content);

    /**
     * @param truncation why reading stopped early, or null when the whole body was read
     */
    record Rows(List<Map<String, String>> values, String truncation) {

        static Rows complete(List<Map<String, String>> values) {
            return new Rows(values, null);
        }
    }
}
