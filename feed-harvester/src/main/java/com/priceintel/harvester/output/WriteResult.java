package com.priceintel.harvester.output;

import java.util.List;

/**
 * @param changedProductIds source products that are new or whose descriptive fields changed
 */
public record WriteResult(int productsWritten, int pricesWritten, int pricesUnchanged, List<String> changedProductIds) {

    public WriteResult {
        changedProductIds = List.copyOf(changedProductIds);
    }
}
