package com.priceintel.harvester.resolver;

public record BatchResolveResult(String resolverVersion, int matched, int needsReview, int unmatched,
                                 int skipped, int missing) {

    public int resolved() {
        return matched + needsReview + unmatched;
    }
}
