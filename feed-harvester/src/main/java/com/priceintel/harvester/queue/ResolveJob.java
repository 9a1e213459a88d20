package com.priceintel.harvester.queue;

import java.util.List;

/**
 * Resolve a batch of source products against the catalog.
 */
public record ResolveJob(String uniqueKey, List<String> sourceProductIds) implements Job {

    public ResolveJob {
        sourceProductIds = List.copyOf(sourceProductIds);
    }

    @Override
    public int priority() {
        return PRIORITY_BACKGROUND;
    }
}
