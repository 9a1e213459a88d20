package com.priceintel.harvester.repository;

import com.priceintel.harvester.model.BlockingErrorCode;
import com.priceintel.harvester.model.FeedType;

/**
 * Narrows bulk quarantine operations. Null fields match everything.
 */
public record QuarantineFilter(FeedType feedType, BlockingErrorCode reasonCode, String feedId) {

    public static QuarantineFilter all() {
        return new QuarantineFilter(null, null, null);
    }
}
