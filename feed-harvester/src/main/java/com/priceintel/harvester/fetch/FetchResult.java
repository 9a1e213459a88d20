package com.priceintel.harvester.fetch;

import com.priceintel.harvester.model.FeedFormat;

/**
 * Retrieved feed body, already decompressed, with its detected format and SHA-256 content hash.
 */
public record FetchResult(byte[] content, String contentType, FeedFormat detectedFormat,
                          String contentHash, String source) {

    public int size() {
        return content.length;
    }
}
