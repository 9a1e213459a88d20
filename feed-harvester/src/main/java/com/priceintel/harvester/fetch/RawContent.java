package com.priceintel.harvester.fetch;

/**
 * Bytes as delivered by a transport, before decompression and sniffing.
 */
public record RawContent(byte[] bytes, String contentType, String source) {
}
