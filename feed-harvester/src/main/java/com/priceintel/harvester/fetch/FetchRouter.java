package com.priceintel.harvester.fetch;

import com.priceintel.harvester.config.HarvesterProperties;
import com.priceintel.harvester.identity.Hashing;
import com.priceintel.harvester.model.ErrorCode;
import com.priceintel.harvester.model.Feed;
import com.priceintel.harvester.model.FeedFormat;
import com.priceintel.harvester.model.TransportConfig;
import com.priceintel.harvester.parser.ContentSniffer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * Routes a feed to the transport its config names, then normalizes what comes back:
 * gzip is unpacked, HTML error pages are rejected and the format is sniffed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FetchRouter {

    private final List<FeedFetcher> fetchers;
    private final HarvesterProperties properties;

    /** Fetch for a scheduled or manual run. */
    public FetchResult fetch(Feed feed) {
        return fetch(feed, properties.getFetch().getScheduledTimeout());
    }

    /** Fetch for an operator's interactive connection test. */
    public FetchResult testFetch(Feed feed) {
        return fetch(feed, properties.getFetch().getInteractiveTimeout());
    }

    public FetchResult fetch(Feed feed, Duration timeout) {
        TransportConfig config = feed.getTransport();
        if (config == null || config.getKind() == null) {
            throw new FeedFetchException(FetchFailureKind.CONFIG, "Feed " + feed.getId() + " has no transport");
        }

        long maxBytes = config.getMaxFileSizeBytes() != null
                ? config.getMaxFileSizeBytes()
                : properties.getFetch().getMaxFileSizeBytes();

        FeedFetcher fetcher = fetchers.stream()
                .filter(f -> f.supports(config.getKind()))
                .findFirst()
                .orElseThrow(() -> new FeedFetchException(FetchFailureKind.CONFIG,
                        "No fetcher for transport " + config.getKind()));

        long started = System.nanoTime();
        RawContent raw = fetcher.fetch(feed, timeout, maxBytes);
        byte[] content = isGzip(raw.bytes()) ? gunzip(raw.bytes(), maxBytes) : raw.bytes();

        if (ContentSniffer.looksLikeHtml(raw.contentType(), content)) {
            throw new FeedFetchException(FetchFailureKind.INVALID_CONTENT_TYPE,
                    "Expected a product feed but received an HTML page from " + raw.source());
        }

        FeedFormat detected = ContentSniffer.detect(contentTypeOf(raw), content);
        String hash = Hashing.sha256Hex(content);

        log.info("Fetched feed {} via {}: {} bytes, {} format, {} ms",
                feed.getId(), config.getKind(), content.length, detected,
                (System.nanoTime() - started) / 1_000_000);

        return new FetchResult(content, raw.contentType(), detected, hash, raw.source());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String contentTypeOf(RawContent raw) {
        if (raw.contentType() != null) return raw.contentType();
        String source = raw.source() == null ? "" : raw.source().toLowerCase(Locale.ROOT).replaceAll("\\.gz$", "");
        if (source.endsWith(".json")) return "application/json";
        if (source.endsWith(".xml")) return "application/xml";
        if (source.endsWith(".tsv")) return "text/tab-separated-values";
        if (source.endsWith(".csv")) return "text/csv";
        return null;
    }

    private static boolean isGzip(byte[] bytes) {
        return bytes.length >= 2 && (bytes[0] & 0xff) == 0x1f && (bytes[1] & 0xff) == 0x8b;
    }

    private static byte[] gunzip(byte[] bytes, long maxBytes) {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
            return BoundedStreams.readAll(in, maxBytes);
        } catch (IOException e) {
            throw new FeedFetchException(FetchFailureKind.INVALID_CONTENT_TYPE, ErrorCode.DECOMPRESS_FAILED,
                    "Could not decompress gzip content: " + e.getMessage(), null, e);
        }
    }
}
