package com.priceintel.harvester.parser;

import com.priceintel.harvester.model.FeedFormat;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Routes content to a reader from its declared content type or its leading bytes.
 */
public final class ContentSniffer {

    private static final int PEEK_BYTES = 4096;

    private ContentSniffer() {
    }

    public static FeedFormat detect(String contentType, byte[] content) {
        FeedFormat fromHeader = fromContentType(contentType);
        return fromHeader != FeedFormat.AUTO ? fromHeader : fromContent(content);
    }

    public static FeedFormat fromContentType(String contentType) {
        if (contentType == null) return FeedFormat.AUTO;
        String ct = contentType.toLowerCase(Locale.ROOT);
        if (ct.contains("json")) return FeedFormat.JSON;
        if (ct.contains("xml")) return FeedFormat.XML;
        if (ct.contains("tab-separated")) return FeedFormat.TSV;
        if (ct.contains("csv")) return FeedFormat.CSV;
        return FeedFormat.AUTO;
    }

    public static FeedFormat fromContent(byte[] content) {
        String head = peek(content).stripLeading();
        if (head.startsWith("{") || head.startsWith("[")) return FeedFormat.JSON;
        if (head.startsWith("<")) return FeedFormat.XML;

        int eol = head.indexOf('\n');
        String firstLine = eol >= 0 ? head.substring(0, eol) : head;
        long tabs = firstLine.chars().filter(c -> c == '\t').count();
        long commas = firstLine.chars().filter(c -> c == ',').count();
        return tabs > commas ? FeedFormat.TSV : FeedFormat.CSV;
    }

    /** True when the payload is an HTML page, e.g. a login or error page served with 200. */
    public static boolean looksLikeHtml(String contentType, byte[] content) {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("text/html")) return true;
        String head = peek(content).stripLeading().toLowerCase(Locale.ROOT);
        return head.startsWith("<!doctype html") || head.startsWith("<html");
    }

    static String peek(byte[] content) {
        int len = Math.min(content.length, PEEK_BYTES);
        String head = new String(content, 0, len, StandardCharsets.UTF_8);
        return head.startsWith("\uFEFF") ? head.substring(1) : head;
    }
}
