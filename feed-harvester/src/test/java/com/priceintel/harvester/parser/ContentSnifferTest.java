package com.priceintel.harvester.parser;

import com.priceintel.harvester.model.FeedFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ContentSnifferTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("declared content type wins over the body")
    void contentTypeFirst() {
        assertEquals(FeedFormat.JSON, ContentSniffer.detect("application/json; charset=utf-8", bytes("a,b\n")));
        assertEquals(FeedFormat.TSV, ContentSniffer.detect("text/tab-separated-values", bytes("[]")));
        assertEquals(FeedFormat.CSV, ContentSniffer.detect("text/csv", bytes("<x/>")));
    }

    @Test
    @DisplayName("unhelpful content type falls back to sniffing")
    void sniffing() {
        assertEquals(FeedFormat.JSON, ContentSniffer.detect("application/octet-stream", bytes("  \n{\"a\":1}")));
        assertEquals(FeedFormat.XML, ContentSniffer.detect(null, bytes("\uFEFF<?xml version=\"1.0\"?><p/>")));
        assertEquals(FeedFormat.TSV, ContentSniffer.detect(null, bytes("a\tb\tc,d\n1\t2\t3\n")));
        assertEquals(FeedFormat.CSV, ContentSniffer.detect(null, bytes("a,b,c\n")));
        assertEquals(FeedFormat.CSV, ContentSniffer.detect(null, new byte[0]));
    }

    @Test
    @DisplayName("HTML pages are recognised by header or markup")
    void html() {
        assertTrue(ContentSniffer.looksLikeHtml("text/html; charset=UTF-8", bytes("a,b")));
        assertTrue(ContentSniffer.looksLikeHtml(null, bytes("\n<!DOCTYPE html><html>")));
        assertTrue(ContentSniffer.looksLikeHtml("text/plain", bytes("<HTML><body>login</body>")));
        assertFalse(ContentSniffer.looksLikeHtml("text/csv", bytes("Title,URL\n")));
    }
}
