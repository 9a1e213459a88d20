package com.priceintel.harvester.model;

/** Declared feed format. AUTO defers to content sniffing. */
public enum FeedFormat {
    AUTO, CSV, TSV, XML, JSON
}
