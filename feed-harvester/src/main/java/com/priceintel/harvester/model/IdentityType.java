package com.priceintel.harvester.model;

/** Identity sources in descending priority. */
public enum IdentityType {
    NETWORK_ITEM_ID, SKU, URL_HASH, RECORD_HASH
}
