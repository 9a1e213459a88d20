package com.priceintel.harvester.model;

/**
 * Run-level and per-row error codes recorded on a feed run.
 */
public enum ErrorCode {

    // ── Transport ───────────────────────────────────────────────────────────
    CONNECTION_FAILED,
    CONNECTION_TIMEOUT,
    HTTP_STATUS,
    INVALID_CONTENT_TYPE,
    FILE_TOO_LARGE,
    DECOMPRESS_FAILED,
    CONFIG_ERROR,

    // ── Parsing ─────────────────────────────────────────────────────────────
    PARSE_FAILED,
    MISSING_REQUIRED_FIELD,
    INVALID_PRICE,
    INVALID_URL,
    TOO_MANY_ROWS,

    UNKNOWN_ERROR
}
