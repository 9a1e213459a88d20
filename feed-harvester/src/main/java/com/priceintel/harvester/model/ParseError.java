package com.priceintel.harvester.model;

/**
 * A coded per-row (or whole-file) problem found while parsing. rowNumber is 1-based, null for file-level errors.
 */
public record ParseError(ErrorCode code, String message, Integer rowNumber) {

    public static ParseError row(int rowNumber, ErrorCode code, String message) {
        return new ParseError(code, message, rowNumber);
    }

    public static ParseError file(ErrorCode code, String message) {
        return new ParseError(code, message, null);
    }
}
