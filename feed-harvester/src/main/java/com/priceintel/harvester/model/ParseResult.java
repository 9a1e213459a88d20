package com.priceintel.harvester.model;

import java.util.List;

/**
 * Output of parsing one feed file. rowsParsed never exceeds rowsRead.
 */
public record ParseResult(List<SourceRecord> records, int rowsRead, int rowsParsed, List<ParseError> errors) {

    public ParseResult {
        if (rowsParsed > rowsRead) {
            throw new IllegalArgumentException(
                    "rowsParsed (" + rowsParsed + ") cannot exceed rowsRead (" + rowsRead + ")");
        }
        records = List.copyOf(records);
        errors = List.copyOf(errors);
    }
}
