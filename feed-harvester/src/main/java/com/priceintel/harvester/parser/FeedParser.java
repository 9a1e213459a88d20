package com.priceintel.harvester.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.priceintel.harvester.model.ErrorCode;
import com.priceintel.harvester.model.FeedFormat;
import com.priceintel.harvester.model.ParseError;
import com.priceintel.harvester.model.ParseResult;
import com.priceintel.harvester.model.SourceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses a feed body in any supported format into source records.
 *
 * Malformed rows are dropped with a row-numbered error and never fail the parse. A body that
 * cannot be read at all yields zero records and a single file-level error.
 */
@Component
@Slf4j
public class FeedParser {

    private static final String BOM = "\uFEFF";

    private final SourceRecordMapper mapper;
    private final RowReader csvReader = new DelimitedRowReader(',');
    private final RowReader tsvReader = new DelimitedRowReader('\t');
    private final RowReader jsonReader;
    private final RowReader xmlReader;

    public FeedParser(SourceRecordMapper mapper, ObjectMapper objectMapper) {
        this.mapper = mapper;
        this.jsonReader = new TreeRowReader(objectMapper, "JSON");
        this.xmlReader = new TreeRowReader(new XmlMapper(), "XML");
    }

    public ParseResult parse(byte[] content, FeedFormat formatHint, int maxRows) {
        FeedFormat format = formatHint == null || formatHint == FeedFormat.AUTO
                ? ContentSniffer.fromContent(content)
                : formatHint;

        String text = new String(content, StandardCharsets.UTF_8);
        if (text.startsWith(BOM)) text = text.substring(1);

        List<ParseError> errors = new ArrayList<>();
        RowReader.Rows rows;
        try {
            rows = readerFor(format).read(text);
        } catch (FeedParseException e) {
            log.warn("Could not read {} content: {}", format, e.getMessage());
            errors.add(ParseError.file(e.getCode(), e.getMessage()));
            return new ParseResult(List.of(), 0, 0, errors);
        }
        if (rows.truncation() != null) {
            errors.add(ParseError.file(ErrorCode.PARSE_FAILED,
                    "Stopped reading after " + rows.values().size() + " rows: " + rows.truncation()));
        }

        List<Map<String, String>> values = rows.values();
        int rowsRead = values.size();
        if (rowsRead > maxRows) {
            errors.add(ParseError.file(ErrorCode.TOO_MANY_ROWS,
                    "Feed has " + rowsRead + " rows; only the first " + maxRows + " were processed"));
            values = values.subList(0, maxRows);
        }

        List<SourceRecord> records = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            SourceRecordMapper.RowOutcome outcome = mapper.map(i + 1, values.get(i));
            if (outcome.isMapped()) {
                records.add(outcome.record());
            } else {
                errors.add(outcome.error());
            }
        }

        log.info("Parsed {} feed: {} rows read, {} parsed, {} errors",
                format, rowsRead, records.size(), errors.size());
        return new ParseResult(records, rowsRead, records.size(), errors);
    }

    private RowReader readerFor(FeedFormat format) {
        return switch (format) {
            case TSV -> tsvReader;
            case JSON -> jsonReader;
            case XML -> xmlReader;
            case CSV, AUTO -> csvReader;
        };
    }
}
