package com.priceintel.harvester.parser;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import com.priceintel.harvester.model.ErrorCode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV / TSV rows keyed by the header line. Short rows yield missing fields, extra columns are ignored.
 */
@Slf4j
class DelimitedRowReader implements RowReader {

    private final char separator;

    DelimitedRowReader(char separator) {
        this.separator = separator;
    }

    @Override
    public Rows read(String content) {
        List<Map<String, String>> rows = new ArrayList<>();

        try (CSVReader reader = new CSVReaderBuilder(new StringReader(content))
                .withCSVParser(new CSVParserBuilder()
                        .withSeparator(separator)
                        .withIgnoreLeadingWhiteSpace(true)
                        .build())
                .build()) {

            String[] header = reader.readNext();
            if (header == null) return Rows.complete(rows);
            for (int i = 0; i < header.length; i++) {
                header[i] = header[i] == null ? "" : header[i].trim();
            }

            String[] line;
            while ((line = reader.readNext()) != null) {
                if (isBlankLine(line)) continue;

                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < header.length && i < line.length; i++) {
                    if (!header[i].isEmpty()) {
                        row.put(header[i], line[i] == null ? "" : line[i].trim());
                    }
                }
                rows.add(row);
            }
        } catch (IOException | CsvValidationException e) {
            if (rows.isEmpty()) {
                throw new FeedParseException(ErrorCode.PARSE_FAILED,
                        "Unreadable delimited content: " + e.getMessage(), e);
            }
            log.warn("Delimited content truncated after {} rows: {}", rows.size(), e.getMessage());
            return new Rows(rows, e.getMessage());
        }
        return Rows.complete(rows);
    }

    private boolean isBlankLine(String[] line) {
        for (String cell : line) {
            if (cell != null && !cell.isBlank()) return false;
        }
        return true;
    }
}
