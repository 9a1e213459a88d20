package com.priceintel.harvester.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceintel.harvester.model.ErrorCode;
import com.priceintel.harvester.model.FeedFormat;
import com.priceintel.harvester.model.ParseError;
import com.priceintel.harvester.model.ParseResult;
import com.priceintel.harvester.model.SourceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeedParserTest {

    private final FeedParser parser = new FeedParser(new SourceRecordMapper(), new ObjectMapper());

    private ParseResult parse(String body, FeedFormat format) {
        return parser.parse(body.getBytes(StandardCharsets.UTF_8), format, 1000);
    }

    private static List<ErrorCode> codes(ParseResult result) {
        return result.errors().stream().map(ParseError::code).toList();
    }

    @Nested
    @DisplayName("delimited feeds")
    class Delimited {

        @Test
        @DisplayName("CSV with aliased headers maps to normalized records")
        void csv() {
            ParseResult result = parse("""
                    ProductName,Link,Price,SKU,UPC,Manufacturer,Availability
                    Federal 9mm 115gr FMJ 50rd,shop.example.com/p/1,$18.99,fed-9,0-29465-06451-5,Federal,In Stock
                    """, FeedFormat.CSV);

            assertEquals(1, result.rowsRead());
            assertEquals(1, result.rowsParsed());
            SourceRecord record = result.records().get(0);
            assertEquals("Federal 9mm 115gr FMJ 50rd", record.getTitle());
            assertEquals("https://shop.example.com/p/1", record.getUrl());
            assertEquals(new BigDecimal("18.99"), record.getPrice());
            assertEquals("USD", record.getCurrency());
            assertEquals("029465064515", record.getUpc());
            assertEquals("Federal", record.getBrand());
            assertTrue(record.isInStock());
            assertEquals("$18.99", record.getRawFields().get("Price"));
        }

        @Test
        @DisplayName("TSV is sniffed from the first line when no format is given")
        void tsvSniffed() {
            ParseResult result = parse("Name\tURL\tPrice\n"
                    + "Hornady 6.5 Creedmoor\thttps://shop.example.com/h\t29,99 €\n", FeedFormat.AUTO);

            assertEquals(1, result.rowsParsed());
            assertEquals(new BigDecimal("29.99"), result.records().get(0).getPrice());
            assertEquals("EUR", result.records().get(0).getCurrency());
        }

        @Test
        @DisplayName("a leading byte-order mark does not break the first header")
        void bom() {
            ParseResult result = parse("\uFEFFTitle,URL,Price\nA,https://shop.example.com/a,1.00\n", FeedFormat.AUTO);

            assertEquals(1, result.rowsParsed());
            assertEquals("A", result.records().get(0).getTitle());
        }

        @Test
        @DisplayName("bad rows are dropped with 1-based row numbers, good rows survive")
        void badRows() {
            ParseResult result = parse("""
                    Title,URL,Price
                    Good,https://shop.example.com/a,1.00
                    ,https://shop.example.com/b,2.00
                    No price,https://shop.example.com/c,
                    Local,http://localhost/d,3.00
                    Garbled,https://shop.example.com/e,call us
                    """, FeedFormat.CSV);

            assertEquals(5, result.rowsRead());
            assertEquals(1, result.rowsParsed());
            assertEquals(List.of(ErrorCode.MISSING_REQUIRED_FIELD, ErrorCode.MISSING_REQUIRED_FIELD,
                    ErrorCode.INVALID_URL, ErrorCode.INVALID_PRICE), codes(result));
            assertEquals(List.of(2, 3, 4, 5), result.errors().stream().map(ParseError::rowNumber).toList());
        }

        @Test
        @DisplayName("sale price wins and the list price becomes the original price")
        void salePrice() {
            ParseResult result = parse("""
                    Title,URL,Price,SalePrice
                    A,https://shop.example.com/a,24.00,18.99
                    """, FeedFormat.CSV);

            SourceRecord record = result.records().get(0);
            assertEquals(new BigDecimal("18.99"), record.getPrice());
            assertEquals(new BigDecimal("24.00"), record.getOriginalPrice());
        }
    }

    @Nested
    @DisplayName("tree feeds")
    class Tree {

        @Test
        @DisplayName("JSON root array")
        void jsonArray() {
            ParseResult result = parse("""
                    [{"title":"A","url":"https://shop.example.com/a","price":"1.50","sku":"a1"},
                     {"title":"B","url":"https://shop.example.com/b","price":2}]
                    """, FeedFormat.AUTO);

            assertEquals(2, result.rowsParsed());
            assertEquals("a1", result.records().get(0).getSku());
            assertEquals(new BigDecimal("2.00"), result.records().get(1).getPrice());
        }

        @Test
        @DisplayName("JSON records under a wrapper object with nested fields")
        void nestedJson() {
            ParseResult result = parse("""
                    {"meta":{"count":1},
                     "products":[{"name":"A","link":"https://shop.example.com/a",
                                  "offer":{"price":"9.99","currency":"cad"},"gtin":"12345678"}]}
                    """, FeedFormat.JSON);

            assertEquals(1, result.rowsParsed());
            SourceRecord record = result.records().get(0);
            assertEquals(new BigDecimal("9.99"), record.getPrice());
            assertEquals("CAD", record.getCurrency());
            assertEquals("12345678", record.getUpc());
        }

        @Test
        @DisplayName("XML repeated elements, and a single element")
        void xml() {
            ParseResult many = parse("""
                    <products>
                      <product><title>A</title><url>https://shop.example.com/a</url><price>1.00</price></product>
                      <product><title>B</title><url>https://shop.example.com/b</url><price>2.00</price></product>
                    </products>
                    """, FeedFormat.AUTO);
            ParseResult one = parse("""
                    <products>
                      <product><title>A</title><url>https://shop.example.com/a</url><price>1.00</price></product>
                    </products>
                    """, FeedFormat.XML);

            assertEquals(2, many.rowsParsed());
            assertEquals("B", many.records().get(1).getTitle());
            assertEquals(1, one.rowsParsed());
        }
    }

    @Nested
    @DisplayName("file-level outcomes")
    class FileLevel {

        @Test
        @DisplayName("unreadable JSON yields no records and one file error")
        void unreadable() {
            ParseResult result = parse("{\"products\": [", FeedFormat.JSON);

            assertEquals(0, result.rowsRead());
            assertTrue(result.records().isEmpty());
            assertEquals(1, result.errors().size());
            assertEquals(ErrorCode.PARSE_FAILED, result.errors().get(0).code());
            assertNull(result.errors().get(0).rowNumber());
        }

        @Test
        @DisplayName("rows beyond the cap are not processed and TOO_MANY_ROWS is reported")
        void rowCap() {
            StringBuilder body = new StringBuilder("Title,URL,Price\n");
            for (int i = 0; i < 5; i++) {
                body.append("P").append(i).append(",https://shop.example.com/").append(i).append(",1.00\n");
            }

            ParseResult result = parser.parse(body.toString().getBytes(StandardCharsets.UTF_8), FeedFormat.CSV, 3);

            assertEquals(5, result.rowsRead());
            assertEquals(3, result.rowsParsed());
            assertEquals(List.of(ErrorCode.TOO_MANY_ROWS), codes(result));
        }

        @Test
        @DisplayName("header-only CSV is an empty, error-free parse")
        void headerOnly() {
            ParseResult result = parse("Title,URL,Price\n", FeedFormat.CSV);

            assertEquals(0, result.rowsRead());
            assertTrue(result.errors().isEmpty());
        }
    }
}
