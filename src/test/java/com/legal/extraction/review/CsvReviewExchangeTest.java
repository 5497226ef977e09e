package com.legal.extraction.review;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvReviewExchangeTest {

    private final CsvReviewExchange exchange = new CsvReviewExchange();

    private static ReviewExchangeRecord row(String id, String text) {
        return new ReviewExchangeRecord("doc-1:" + id, "definition", text, "the body", 2, 0.55,
                "colon_pattern", "Low confidence (0.55)", null, null, null, null);
    }

    @Test
    @DisplayName("Writes a header and one line per row")
    void writes() throws IOException {
        StringWriter out = new StringWriter();

        int written = exchange.write(List.of(row("a", "Authority")), out);

        assertEquals(1, written);
        String[] lines = out.toString().split("\r\n");
        assertEquals(String.join(",", CsvReviewExchange.HEADER), lines[0]);
        assertEquals("doc-1:a,definition,Authority,the body,2,0.5500,colon_pattern,Low confidence (0.55),,,,",
                lines[1]);
    }

    @Test
    @DisplayName("Only reviewed rows are read back, with quoted fields intact")
    void readsReviewedRows() throws IOException {
        String tricky = "Tax, \"Excise\"\nGoods";
        StringWriter out = new StringWriter();
        exchange.write(List.of(
                row("a", tricky).withReview("alice", "accepted", null, "ok, checked"),
                row("b", "Person")), out);

        List<ReviewExchangeRecord> rows = exchange.read(new StringReader(out.toString()));

        assertEquals(1, rows.size());
        ReviewExchangeRecord read = rows.get(0);
        assertEquals("doc-1:a", read.recordId());
        assertEquals(tricky, read.rawText());
        assertEquals("ok, checked", read.notes());
        assertEquals(2, read.page());
        assertEquals(0.55, read.confidence(), 1e-9);
        assertEquals(ReviewDecision.ACCEPT, read.toCorrection().decision());
    }

    @Test
    @DisplayName("Columns are found by name")
    void reorderedColumns() throws IOException {
        String csv = "decision,Reviewed_By,record_id\r\nreject,bob,doc-1:a\r\n\r\n,,doc-1:b\r\n";

        List<ReviewExchangeRecord> rows = exchange.read(new StringReader(csv));

        assertEquals(1, rows.size());
        assertEquals("doc-1:a", rows.get(0).recordId());
        assertEquals(ReviewDecision.REJECT, rows.get(0).toCorrection().decision());
        assertNull(rows.get(0).rawText());
    }

    @Test
    @DisplayName("Bad numbers default to zero")
    void badNumbers() throws IOException {
        String csv = "record_id,page,confidence,reviewed_by\ndoc-1:a,two,high,alice\n";

        ReviewExchangeRecord row = exchange.read(new StringReader(csv)).get(0);

        assertEquals(0, row.page());
        assertEquals(0.0, row.confidence());
    }

    @Test
    @DisplayName("A batch without record ids is rejected")
    void missingRecordId() {
        assertThrows(IOException.class, () -> exchange.read(new StringReader("text,reviewed_by\nx,alice\n")));
    }

    @Test
    @DisplayName("Empty input yields no rows")
    void emptyInput() throws IOException {
        assertTrue(exchange.read(new StringReader("")).isEmpty());
        assertEquals("csv", exchange.getFormat());
    }

    @Test
    @DisplayName("Record parsing handles escaped quotes")
    void readRecord() throws IOException {
        BufferedReader reader = new BufferedReader(new StringReader("\"a \"\"b\"\"\",c\r\nnext"));

        assertEquals(List.of("a \"b\"", "c"), CsvReviewExchange.readRecord(reader));
        assertEquals(List.of("next"), CsvReviewExchange.readRecord(reader));
        assertNull(CsvReviewExchange.readRecord(reader));
        assertEquals("\"x,\"\"y\"\"\"", CsvReviewExchange.csvEscape("x,\"y\""));
    }
}
