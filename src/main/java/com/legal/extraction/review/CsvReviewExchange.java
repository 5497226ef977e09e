package com.legal.extraction.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CSV review batches.
 *
 * <pre>
 * record_id,entity_type,text,definition,page,confidence,extraction_method,reason,reviewed_by,corrected_text,decision,notes
 * doc-1:term_unresolved_3f2a...,definition,"Authority: the competent body",the competent body,3,0.55,colon_pattern,Low confidence (0.55),,,,
 * </pre>
 *
 * <p>The header row is required on import and columns are looked up by name, so reviewers may
 * reorder or drop descriptive columns. Quoted fields may contain commas, quotes and line breaks.</p>
 */
public class CsvReviewExchange implements ReviewExchange {
    private static final Logger log = LoggerFactory.getLogger(CsvReviewExchange.class);

    static final String[] HEADER = {
            "record_id", "entity_type", "text", "definition", "page", "confidence", "extraction_method",
            "reason", "reviewed_by", "corrected_text", "decision", "notes"
    };

    @Override
    public int write(List<ReviewExchangeRecord> rows, Writer writer) {
        PrintWriter pw = new PrintWriter(writer);
        pw.print(String.join(",", HEADER));
        pw.print("\r\n");
        for (ReviewExchangeRecord row : rows) {
            pw.print(String.join(",",
                    csvEscape(row.recordId()),
                    csvEscape(row.kind()),
                    csvEscape(row.rawText()),
                    csvEscape(row.definition()),
                    Integer.toString(row.page()),
                    String.format(Locale.ROOT, "%.4f", row.confidence()),
                    csvEscape(row.extractionMethod()),
                    csvEscape(row.reason()),
                    csvEscape(row.reviewedBy()),
                    csvEscape(row.correctedText()),
                    csvEscape(row.decision()),
                    csvEscape(row.notes())));
            pw.print("\r\n");
        }
        pw.flush();
        log.info("review.export.completed format=csv rows={}", rows.size());
        return rows.size();
    }

    @Override
    public List<ReviewExchangeRecord> read(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        List<String> header = readRecord(br);
        if (header == null) {
            return List.of();
        }
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            columns.put(header.get(i).strip().toLowerCase(Locale.ROOT), i);
        }
        if (!columns.containsKey("record_id")) {
            throw new IOException("CSV review batch has no record_id column");
        }

        List<ReviewExchangeRecord> reviewed = new ArrayList<>();
        int rowNumber = 1;
        int unreviewed = 0;
        List<String> fields;
        while ((fields = readRecord(br)) != null) {
            rowNumber++;
            if (fields.size() == 1 && fields.get(0).isBlank()) {
                continue;
            }
            ReviewExchangeRecord row = toRow(fields, columns, rowNumber);
            if (row.isReviewed()) {
                reviewed.add(row);
            } else {
                unreviewed++;
            }
        }
        log.info("review.import.parsed format=csv reviewed={} skipped={}", reviewed.size(), unreviewed);
        return reviewed;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private ReviewExchangeRecord toRow(List<String> fields, Map<String, Integer> columns, int rowNumber) {
        return new ReviewExchangeRecord(
                field(fields, columns, "record_id"),
                field(fields, columns, "entity_type"),
                field(fields, columns, "text"),
                field(fields, columns, "definition"),
                parseInt(field(fields, columns, "page"), rowNumber),
                parseDouble(field(fields, columns, "confidence"), rowNumber),
                field(fields, columns, "extraction_method"),
                field(fields, columns, "reason"),
                field(fields, columns, "reviewed_by"),
                field(fields, columns, "corrected_text"),
                field(fields, columns, "decision"),
                field(fields, columns, "notes"));
    }

    private static String field(List<String> fields, Map<String, Integer> columns, String name) {
        Integer index = columns.get(name);
        if (index == null || index >= fields.size()) {
            return null;
        }
        String value = fields.get(index);
        return value.isEmpty() ? null : value;
    }

    private static int parseInt(String value, int rowNumber) {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            log.warn("review.import.bad_value row={} column=page value='{}'", rowNumber, value);
            return 0;
        }
    }

    private static double parseDouble(String value, int rowNumber) {
        if (value == null) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value.strip());
        } catch (NumberFormatException e) {
            log.warn("review.import.bad_value row={} column=confidence value='{}'", rowNumber, value);
            return 0.0;
        }
    }

    /**
     * Reads one logical CSV record, which may span several lines inside quotes.
     *
     * @return the fields, or null at end of input
     */
    static List<String> readRecord(BufferedReader reader) throws IOException {
        int c = reader.read();
        if (c == -1) {
            return null;
        }
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        while (c != -1) {
            char ch = (char) c;
            if (quoted) {
                if (ch == '"') {
                    reader.mark(1);
                    int next = reader.read();
                    if (next == '"') {
                        current.append('"');
                    } else {
                        quoted = false;
                        if (next != -1) {
                            reader.reset();
                        }
                    }
                } else {
                    current.append(ch);
                }
            } else if (ch == '"' && current.length() == 0) {
                quoted = true;
            } else if (ch == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else if (ch == '\n') {
                break;
            } else if (ch != '\r') {
                current.append(ch);
            }
            c = reader.read();
        }
        fields.add(current.toString());
        return fields;
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
