package com.legal.extraction.review;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.time.Instant;
import java.util.List;

/**
 * JSON review batches.
 *
 * <pre>
 * {
 *   "export_date" : "2024-05-01T10:15:30Z",
 *   "total_items" : 1,
 *   "items" : [ { "record_id" : "...", "text" : "...", "reviewed_by" : null, ... } ]
 * }
 * </pre>
 */
public class JsonReviewExchange implements ReviewExchange {
    private static final Logger log = LoggerFactory.getLogger(JsonReviewExchange.class);

    private final ObjectMapper objectMapper;

    public JsonReviewExchange() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonReviewExchange(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public int write(List<ReviewExchangeRecord> rows, Writer writer) throws IOException {
        ReviewBatch batch = new ReviewBatch(Instant.now().toString(), rows.size(), rows);
        writer.write(objectMapper.writeValueAsString(batch));
        writer.flush();
        log.info("review.export.completed format=json rows={}", rows.size());
        return rows.size();
    }

    @Override
    public List<ReviewExchangeRecord> read(Reader reader) throws IOException {
        ReviewBatch batch = objectMapper.readValue(reader, ReviewBatch.class);
        if (batch.items() == null) {
            return List.of();
        }
        List<ReviewExchangeRecord> reviewed = batch.items().stream()
                .filter(ReviewExchangeRecord::isReviewed)
                .toList();
        log.info("review.import.parsed format=json reviewed={} skipped={}",
                reviewed.size(), batch.items().size() - reviewed.size());
        return reviewed;
    }

    @Override
    public String getFormat() {
        return "json";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ReviewBatch(
            @JsonProperty("export_date") String exportDate,
            @JsonProperty("total_items") int totalItems,
            @JsonProperty("items") List<ReviewExchangeRecord> items
    ) {}
}
