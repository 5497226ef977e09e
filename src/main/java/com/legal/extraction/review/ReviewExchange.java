package com.legal.extraction.review;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.List;

/**
 * File format used to hand review batches to reviewers and read their answers back.
 */
public interface ReviewExchange {

    /**
     * Writes the rows. The writer is flushed, not closed.
     *
     * @return number of rows written
     */
    int write(List<ReviewExchangeRecord> rows, Writer writer) throws IOException;

    /**
     * Reads back a batch. Rows without a reviewer are skipped.
     */
    List<ReviewExchangeRecord> read(Reader reader) throws IOException;

    /**
     * Format name, e.g. "csv" or "json".
     */
    String getFormat();
}
