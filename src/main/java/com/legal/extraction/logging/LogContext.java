package com.legal.extraction.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries, removed again on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forDocument(documentId)) {
 *     log.info("document.completed records={}", records.size());
 * }
 * </pre>
 *
 * <p>Keys that were already present when the context opened are restored on close, so
 * contexts can nest (a per-adapter context inside a per-document one).</p>
 */
public class LogContext implements AutoCloseable {

    private final Deque<String[]> previous = new ArrayDeque<>();

    private LogContext() {
    }

    public static LogContext forDocument(String documentId) {
        return new LogContext()
                .with("documentId", documentId)
                .with("stage", "document");
    }

    public static LogContext forAdapter(String documentId, String adapterName) {
        return new LogContext()
                .with("documentId", documentId)
                .with("adapter", adapterName)
                .with("stage", "enhance");
    }

    public static LogContext forMerge(String documentId) {
        return new LogContext()
                .with("documentId", documentId)
                .with("stage", "merge");
    }

    public static LogContext forReviewImport(String batchId) {
        return new LogContext()
                .with("importBatchId", batchId)
                .with("stage", "review-import");
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        previous.push(new String[]{key, MDC.get(key)});
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
        return this;
    }

    @Override
    public void close() {
        while (!previous.isEmpty()) {
            String[] entry = previous.pop();
            if (entry[1] == null) {
                MDC.remove(entry[0]);
            } else {
                MDC.put(entry[0], entry[1]);
            }
        }
    }
}
