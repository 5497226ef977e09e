package com.legal.extraction.tracing;

/**
 * An open trace span for one pipeline stage. Close it with try-with-resources.
 */
public interface TraceScope extends AutoCloseable {

    TraceScope annotate(String key, String value);

    TraceScope annotate(String key, long value);

    /**
     * Marks the stage as failed and attaches the cause.
     */
    void fail(Throwable cause);

    @Override
    void close();
}
