package com.legal.extraction.tracing;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * Emits one OpenTelemetry span per pipeline stage, named {@code extraction.<stage>}
 * and tagged with the document id.
 */
public class OpenTelemetryPipelineTracer implements PipelineTracer {

    private final Tracer tracer;

    public OpenTelemetryPipelineTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public TraceScope startStage(String stage, String documentId) {
        Span span = tracer.spanBuilder("extraction." + stage)
                .setAttribute("extraction.document_id", documentId != null ? documentId : "")
                .startSpan();
        return new SpanScope(span);
    }

    private static final class SpanScope implements TraceScope {
        private final Span span;
        private boolean failed;

        SpanScope(Span span) {
            this.span = span;
        }

        @Override
        public TraceScope annotate(String key, String value) {
            span.setAttribute(key, value);
            return this;
        }

        @Override
        public TraceScope annotate(String key, long value) {
            span.setAttribute(key, value);
            return this;
        }

        @Override
        public void fail(Throwable cause) {
            failed = true;
            span.recordException(cause);
            span.setStatus(StatusCode.ERROR, String.valueOf(cause.getMessage()));
        }

        @Override
        public void close() {
            if (!failed) {
                span.setStatus(StatusCode.OK);
            }
            span.end();
        }
    }
}
