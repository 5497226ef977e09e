package com.legal.extraction.tracing;

/**
 * Tracer used when no tracing backend is configured.
 */
final class NoOpPipelineTracer implements PipelineTracer {

    static final NoOpPipelineTracer INSTANCE = new NoOpPipelineTracer();

    private static final TraceScope SCOPE = new TraceScope() {
        @Override
        public TraceScope annotate(String key, String value) {
            return this;
        }

        @Override
        public TraceScope annotate(String key, long value) {
            return this;
        }

        @Override
        public void fail(Throwable cause) {
        }

        @Override
        public void close() {
        }
    };

    private NoOpPipelineTracer() {
    }

    @Override
    public TraceScope startStage(String stage, String documentId) {
        return SCOPE;
    }
}
