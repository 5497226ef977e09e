package com.legal.extraction.tracing;

/**
 * Opens trace spans around pipeline stages (document, adapter call, merge, review import).
 */
public interface PipelineTracer {

    TraceScope startStage(String stage, String documentId);

    static PipelineTracer noop() {
        return NoOpPipelineTracer.INSTANCE;
    }
}
