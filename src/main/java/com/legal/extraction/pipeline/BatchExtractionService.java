package com.legal.extraction.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Processes many documents in parallel on a fixed pool of {@code maxConcurrentDocuments}
 * threads. Every document is its own unit of work; a document that fails yields a failed
 * {@link DocumentResult} and never affects the others.
 */
public class BatchExtractionService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchExtractionService.class);

    private final ExtractionPipeline pipeline;
    private final ExecutorService executor;

    public BatchExtractionService(ExtractionPipeline pipeline) {
        this(pipeline, pipeline.getConfig().getMaxConcurrentDocuments());
    }

    public BatchExtractionService(ExtractionPipeline pipeline, int maxConcurrentDocuments) {
        if (maxConcurrentDocuments <= 0) {
            throw new IllegalArgumentException("maxConcurrentDocuments must be > 0");
        }
        this.pipeline = pipeline;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(maxConcurrentDocuments, runnable -> {
            Thread thread = new Thread(runnable, "extraction-document-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public CompletableFuture<DocumentResult> processAsync(DocumentInput input) {
        return CompletableFuture.supplyAsync(() -> processSafely(input), executor);
    }

    /**
     * Processes all documents and returns their results in input order.
     */
    public List<DocumentResult> processAll(List<DocumentInput> inputs) {
        long started = System.nanoTime();
        List<CompletableFuture<DocumentResult>> futures = inputs.stream()
                .map(this::processAsync)
                .toList();
        List<DocumentResult> results = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream().map(CompletableFuture::join).toList())
                .join();
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("batch.completed documents={} failed={} durationMs={}",
                results.size(), failed, Duration.ofNanos(System.nanoTime() - started).toMillis());
        return results;
    }

    private DocumentResult processSafely(DocumentInput input) {
        long started = System.nanoTime();
        try {
            return pipeline.process(input);
        } catch (RuntimeException e) {
            log.error("batch.document_failed documentId={} error={}", input.documentId(), e.toString(), e);
            return DocumentResult.failed(input.documentId(), e.toString(),
                    Duration.ofNanos(System.nanoTime() - started));
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
