package com.legal.extraction.pipeline;

import com.legal.extraction.audit.AuditTrail;
import com.legal.extraction.config.PipelineConfig;
import com.legal.extraction.core.model.Candidate;
import com.legal.extraction.core.model.ExtractionMethod;
import com.legal.extraction.core.model.MergedRecord;
import com.legal.extraction.core.model.ReviewStatus;
import com.legal.extraction.enhance.EmbeddingModel;
import com.legal.extraction.enhance.EnhancementAdapter;
import com.legal.extraction.enhance.EnhancementDocument;
import com.legal.extraction.extract.PageText;
import com.legal.extraction.extract.PatternExtractor;
import com.legal.extraction.logging.LogContext;
import com.legal.extraction.merge.MergeResult;
import com.legal.extraction.merge.ResultMerger;
import com.legal.extraction.metrics.MetricsService;
import com.legal.extraction.metrics.NoOpMetricsService;
import com.legal.extraction.review.ConfidenceRouter;
import com.legal.extraction.review.InMemoryReviewQueue;
import com.legal.extraction.review.ReviewQueue;
import com.legal.extraction.review.ReviewService;
import com.legal.extraction.tracing.PipelineTracer;
import com.legal.extraction.tracing.TraceScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Processes one document end to end.
 *
 * <ol>
 *   <li>deterministic extraction of every page</li>
 *   <li>enhancement adapters, in parallel, all bounded by the document deadline</li>
 *   <li>merge into canonical records</li>
 *   <li>confidence routing into accepted records and the review queue</li>
 * </ol>
 *
 * <p>A document's work shares no mutable state with other documents except the review queue,
 * audit trail and metrics, which are thread-safe. Any unexpected failure turns into
 * {@link DocumentResult#failed}.</p>
 *
 * <pre>
 * try (ExtractionPipeline pipeline = ExtractionPipeline.builder()
 *         .config(PipelineConfigLoader.load())
 *         .adapter(OllamaEnhancementAdapter.builder().build())
 *         .build()) {
 *     DocumentResult result = pipeline.process(DocumentInput.of("doc-1", pageText));
 * }
 * </pre>
 */
public class ExtractionPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

    private final PipelineConfig config;
    private final PatternExtractor extractor;
    private final List<EnhancementAdapter> adapters;
    private final ResultMerger merger;
    private final ConfidenceRouter router;
    private final ReviewQueue reviewQueue;
    private final ReviewService reviewService;
    private final MetricsService metrics;
    private final AuditTrail auditTrail;
    private final PipelineTracer tracer;
    private final ExecutorService adapterExecutor;
    private final boolean ownsExecutor;
    private final AdapterInvoker invoker;

    private ExtractionPipeline(Builder builder) {
        this.config = builder.config != null ? builder.config : PipelineConfig.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : NoOpMetricsService.INSTANCE;
        this.auditTrail = builder.auditTrail != null ? builder.auditTrail : new AuditTrail();
        this.tracer = builder.tracer != null ? builder.tracer : PipelineTracer.noop();
        this.extractor = builder.extractor != null ? builder.extractor
                : new PatternExtractor(config.getMaxLookaheadLines());
        this.adapters = List.copyOf(builder.adapters);
        this.merger = builder.merger != null ? builder.merger : ResultMerger.builder()
                .config(config)
                .embeddingModel(builder.embeddingModel)
                .metrics(metrics)
                .auditTrail(auditTrail)
                .build();
        this.reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();
        this.router = new ConfidenceRouter(config, reviewQueue, metrics, auditTrail);
        this.reviewService = builder.reviewService != null ? builder.reviewService
                : new ReviewService(reviewQueue, metrics, auditTrail);
        this.ownsExecutor = builder.adapterExecutor == null;
        this.adapterExecutor = ownsExecutor ? newAdapterExecutor() : builder.adapterExecutor;
        this.invoker = new AdapterInvoker(adapterExecutor, config, metrics, auditTrail, tracer);
    }

    public DocumentResult process(DocumentInput input) {
        return process(input, List.of());
    }

    /**
     * Processes a document on top of records produced by an earlier run of the same document.
     * Candidates already recorded there are not merged twice.
     */
    public DocumentResult process(DocumentInput input, Collection<MergedRecord> existing) {
        String documentId = input.documentId();
        long started = System.nanoTime();
        long deadline = System.currentTimeMillis() + config.getDocumentTimeoutMs();

        try (LogContext ctx = LogContext.forDocument(documentId);
             TraceScope span = tracer.startStage("document", documentId)) {
            try {
                List<Candidate> candidates = new ArrayList<>(extractDeterministic(input));
                List<String> degraded = new ArrayList<>();
                candidates.addAll(enhance(input, deadline, degraded));

                MergeResult merged;
                try (TraceScope mergeSpan = tracer.startStage("merge", documentId)) {
                    merged = merger.merge(documentId, existing, candidates);
                    mergeSpan.annotate("extraction.records", merged.records().size());
                }

                Map<ReviewStatus, Integer> routed = new EnumMap<>(ReviewStatus.class);
                for (MergedRecord record : merged.records()) {
                    routed.merge(router.route(record), 1, Integer::sum);
                }
                reviewService.register(merged.records());

                Duration took = Duration.ofNanos(System.nanoTime() - started);
                metrics.recordDocumentDuration("success", took);
                span.annotate("extraction.candidates", candidates.size());
                span.annotate("extraction.records", merged.records().size());
                log.info("document.completed documentId={} candidates={} records={} accepted={} pending={} degraded={} durationMs={}",
                        documentId, candidates.size(), merged.records().size(),
                        routed.getOrDefault(ReviewStatus.ACCEPTED, 0), routed.getOrDefault(ReviewStatus.PENDING, 0),
                        degraded, took.toMillis());
                return DocumentResult.completed(documentId, merged.records(), merged.stats(), degraded, took);
            } catch (RuntimeException e) {
                Duration took = Duration.ofNanos(System.nanoTime() - started);
                span.fail(e);
                metrics.recordDocumentDuration("failed", took);
                log.error("document.failed documentId={} error={}", documentId, e.getMessage(), e);
                return DocumentResult.failed(documentId, e.getClass().getSimpleName() + ": " + e.getMessage(), took);
            }
        }
    }

    private List<Candidate> extractDeterministic(DocumentInput input) {
        List<Candidate> candidates = new ArrayList<>();
        Map<ExtractionMethod, Integer> perMethod = new EnumMap<>(ExtractionMethod.class);
        try (TraceScope span = tracer.startStage("extract", input.documentId())) {
            for (PageText page : input.pages()) {
                for (Candidate candidate : extractor.extract(page)) {
                    candidates.add(candidate);
                    perMethod.merge(candidate.getExtractionMethod(), 1, Integer::sum);
                }
            }
            span.annotate("extraction.candidates", candidates.size());
        }
        perMethod.forEach(metrics::recordCandidates);
        log.debug("extract.completed documentId={} pages={} candidates={}",
                input.documentId(), input.pages().size(), candidates.size());
        return candidates;
    }

    /**
     * Runs the adapters in parallel, each behind its own readiness check. Contributions are
     * concatenated in adapter registration order; an adapter still running at the deadline is dropped.
     */
    private List<Candidate> enhance(DocumentInput input, long deadline, List<String> degraded) {
        EnhancementDocument document = new EnhancementDocument(input.documentId(), input.pages());
        List<CompletableFuture<AdapterContribution>> futures = new ArrayList<>(adapters.size());
        for (EnhancementAdapter adapter : adapters) {
            futures.add(CompletableFuture.supplyAsync(() -> invoker.invoke(adapter, document, deadline), adapterExecutor));
        }

        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < adapters.size(); i++) {
            EnhancementAdapter adapter = adapters.get(i);
            CompletableFuture<AdapterContribution> future = futures.get(i);
            try {
                long remaining = Math.max(0, deadline - System.currentTimeMillis());
                AdapterContribution contribution = future.get(remaining, TimeUnit.MILLISECONDS);
                if (contribution.isDegraded()) {
                    degraded.add(contribution.adapterName());
                } else {
                    candidates.addAll(contribution.candidates());
                }
            } catch (TimeoutException | CancellationException e) {
                future.cancel(true);
                degraded.add(adapter.getName());
                log.warn("adapter.dropped adapter={} documentId={} reason=document_timeout",
                        adapter.getName(), input.documentId());
            } catch (ExecutionException e) {
                degraded.add(adapter.getName());
                log.warn("adapter.dropped adapter={} documentId={} error={}",
                        adapter.getName(), input.documentId(), String.valueOf(e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                degraded.add(adapter.getName());
                break;
            }
        }
        return candidates;
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }

    public ReviewService getReviewService() {
        return reviewService;
    }

    public AuditTrail getAuditTrail() {
        return auditTrail;
    }

    public PipelineConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        adapterExecutor.shutdown();
        try {
            if (!adapterExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                adapterExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            adapterExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ExecutorService newAdapterExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "extraction-adapter-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PipelineConfig config;
        private PatternExtractor extractor;
        private final List<EnhancementAdapter> adapters = new ArrayList<>();
        private EmbeddingModel embeddingModel;
        private ResultMerger merger;
        private ReviewQueue reviewQueue;
        private ReviewService reviewService;
        private MetricsService metrics;
        private AuditTrail auditTrail;
        private PipelineTracer tracer;
        private ExecutorService adapterExecutor;

        public Builder config(PipelineConfig config) {
            this.config = config;
            return this;
        }

        public Builder extractor(PatternExtractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder adapter(EnhancementAdapter adapter) {
            this.adapters.add(adapter);
            return this;
        }

        public Builder adapters(List<EnhancementAdapter> adapters) {
            this.adapters.addAll(adapters);
            return this;
        }

        /**
         * Used by the default merger. Ignored when {@link #merger} is set.
         */
        public Builder embeddingModel(EmbeddingModel embeddingModel) {
            this.embeddingModel = embeddingModel;
            return this;
        }

        public Builder merger(ResultMerger merger) {
            this.merger = merger;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder reviewService(ReviewService reviewService) {
            this.reviewService = reviewService;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder auditTrail(AuditTrail auditTrail) {
            this.auditTrail = auditTrail;
            return this;
        }

        public Builder tracer(PipelineTracer tracer) {
            this.tracer = tracer;
            return this;
        }

        /**
         * Executor for adapter calls. The pipeline does not shut down an executor it did not create.
         */
        public Builder adapterExecutor(ExecutorService adapterExecutor) {
            this.adapterExecutor = adapterExecutor;
            return this;
        }

        public ExtractionPipeline build() {
            return new ExtractionPipeline(this);
        }
    }
}
