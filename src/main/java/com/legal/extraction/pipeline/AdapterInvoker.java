package com.legal.extraction.pipeline;

import com.legal.extraction.audit.AuditAction;
import com.legal.extraction.audit.AuditTrail;
import com.legal.extraction.config.PipelineConfig;
import com.legal.extraction.core.model.Candidate;
import com.legal.extraction.enhance.AdapterTimeoutException;
import com.legal.extraction.enhance.AdapterUnavailableException;
import com.legal.extraction.enhance.EnhancementAdapter;
import com.legal.extraction.enhance.EnhancementDocument;
import com.legal.extraction.enhance.EnhancementException;
import com.legal.extraction.logging.LogContext;
import com.legal.extraction.metrics.MetricsService;
import com.legal.extraction.tracing.PipelineTracer;
import com.legal.extraction.tracing.TraceScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls one enhancement adapter with a per-call timeout and bounded retries.
 *
 * <p>Each attempt runs on the executor and is awaited for at most {@code adapterTimeoutMs},
 * further capped by the document deadline. Failed attempts are retried up to
 * {@code adapterRetryCount} times after {@code retryBackoffMs * 2^attempt}. The adapter's
 * readiness check runs first under the same bounds; an adapter that reports itself unavailable
 * is skipped, one whose check throws or hangs is degraded. An unavailable adapter is not retried. Whatever goes wrong, the caller gets an empty, degraded contribution
 * and never an exception.</p>
 */
public class AdapterInvoker {
    private static final Logger log = LoggerFactory.getLogger(AdapterInvoker.class);

    private final ExecutorService executor;
    private final Duration adapterTimeout;
    private final int retryCount;
    private final long retryBackoffMs;
    private final MetricsService metrics;
    private final AuditTrail auditTrail;
    private final PipelineTracer tracer;

    public AdapterInvoker(ExecutorService executor, PipelineConfig config, MetricsService metrics,
                          AuditTrail auditTrail, PipelineTracer tracer) {
        this.executor = executor;
        this.adapterTimeout = config.getAdapterTimeout();
        this.retryCount = config.getAdapterRetryCount();
        this.retryBackoffMs = config.getRetryBackoffMs();
        this.metrics = metrics;
        this.auditTrail = auditTrail;
        this.tracer = tracer;
    }

    /**
     * @param deadline epoch millis after which no attempt is started or awaited
     */
    public AdapterContribution invoke(EnhancementAdapter adapter, EnhancementDocument document, long deadline) {
        String name = adapter.getName();
        String documentId = document.documentId();
        try (LogContext ctx = LogContext.forAdapter(documentId, name);
             TraceScope span = tracer.startStage("enhance", documentId)) {
            span.annotate("extraction.adapter", name);

            long untilDeadline = deadline - System.currentTimeMillis();
            if (untilDeadline <= 0) {
                return degrade(adapter, documentId, 0, "document_timeout", span);
            }
            try {
                if (!checkReadiness(adapter, Math.min(adapterTimeout.toMillis(), untilDeadline))) {
                    log.info("adapter.skipped adapter={} documentId={} reason=unavailable", name, documentId);
                    span.annotate("extraction.skipped", "unavailable");
                    return AdapterContribution.skipped(name);
                }
            } catch (AdapterUnavailableException e) {
                log.warn("adapter.readiness_failed adapter={} documentId={} error={}", name, documentId, e.getMessage());
                return degrade(adapter, documentId, 0, "unavailable", span);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return degrade(adapter, documentId, 0, "interrupted", span);
            }

            EnhancementException lastFailure = null;
            int attempt = 0;
            while (attempt <= retryCount) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    return degrade(adapter, documentId, attempt, "document_timeout", span);
                }
                long waitMs = Math.min(adapterTimeout.toMillis(), remaining);
                long started = System.nanoTime();
                try {
                    List<Candidate> candidates = callOnce(adapter, document, waitMs);
                    Duration took = Duration.ofNanos(System.nanoTime() - started);
                    metrics.recordAdapterCall(name, "success", took);
                    metrics.recordCandidates(adapter.getExtractionMethod(), candidates.size());
                    span.annotate("extraction.candidates", candidates.size());
                    log.info("adapter.completed adapter={} documentId={} candidates={} attempt={} durationMs={}",
                            name, documentId, candidates.size(), attempt + 1, took.toMillis());
                    return AdapterContribution.succeeded(name, candidates, attempt + 1);
                } catch (AdapterUnavailableException e) {
                    metrics.recordAdapterCall(name, "unavailable", Duration.ofNanos(System.nanoTime() - started));
                    log.warn("adapter.unavailable adapter={} documentId={} error={}", name, documentId, e.getMessage());
                    return degrade(adapter, documentId, attempt + 1, "unavailable", span);
                } catch (EnhancementException e) {
                    lastFailure = e;
                    String outcome = e instanceof AdapterTimeoutException ? "timeout" : "error";
                    metrics.recordAdapterCall(name, outcome, Duration.ofNanos(System.nanoTime() - started));
                    log.warn("adapter.attempt_failed adapter={} documentId={} attempt={} outcome={} error={}",
                            name, documentId, attempt + 1, outcome, e.getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return degrade(adapter, documentId, attempt + 1, "interrupted", span);
                }

                attempt++;
                if (attempt <= retryCount && !backoff(attempt - 1, deadline)) {
                    return degrade(adapter, documentId, attempt, "interrupted", span);
                }
            }
            String reason = lastFailure instanceof AdapterTimeoutException ? "timeout" : "retries_exhausted";
            if (lastFailure != null) {
                span.fail(lastFailure);
            }
            return degrade(adapter, documentId, attempt, reason, span);
        }
    }

    /**
     * Runs the adapter's readiness check on the executor, bounded like a call.
     *
     * @throws AdapterUnavailableException if the check throws or does not answer in time
     */
    private boolean checkReadiness(EnhancementAdapter adapter, long waitMs) throws InterruptedException {
        Future<Boolean> future = executor.submit(adapter::isAvailable);
        try {
            return Boolean.TRUE.equals(future.get(waitMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AdapterUnavailableException(adapter.getName(),
                    "Readiness check did not answer within " + waitMs + "ms");
        } catch (ExecutionException e) {
            throw new AdapterUnavailableException(adapter.getName(),
                    "Readiness check failed: " + e.getCause(), e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private List<Candidate> callOnce(EnhancementAdapter adapter, EnhancementDocument document, long waitMs)
            throws InterruptedException {
        Future<List<Candidate>> future = executor.submit(() -> adapter.enrich(document));
        try {
            List<Candidate> candidates = future.get(waitMs, TimeUnit.MILLISECONDS);
            return candidates != null ? candidates : List.of();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AdapterTimeoutException(adapter.getName(), Duration.ofMillis(waitMs));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EnhancementException enhancement) {
                throw enhancement;
            }
            throw new EnhancementException(adapter.getName(), "Adapter failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    /**
     * Sleeps {@code retryBackoffMs * 2^attempt}, never past the deadline.
     *
     * @return false if interrupted
     */
    private boolean backoff(int attempt, long deadline) {
        long delay = retryBackoffMs * (1L << Math.min(attempt, 20));
        long sleep = Math.min(delay, Math.max(0, deadline - System.currentTimeMillis()));
        if (sleep <= 0) {
            return true;
        }
        try {
            Thread.sleep(sleep);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private AdapterContribution degrade(EnhancementAdapter adapter, String documentId, int attempts, String reason,
                                        TraceScope span) {
        span.annotate("extraction.degraded", reason);
        auditTrail.record(AuditAction.ADAPTER_DEGRADED, documentId, adapter.getName(),
                Map.of("reason", reason, "attempts", attempts));
        log.warn("adapter.degraded adapter={} documentId={} reason={} attempts={}",
                adapter.getName(), documentId, reason, attempts);
        return AdapterContribution.degraded(adapter.getName(), attempts, reason);
    }
}
