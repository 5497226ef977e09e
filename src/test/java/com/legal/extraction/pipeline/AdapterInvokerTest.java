package com.legal.extraction.pipeline;

import com.legal.extraction.audit.AuditAction;
import com.legal.extraction.audit.AuditEntry;
import com.legal.extraction.audit.AuditTrail;
import com.legal.extraction.config.PipelineConfig;
import com.legal.extraction.enhance.AdapterUnavailableException;
import com.legal.extraction.enhance.EnhancementDocument;
import com.legal.extraction.enhance.EnhancementException;
import com.legal.extraction.extract.PageText;
import com.legal.extraction.metrics.MicrometerMetricsService;
import com.legal.extraction.tracing.PipelineTracer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AdapterInvokerTest {

    private static final String DOC = "doc-1";
    private static final EnhancementDocument DOCUMENT =
            new EnhancementDocument(DOC, List.of(new PageText(DOC, 1, "Federal Law No. (5) of 1985")));

    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private AuditTrail auditTrail;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        registry = new SimpleMeterRegistry();
        auditTrail = new AuditTrail();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private AdapterInvoker invoker(int retries, long timeoutMs) {
        PipelineConfig config = PipelineConfig.builder()
                .adapterRetryCount(retries)
                .adapterTimeoutMs(timeoutMs)
                .retryBackoffMs(1)
                .build();
        return new AdapterInvoker(executor, config, new MicrometerMetricsService(registry), auditTrail,
                PipelineTracer.noop());
    }

    private static long farDeadline() {
        return System.currentTimeMillis() + 10_000;
    }

    @Test
    @DisplayName("A successful call returns the adapter's candidates")
    void success() {
        StubAdapter adapter = StubAdapter.returning("stub",
                StubAdapter.aiCitation(DOC, "Federal Law 5/1985", 0.7));

        AdapterContribution contribution = invoker(2, 1000).invoke(adapter, DOCUMENT, farDeadline());

        assertFalse(contribution.isDegraded());
        assertEquals(1, contribution.candidates().size());
        assertEquals(1, contribution.attempts());
        assertEquals(1.0, registry.get("extraction.adapter.duration")
                .tags("adapter", "stub", "outcome", "success").timer().count());
    }

    @Test
    @DisplayName("Transient failures are retried until the call succeeds")
    void retriesTransientFailures() {
        AtomicInteger failuresLeft = new AtomicInteger(2);
        StubAdapter adapter = new StubAdapter("flaky", doc -> {
            if (failuresLeft.getAndDecrement() > 0) {
                throw new EnhancementException("flaky", "HTTP 503");
            }
            return List.of(StubAdapter.aiCitation(DOC, "Federal Law 5/1985", 0.7));
        });

        AdapterContribution contribution = invoker(2, 1000).invoke(adapter, DOCUMENT, farDeadline());

        assertFalse(contribution.isDegraded());
        assertEquals(3, contribution.attempts());
        assertEquals(3, adapter.calls());
        assertEquals(2.0, registry.get("extraction.adapter.duration")
                .tags("adapter", "flaky", "outcome", "error").timer().count());
    }

    @Test
    @DisplayName("Exhausted retries degrade to an empty contribution and leave an audit entry")
    void exhaustedRetriesDegrade() {
        StubAdapter adapter = StubAdapter.failing("broken", new IllegalStateException("bad payload"));

        AdapterContribution contribution = invoker(2, 1000).invoke(adapter, DOCUMENT, farDeadline());

        assertTrue(contribution.isDegraded());
        assertTrue(contribution.candidates().isEmpty());
        assertEquals("retries_exhausted", contribution.failureReason());
        assertEquals(3, adapter.calls());

        List<AuditEntry> degraded = auditTrail.getEntriesByAction(AuditAction.ADAPTER_DEGRADED);
        assertEquals(1, degraded.size());
        assertEquals("broken", degraded.get(0).subjectId());
        assertEquals("retries_exhausted", degraded.get(0).details().get("reason"));
    }

    @Test
    @DisplayName("An unavailable adapter is not retried")
    void unavailableIsNotRetried() {
        StubAdapter adapter = StubAdapter.failing("offline",
                new AdapterUnavailableException("offline", "connection refused"));

        AdapterContribution contribution = invoker(2, 1000).invoke(adapter, DOCUMENT, farDeadline());

        assertEquals("unavailable", contribution.failureReason());
        assertEquals(1, adapter.calls());
    }

    @Test
    @DisplayName("A call that outlives its timeout degrades with reason timeout")
    void slowCallTimesOut() {
        StubAdapter adapter = StubAdapter.sleeping("slow", 5_000);

        long started = System.currentTimeMillis();
        AdapterContribution contribution = invoker(0, 50).invoke(adapter, DOCUMENT, farDeadline());

        assertEquals("timeout", contribution.failureReason());
        assertTrue(System.currentTimeMillis() - started < 4_000);
        assertEquals(1.0, registry.get("extraction.adapter.duration")
                .tags("adapter", "slow", "outcome", "timeout").timer().count());
    }

    @Test
    @DisplayName("No attempt is started once the document deadline has passed")
    void expiredDeadline() {
        StubAdapter adapter = StubAdapter.returning("late");

        AdapterContribution contribution = invoker(2, 1000)
                .invoke(adapter, DOCUMENT, System.currentTimeMillis() - 1);

        assertEquals("document_timeout", contribution.failureReason());
        assertEquals(0, adapter.calls());
    }

    @Test
    @DisplayName("An adapter that reports itself not ready is skipped without degradation")
    void notReadyIsSkipped() {
        StubAdapter adapter = StubAdapter.returning("cold").withReadiness(() -> false);

        AdapterContribution contribution = invoker(2, 1000).invoke(adapter, DOCUMENT, farDeadline());

        assertFalse(contribution.isDegraded());
        assertTrue(contribution.candidates().isEmpty());
        assertEquals(0, contribution.attempts());
        assertEquals(0, adapter.calls());
        assertTrue(auditTrail.getEntriesByAction(AuditAction.ADAPTER_DEGRADED).isEmpty());
    }

    @Test
    @DisplayName("A readiness check that throws degrades the adapter as unavailable")
    void throwingReadinessDegrades() {
        StubAdapter adapter = StubAdapter.returning("broken").withReadiness(() -> {
            throw new IllegalStateException("model not loaded");
        });

        AdapterContribution contribution = invoker(2, 1000).invoke(adapter, DOCUMENT, farDeadline());

        assertEquals("unavailable", contribution.failureReason());
        assertEquals(0, adapter.calls());
    }

    @Test
    @DisplayName("A readiness check that hangs degrades the adapter within the call timeout")
    void hangingReadinessDegrades() {
        StubAdapter adapter = StubAdapter.returning("stuck").withReadiness(() -> StubAdapter.hang(5_000));

        long started = System.currentTimeMillis();
        AdapterContribution contribution = invoker(0, 50).invoke(adapter, DOCUMENT, farDeadline());

        assertEquals("unavailable", contribution.failureReason());
        assertTrue(System.currentTimeMillis() - started < 4_000);
        assertEquals(0, adapter.calls());
    }
}
