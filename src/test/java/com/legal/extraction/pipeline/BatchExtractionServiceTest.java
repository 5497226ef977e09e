package com.legal.extraction.pipeline;

import com.legal.extraction.config.PipelineConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchExtractionServiceTest {

    private static DocumentInput document(int i) {
        return DocumentInput.of("doc-" + i, "Pursuant to Federal Law No. (" + i + ") of 1985 concerning Civil Transactions.");
    }

    @Test
    @DisplayName("Results come back in input order")
    void preservesInputOrder() {
        List<DocumentInput> inputs = IntStream.rangeClosed(1, 8).mapToObj(BatchExtractionServiceTest::document).toList();
        try (ExtractionPipeline pipeline = ExtractionPipeline.builder()
                .config(PipelineConfig.builder().maxConcurrentDocuments(3).build())
                .build();
             BatchExtractionService batch = new BatchExtractionService(pipeline)) {

            List<DocumentResult> results = batch.processAll(inputs);

            assertEquals(8, results.size());
            for (int i = 0; i < inputs.size(); i++) {
                DocumentResult result = results.get(i);
                assertEquals(inputs.get(i).documentId(), result.documentId());
                assertTrue(result.isSuccess());
                assertEquals("federal_law_" + (i + 1) + "_1985", result.records().get(0).getKey().canonicalId());
            }
        }
    }

    @Test
    @DisplayName("A document that throws does not affect the others")
    void failureIsIsolated(@Mock ExtractionPipeline pipeline) {
        when(pipeline.process(any(DocumentInput.class))).thenAnswer(invocation -> {
            DocumentInput input = invocation.getArgument(0);
            if (input.documentId().equals("doc-2")) {
                throw new IllegalStateException("cannot read page 1");
            }
            return DocumentResult.completed(input.documentId(), List.of(), null, List.of(), Duration.ZERO);
        });

        try (BatchExtractionService batch = new BatchExtractionService(pipeline, 2)) {
            List<DocumentResult> results = batch.processAll(List.of(document(1), document(2), document(3)));

            assertTrue(results.get(0).isSuccess());
            assertFalse(results.get(1).isSuccess());
            assertTrue(results.get(1).error().contains("cannot read page 1"));
            assertTrue(results.get(2).isSuccess());
        }
    }

    @Test
    @DisplayName("Single documents can be processed asynchronously")
    void processAsync() throws Exception {
        try (ExtractionPipeline pipeline = ExtractionPipeline.builder().build();
             BatchExtractionService batch = new BatchExtractionService(pipeline, 1)) {

            DocumentResult result = batch.processAsync(document(5)).get(10, TimeUnit.SECONDS);

            assertTrue(result.isSuccess());
            assertEquals(1, result.records().size());
        }
    }

    @Test
    @DisplayName("Concurrency must be positive")
    void rejectsNonPositiveConcurrency(@Mock ExtractionPipeline pipeline) {
        assertThrows(IllegalArgumentException.class, () -> new BatchExtractionService(pipeline, 0));
    }
}
