package com.legal.extraction.merge;

import com.legal.extraction.audit.AuditAction;
import com.legal.extraction.audit.AuditTrail;
import com.legal.extraction.config.PipelineConfig;
import com.legal.extraction.core.model.Candidate;
import com.legal.extraction.core.model.CandidateKind;
import com.legal.extraction.core.model.ExtractionMethod;
import com.legal.extraction.core.model.MergedRecord;
import com.legal.extraction.core.model.Provenance;
import com.legal.extraction.enhance.EmbeddingModel;
import com.legal.extraction.enhance.EnhancementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResultMergerTest {

    private static final String DOC = "doc-1";

    @Mock
    private EmbeddingModel embeddingModel;

    private AuditTrail auditTrail;
    private ResultMerger merger;

    @BeforeEach
    void setUp() {
        auditTrail = new AuditTrail();
        merger = ResultMerger.builder().auditTrail(auditTrail).build();
    }

    private static Candidate citation(String text, ExtractionMethod method, double confidence) {
        return Candidate.citation(text)
                .sourceDocumentId(DOC)
                .page(1)
                .extractionMethod(method)
                .confidence(confidence)
                .build();
    }

    private static MergedRecord only(MergeResult result) {
        assertEquals(1, result.records().size());
        return result.records().get(0);
    }

    @Nested
    @DisplayName("Exact keys")
    class ExactKeys {

        @Test
        @DisplayName("A resolution citing a decree-law and the decree-law itself stay two records")
        void secondInstrumentDoesNotMerge() {
            MergeResult result = merger.merge(DOC, List.of(
                    citation("Cabinet Resolution No. (52) of 2017 on the Executive Regulation of Federal Decree-Law No. (8) of 2017",
                            ExtractionMethod.AI_ENHANCEMENT, 0.8),
                    citation("Federal Decree-Law No. (8) of 2017 on Value Added Tax", ExtractionMethod.REGEX, 0.95)));

            assertEquals(2, result.records().size());
            assertEquals(Set.of("cabinet_resolution_52_2017", "federal_decree_law_8_2017"),
                    result.records().stream().map(r -> r.getKey().canonicalId()).collect(Collectors.toSet()));
        }

        @Test
        @DisplayName("Two surface forms of one decree-law become one corroborated record")
        void corroboratedCitation() {
            MergeResult result = merger.merge(DOC, List.of(
                    citation("Federal Decree-Law No. (7) of 2017", ExtractionMethod.REGEX, 0.95),
                    citation("Federal Decree Law 7/2017 on Excise Tax", ExtractionMethod.AI_ENHANCEMENT, 0.7)));

            MergedRecord record = only(result);
            assertEquals("federal_decree_law_7_2017", record.getKey().canonicalId());
            assertEquals("doc-1:federal_decree_law_7_2017", record.getRecordId());
            assertEquals(2, record.getProvenance().size());
            assertEquals(0.985, record.getConfidence(), 1e-9);
            assertTrue(record.getConfidence() > 0.95);
            assertEquals("Federal Decree-Law No. (7) of 2017", record.getBestText());

            MergeStats stats = result.stats();
            assertEquals(2, stats.received());
            assertEquals(1, stats.created());
            assertEquals(1, stats.merged());
            assertEquals(0, stats.fuzzyMatched());
        }

        @Test
        @DisplayName("A definition and its 'means' restatement become one record")
        void nearDuplicateDefinition() {
            Candidate colon = Candidate.definition("Authority", "The Federal Tax Authority.")
                    .sourceDocumentId(DOC)
                    .extractionMethod(ExtractionMethod.COLON_PATTERN)
                    .confidence(0.95)
                    .build();
            Candidate means = Candidate.builder()
                    .kind(CandidateKind.DEFINITION)
                    .rawText("The Authority means the Federal Tax Authority")
                    .sourceDocumentId(DOC)
                    .extractionMethod(ExtractionMethod.AI_ENHANCEMENT)
                    .confidence(0.6)
                    .build();

            MergeResult result = merger.merge(DOC, List.of(means, colon));

            MergedRecord record = only(result);
            assertEquals("authority", record.getKey().value());
            assertEquals("Authority: The Federal Tax Authority.", record.getBestText());
            assertEquals("The Federal Tax Authority.", record.getDefinitionText());
            assertEquals(Set.of("Authority: The Federal Tax Authority.", "The Authority means the Federal Tax Authority"),
                    record.getProvenance().stream().map(Provenance::excerpt).collect(Collectors.toSet()));
            assertEquals(0, result.stats().conflicts());
        }

        @Test
        @DisplayName("Repeated matches from one method do not raise confidence")
        void sameMethodCountsOnce() {
            MergeResult result = merger.merge(DOC, List.of(
                    citation("Federal Law No. (5) of 1985", ExtractionMethod.REGEX, 0.8),
                    citation("Federal Law No. 5 of 1985", ExtractionMethod.REGEX, 0.8)));

            assertEquals(0.8, only(result).getConfidence(), 1e-9);
        }

        @Test
        @DisplayName("Disagreeing definition bodies are counted as conflicts")
        void definitionConflict() {
            MergeResult result = merger.merge(DOC, List.of(
                    Candidate.definition("Authority", "The Federal Tax Authority.")
                            .sourceDocumentId(DOC).extractionMethod(ExtractionMethod.COLON_PATTERN)
                            .confidence(0.95).build(),
                    Candidate.definition("The Authority", "The competent local authority.")
                            .sourceDocumentId(DOC).extractionMethod(ExtractionMethod.LAYOUT)
                            .confidence(0.7).build()));

            assertEquals(1, result.stats().conflicts());
            assertEquals("The Federal Tax Authority.", only(result).getDefinitionText());
        }
    }

    @Nested
    @DisplayName("Approximate matching")
    class Approximate {

        @Test
        @DisplayName("An unparsable near-copy attaches to the parsed record")
        void fuzzyMatch() {
            MergeResult result = merger.merge(DOC, List.of(
                    citation("Federal Law No. (5) of 198", ExtractionMethod.AI_ENHANCEMENT, 0.6),
                    citation("Federal Law No. (5) of 1985", ExtractionMethod.REGEX, 0.95)));

            MergedRecord record = only(result);
            assertEquals("federal_law_5_1985", record.getKey().value());
            assertEquals(2, record.evidenceCount());
            assertEquals(1, result.stats().fuzzyMatched());
            assertEquals(1, auditTrail.getEntriesByAction(AuditAction.FUZZY_MATCHED).size());
        }

        @Test
        @DisplayName("An unrelated unparsable text becomes its own fallback record")
        void fallbackRecord() {
            MergeResult result = merger.merge(DOC, List.of(
                    citation("Federal Law No. (5) of 1985", ExtractionMethod.REGEX, 0.95),
                    citation("Federal Law concerning customs procedures", ExtractionMethod.AI_ENHANCEMENT, 0.5)));

            assertEquals(2, result.records().size());
            MergedRecord fallback = result.records().get(1);
            assertTrue(fallback.getKey().fallback());
            assertTrue(fallback.getKey().value().startsWith("unresolved_"));
            assertEquals(0.5, fallback.getConfidence(), 1e-9);
            assertEquals(0, result.stats().fuzzyMatched());
        }

        @Test
        @DisplayName("Matching is limited to records of the same kind")
        void sameKindOnly() {
            Candidate definition = Candidate.definition("Federal Law No 5 of 1985", "The civil code of the State.")
                    .sourceDocumentId(DOC).extractionMethod(ExtractionMethod.LAYOUT).confidence(0.6).build();

            MergeResult result = merger.merge(DOC, List.of(
                    definition,
                    citation("Federal Law No. (5) of 198", ExtractionMethod.AI_ENHANCEMENT, 0.6)));

            assertEquals(2, result.records().size());
            assertEquals(0, result.stats().fuzzyMatched());
        }

        @Test
        @DisplayName("Candidates merged later can attach to records from an earlier call")
        void matchesExistingRecords() {
            MergeResult first = merger.merge(DOC, List.of(
                    citation("Federal Law No. (5) of 1985", ExtractionMethod.REGEX, 0.95)));

            MergeResult second = merger.merge(DOC, first.records(), List.of(
                    citation("Federal Law No. (5) of 198", ExtractionMethod.AI_ENHANCEMENT, 0.6)));

            MergedRecord record = only(second);
            assertSame(first.records().get(0), record);
            assertEquals(2, record.evidenceCount());
            assertEquals(1, second.stats().fuzzyMatched());
        }
    }

    @Nested
    @DisplayName("Tie-breaks")
    class TieBreaks {

        private List<Candidate> tiedInput() {
            return List.of(
                    citation("Federal Law No. (5) of 1985", ExtractionMethod.REGEX, 0.95),
                    citation("Federal Law No. (6) of 1985", ExtractionMethod.REGEX, 0.6),
                    citation("Federal Law No. 6 of 1985", ExtractionMethod.AI_ENHANCEMENT, 0.5),
                    citation("Federal Law No. (x) of 1985", ExtractionMethod.AI_ENHANCEMENT, 0.4));
        }

        private MergedRecord winner(MergeResult result) {
            return result.records().stream()
                    .filter(r -> r.getProvenance().stream().anyMatch(p -> p.excerpt().contains("(x)")))
                    .findFirst()
                    .orElseThrow();
        }

        @Test
        @DisplayName("More evidence wins by default")
        void moreEvidence() {
            MergeResult result = merger.merge(DOC, tiedInput());

            assertEquals(2, result.records().size());
            assertEquals("federal_law_6_1985", winner(result).getKey().value());
        }

        @Test
        @DisplayName("Higher confidence wins when configured")
        void higherConfidence() {
            ResultMerger byConfidence = ResultMerger.builder()
                    .config(PipelineConfig.builder().tieBreakPolicy(TieBreakPolicy.HIGHER_CONFIDENCE).build())
                    .build();

            MergeResult result = byConfidence.merge(DOC, tiedInput());

            assertEquals("federal_law_5_1985", winner(result).getKey().value());
        }

        @Test
        @DisplayName("A full tie goes to the earliest record")
        void earliestRecord() {
            MergeResult result = merger.merge(DOC, List.of(
                    citation("Federal Law No. (5) of 1985", ExtractionMethod.REGEX, 0.9),
                    citation("Federal Law No. (6) of 1985", ExtractionMethod.REGEX, 0.9),
                    citation("Federal Law No. (x) of 1985", ExtractionMethod.AI_ENHANCEMENT, 0.4)));

            assertEquals("federal_law_5_1985", winner(result).getKey().value());
        }
    }

    @Nested
    @DisplayName("Embeddings")
    class Embeddings {

        @Test
        @DisplayName("Semantic similarity can lift a lexically weak match over the threshold")
        void semanticLift() {
            when(embeddingModel.embed(anyString())).thenReturn(new float[]{1f, 0f});
            ResultMerger semantic = ResultMerger.builder().embeddingModel(embeddingModel).build();
            List<Candidate> input = List.of(
                    citation("Federal Law No. (5) of 1985", ExtractionMethod.REGEX, 0.95),
                    citation("Federal Law No. (5) dated 1985", ExtractionMethod.AI_ENHANCEMENT, 0.6));

            assertEquals(2, merger.merge(DOC, input).records().size());
            assertEquals(1, semantic.merge(DOC, input).records().size());
        }

        @Test
        @DisplayName("An embedding failure switches the run to lexical scoring")
        void embeddingFailure() {
            when(embeddingModel.embed(anyString())).thenThrow(new EnhancementException("test-embedder", "down"));
            ResultMerger semantic = ResultMerger.builder().embeddingModel(embeddingModel).build();

            MergeResult result = semantic.merge(DOC, List.of(
                    citation("Federal Law No. (5) of 1985", ExtractionMethod.REGEX, 0.95),
                    citation("Federal Law No. (5) of 198", ExtractionMethod.AI_ENHANCEMENT, 0.6),
                    citation("Federal Law No. (5) of 19", ExtractionMethod.NER, 0.6)));

            assertEquals(1, result.records().size());
            assertEquals(2, result.stats().fuzzyMatched());
            verify(embeddingModel, times(1)).embed(anyString());
        }
    }

    @Nested
    @DisplayName("Input handling")
    class InputHandling {

        @Test
        @DisplayName("Malformed candidates are dropped and audited")
        void dropsMalformed() {
            Candidate outOfRange = citation("Federal Law No. (5) of 1985", ExtractionMethod.REGEX, 1.5);
            Candidate foreign = Candidate.citation("Federal Law No. (6) of 1985")
                    .sourceDocumentId("doc-2").extractionMethod(ExtractionMethod.REGEX).confidence(0.9).build();
            Candidate blank = citation(" ", ExtractionMethod.AI_ENHANCEMENT, 0.9);

            MergeResult result = merger.merge(DOC, List.of(outOfRange, foreign, blank,
                    citation("Cabinet Resolution No. 37 of 2017", ExtractionMethod.REGEX, 0.9)));

            assertEquals(1, result.records().size());
            assertEquals(3, result.stats().dropped());
            assertEquals(List.of("confidence_out_of_range", "foreign_document", "missing_text"),
                    result.dropped().stream().map(MergeResult.DroppedCandidate::reason).toList());
            assertEquals(3, auditTrail.getEntriesByAction(AuditAction.CANDIDATE_DROPPED).size());
        }

        @Test
        @DisplayName("Merging the same candidates again changes nothing")
        void idempotent() {
            List<Candidate> input = List.of(
                    citation("Federal Decree-Law No. (7) of 2017", ExtractionMethod.REGEX, 0.95),
                    citation("Federal Decree Law 7/2017 on Excise Tax", ExtractionMethod.AI_ENHANCEMENT, 0.7),
                    citation("Federal Law concerning customs procedures", ExtractionMethod.AI_ENHANCEMENT, 0.5));
            MergeResult first = merger.merge(DOC, input);
            double confidence = first.records().get(0).getConfidence();

            MergeResult second = merger.merge(DOC, first.records(), input);

            assertEquals(first.records().size(), second.records().size());
            assertEquals(3, second.stats().skipped());
            assertEquals(0, second.stats().created());
            assertEquals(2, second.records().get(0).evidenceCount());
            assertEquals(confidence, second.records().get(0).getConfidence());
        }

        @Test
        @DisplayName("Every accepted candidate ends up in exactly one record")
        void provenanceIsComplete() {
            List<Candidate> input = List.of(
                    citation("Federal Decree-Law No. (7) of 2017", ExtractionMethod.REGEX, 1.0),
                    citation("Federal Decree Law 7/2017", ExtractionMethod.NER, 0.0),
                    citation("Federal Law No. (5) of 198", ExtractionMethod.AI_ENHANCEMENT, 0.3),
                    citation("Cabinet Resolution No. 37 of 2017", ExtractionMethod.REGEX, 0.9));

            MergeResult result = merger.merge(DOC, input);

            List<String> recorded = result.records().stream()
                    .flatMap(r -> r.getProvenance().stream())
                    .map(Provenance::candidateId)
                    .toList();
            assertEquals(input.size(), recorded.size());
            assertEquals(input.stream().map(Candidate::getCandidateId).collect(Collectors.toSet()), Set.copyOf(recorded));
            result.records().forEach(r -> {
                assertTrue(r.getConfidence() >= 0.0 && r.getConfidence() <= 1.0);
                assertEquals(DOC, r.getDocumentId());
            });
        }

        @Test
        @DisplayName("Records of another document cannot be merged into")
        void foreignExistingRecords() {
            MergeResult other = merger.merge("doc-2", List.of(Candidate.citation("Federal Law No. (5) of 1985")
                    .sourceDocumentId("doc-2").extractionMethod(ExtractionMethod.REGEX).confidence(0.9).build()));

            assertThrows(IllegalArgumentException.class, () -> merger.merge(DOC, other.records(), List.of()));
        }
    }
}
