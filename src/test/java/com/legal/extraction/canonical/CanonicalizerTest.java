package com.legal.extraction.canonical;

import com.legal.extraction.core.model.Candidate;
import com.legal.extraction.core.model.CandidateKind;
import com.legal.extraction.core.model.ExtractionMethod;
import com.legal.extraction.core.model.InstrumentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalizerTest {

    private Canonicalizer canonicalizer;

    @BeforeEach
    void setUp() {
        canonicalizer = new Canonicalizer();
    }

    private static Candidate citation(String text) {
        return Candidate.citation(text)
                .sourceDocumentId("doc-1")
                .extractionMethod(ExtractionMethod.REGEX)
                .confidence(0.9)
                .build();
    }

    @Nested
    @DisplayName("Citations")
    class Citations {

        @ParameterizedTest
        @DisplayName("Surface variants of one instrument share a canonical id")
        @CsvSource(delimiter = '|', value = {
                "Federal Decree-Law No. (7) of 2017|federal_decree_law_7_2017",
                "Federal Decree Law 7/2017 on Excise Tax|federal_decree_law_7_2017",
                "Federal Decree-Law No.(7) of 2017, as amended|federal_decree_law_7_2017",
                "Federal Decree by Law No. 7 of 2017|federal_decree_law_7_2017",
                "Cabinet Resolution No. 37 of 2017|cabinet_resolution_37_2017",
                "Cabinet Decision No. (37) of the year 2017|cabinet_resolution_37_2017",
                "Federal Law No. (05) of 1985|federal_law_5_1985",
                "Federal Law No. 5 of 1985 on the Civil Transactions Law|federal_law_5_1985",
                "Ministerial Resolution No. (10) of 2020|ministerial_resolution_10_2020",
                "Federal Decree No. (12) of 2016|federal_decree_12_2016"
        })
        void canonicalIds(String text, String expectedId) {
            CanonicalForm form = canonicalizer.canonicalize(citation(text));

            assertFalse(form.isFallback());
            assertEquals(expectedId, form.key().canonicalId());
            assertEquals(CandidateKind.CITATION, form.key().kind());
        }

        @Test
        @DisplayName("Parsed citation exposes its parts and a standard display form")
        void parsedParts() {
            CanonicalForm form = canonicalizer.canonicalize(citation("Federal Decree Law 7/2017 on Excise Tax"));

            assertEquals(InstrumentType.FEDERAL_DECREE_LAW, form.key().type());
            assertEquals("7", form.key().number());
            assertEquals(2017, form.key().year());
            assertEquals("Federal Decree-Law No. (7) of 2017", form.displayText());
            assertNull(form.definitionText());
        }

        @ParameterizedTest
        @DisplayName("Text without a number or year gets a fallback key")
        @CsvSource(delimiter = '|', value = {
                "Federal Law concerning customs procedures",
                "Cabinet Resolution No. 37",
                "the implementing regulation of the excise tax"
        })
        void fallbackKeys(String text) {
            CanonicalForm form = canonicalizer.canonicalize(citation(text));

            assertTrue(form.isFallback());
            assertTrue(form.key().value().startsWith("unresolved_"));
            assertEquals("unresolved_".length() + 12, form.key().value().length());
            assertEquals(canonicalizer.normalizeCitation(text), form.matchText());
        }

        @Test
        @DisplayName("A resolution issued under a decree-law keeps its own key")
        void citationNamingAnotherInstrument() {
            CanonicalForm resolution = canonicalizer.canonicalize(citation(
                    "Cabinet Resolution No. (52) of 2017 on the Executive Regulation of Federal Decree-Law No. (8) of 2017"));
            CanonicalForm decreeLaw = canonicalizer.canonicalize(citation(
                    "Federal Decree-Law No. (8) of 2017 on Value Added Tax"));

            assertEquals("cabinet_resolution_52_2017", resolution.key().canonicalId());
            assertEquals("federal_decree_law_8_2017", decreeLaw.key().canonicalId());
            assertNotEquals(resolution.key(), decreeLaw.key());
        }

        @Test
        @DisplayName("Fallback keys are stable and distinct per text")
        void fallbackIsDeterministic() {
            CanonicalForm first = canonicalizer.canonicalize(citation("Federal Law concerning customs"));
            CanonicalForm again = canonicalizer.canonicalize(citation("Federal  Law concerning customs"));
            CanonicalForm other = canonicalizer.canonicalize(citation("Federal Law concerning excise"));

            assertEquals(first.key(), again.key());
            assertNotEquals(first.key(), other.key());
        }
    }

    @Nested
    @DisplayName("Definitions")
    class Definitions {

        @ParameterizedTest
        @DisplayName("Terms normalize to a case- and article-insensitive key")
        @CsvSource(delimiter = '|', value = {
                "Authority|authority",
                "The Authority|authority",
                "“Authority”|authority",
                "The Tax-Registration Number|tax registration number",
                "Excise  Goods|excise goods"
        })
        void termKeys(String term, String expected) {
            Candidate candidate = Candidate.definition(term, "The Federal Tax Authority.")
                    .sourceDocumentId("doc-1")
                    .extractionMethod(ExtractionMethod.COLON_PATTERN)
                    .confidence(0.95)
                    .build();

            assertEquals(expected, canonicalizer.canonicalize(candidate).key().value());
        }

        @Test
        @DisplayName("Raw 'means' text is split into term and body")
        void splitsMeansSentence() {
            Candidate candidate = Candidate.builder()
                    .kind(CandidateKind.DEFINITION)
                    .rawText("The Authority means the Federal Tax Authority")
                    .sourceDocumentId("doc-1")
                    .extractionMethod(ExtractionMethod.AI_ENHANCEMENT)
                    .confidence(0.6)
                    .build();

            CanonicalForm form = canonicalizer.canonicalize(candidate);

            assertEquals("authority", form.key().value());
            assertEquals("The Authority", form.displayText());
            assertEquals("the Federal Tax Authority.", form.definitionText());
        }

        @Test
        @DisplayName("Unsplittable definition text falls back")
        void definitionFallback() {
            Candidate candidate = Candidate.builder()
                    .kind(CandidateKind.DEFINITION)
                    .rawText("(12) above")
                    .sourceDocumentId("doc-1")
                    .extractionMethod(ExtractionMethod.LAYOUT)
                    .confidence(0.6)
                    .build();

            CanonicalForm form = canonicalizer.canonicalize(candidate);

            assertTrue(form.isFallback());
            assertTrue(form.key().value().startsWith("term_unresolved_"));
        }

        @Test
        @DisplayName("Definition bodies are cleaned")
        void normalizeDefinition() {
            assertEquals("The competent federal authority.",
                    canonicalizer.normalizeDefinition("The competent fed-\neral   authority"));
            assertEquals("Short text", canonicalizer.normalizeDefinition("Short  text"));
            assertNull(canonicalizer.normalizeDefinition("  "));
        }
    }
}
