package com.legal.extraction.merge;

import com.legal.extraction.audit.AuditAction;
import com.legal.extraction.audit.AuditTrail;
import com.legal.extraction.canonical.CanonicalForm;
import com.legal.extraction.canonical.Canonicalizer;
import com.legal.extraction.config.PipelineConfig;
import com.legal.extraction.core.model.Candidate;
import com.legal.extraction.core.model.CanonicalKey;
import com.legal.extraction.core.model.MergedRecord;
import com.legal.extraction.core.model.Provenance;
import com.legal.extraction.enhance.EmbeddingModel;
import com.legal.extraction.enhance.EnhancementException;
import com.legal.extraction.logging.LogContext;
import com.legal.extraction.metrics.MetricsService;
import com.legal.extraction.metrics.NoOpMetricsService;
import com.legal.extraction.similarity.CandidateSimilarityScorer;
import com.legal.extraction.similarity.CandidateSimilarityScorer.SimilarityBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reconciles the candidates of one document into {@link MergedRecord}s.
 *
 * <ol>
 *   <li>Malformed candidates are dropped and logged.</li>
 *   <li>Candidates with a parsed key are grouped by exact key.</li>
 *   <li>Candidates with a fallback key are then compared against every record of the same kind;
 *       the best match at or above the fuzzy threshold absorbs them, otherwise they form or join
 *       a record under their own fallback key.</li>
 *   <li>Each addition appends provenance, may replace the best text, and re-aggregates confidence.</li>
 * </ol>
 *
 * <p>The merger is deterministic for a given input order and is meant to run on one thread
 * per document. Candidates already present in the given record set are skipped, so merging the
 * same candidates twice leaves the records unchanged.</p>
 */
public class ResultMerger {
    private static final Logger log = LoggerFactory.getLogger(ResultMerger.class);

    private static final double SCORE_EPSILON = 1e-9;

    private final PipelineConfig config;
    private final Canonicalizer canonicalizer;
    private final CandidateSimilarityScorer scorer;
    private final EmbeddingModel embeddingModel;
    private final MetricsService metrics;
    private final AuditTrail auditTrail;

    private ResultMerger(Builder builder) {
        this.config = builder.config != null ? builder.config : PipelineConfig.defaults();
        this.canonicalizer = builder.canonicalizer != null ? builder.canonicalizer : new Canonicalizer();
        this.scorer = builder.scorer != null ? builder.scorer
                : new CandidateSimilarityScorer(this.config.getSimilarityWeights());
        this.embeddingModel = builder.embeddingModel;
        this.metrics = builder.metrics != null ? builder.metrics : NoOpMetricsService.INSTANCE;
        this.auditTrail = builder.auditTrail != null ? builder.auditTrail : new AuditTrail();
    }

    public MergeResult merge(String documentId, List<Candidate> candidates) {
        return merge(documentId, List.of(), candidates);
    }

    /**
     * Merges candidates into an existing record set of the same document. The given records
     * are updated in place and included in the result.
     */
    public MergeResult merge(String documentId, Collection<MergedRecord> existing, List<Candidate> candidates) {
        Objects.requireNonNull(documentId, "documentId is required");
        try (LogContext ctx = LogContext.forMerge(documentId)) {
            MergeRun run = new MergeRun(documentId, existing);
            run.execute(candidates);
            MergeStats stats = run.stats(candidates.size());
            log.info("merge.completed documentId={} received={} records={} created={} merged={} fuzzy={} skipped={} dropped={}",
                    documentId, stats.received(), run.records.size(), stats.created(), stats.merged(),
                    stats.fuzzyMatched(), stats.skipped(), stats.dropped());
            return new MergeResult(new ArrayList<>(run.records.values()), stats, run.dropped);
        }
    }

    /**
     * State of a single merge call. Kept separate so the merger itself stays stateless.
     */
    private final class MergeRun {
        private final String documentId;
        private final Map<CanonicalKey, MergedRecord> records = new LinkedHashMap<>();
        private final Map<String, List<String>> matchTexts = new HashMap<>();
        private final Set<String> seenCandidateIds = new HashSet<>();
        private final Map<String, float[]> embeddings = new HashMap<>();
        private final List<MergeResult.DroppedCandidate> dropped = new ArrayList<>();
        private boolean embeddingsEnabled;
        private int created;
        private int merged;
        private int fuzzy;
        private int skipped;
        private int conflicts;

        MergeRun(String documentId, Collection<MergedRecord> existing) {
            this.documentId = documentId;
            this.embeddingsEnabled = embeddingModel != null;
            for (MergedRecord record : existing) {
                if (!record.getDocumentId().equals(documentId)) {
                    throw new IllegalArgumentException("Record " + record.getRecordId()
                            + " does not belong to document " + documentId);
                }
                records.put(record.getKey(), record);
                List<String> texts = new ArrayList<>();
                for (Provenance p : record.getProvenance()) {
                    seenCandidateIds.add(p.candidateId());
                    texts.add(matchTextOf(record, p));
                }
                matchTexts.put(record.getRecordId(), texts);
            }
        }

        void execute(List<Candidate> candidates) {
            List<Candidate> valid = new ArrayList<>();
            Map<String, CanonicalForm> forms = new HashMap<>();
            for (Candidate candidate : candidates) {
                if (!accept(candidate)) {
                    continue;
                }
                valid.add(candidate);
                forms.put(candidate.getCandidateId(), canonicalizer.canonicalize(candidate));
            }

            // exact keys first so that approximate matching sees every parsed group
            for (Candidate candidate : valid) {
                CanonicalForm form = forms.get(candidate.getCandidateId());
                if (!form.isFallback()) {
                    addToKey(form.key(), candidate, form);
                }
            }
            for (Candidate candidate : valid) {
                CanonicalForm form = forms.get(candidate.getCandidateId());
                if (form.isFallback()) {
                    mergeFallback(candidate, form);
                }
            }
        }

        private boolean accept(Candidate candidate) {
            try {
                CandidateValidator.validate(candidate, documentId);
            } catch (MalformedCandidateException e) {
                log.warn("merge.candidate_dropped documentId={} candidateId={} reason={}",
                        documentId, e.getCandidateId(), e.getReason());
                dropped.add(new MergeResult.DroppedCandidate(e.getCandidateId(), e.getReason()));
                metrics.incrementCandidateDropped(e.getReason());
                auditTrail.record(AuditAction.CANDIDATE_DROPPED, documentId, e.getCandidateId(),
                        Map.of("reason", e.getReason()));
                return false;
            }
            if (!seenCandidateIds.add(candidate.getCandidateId())) {
                skipped++;
                log.debug("merge.candidate_skipped documentId={} candidateId={}", documentId, candidate.getCandidateId());
                return false;
            }
            return true;
        }

        private void mergeFallback(Candidate candidate, CanonicalForm form) {
            MergedRecord exact = records.get(form.key());
            MergedRecord target = bestApproximateMatch(candidate, form);
            if (target != null && target != exact) {
                fuzzy++;
                metrics.incrementFuzzyMatched(candidate.getKind());
                auditTrail.record(AuditAction.FUZZY_MATCHED, documentId, target.getRecordId(),
                        Map.of("candidateId", candidate.getCandidateId(), "fallbackKey", form.key().value()));
                append(target, candidate, form);
                return;
            }
            addToKey(form.key(), candidate, form);
        }

        private MergedRecord bestApproximateMatch(Candidate candidate, CanonicalForm form) {
            MergedRecord best = null;
            double bestScore = -1.0;
            for (MergedRecord record : records.values()) {
                if (record.getKind() != candidate.getKind()) {
                    continue;
                }
                double score = similarityTo(record, form.matchText());
                if (score < config.getFuzzyMatchThreshold()) {
                    continue;
                }
                if (best == null || score > bestScore + SCORE_EPSILON) {
                    best = record;
                    bestScore = score;
                } else if (Math.abs(score - bestScore) <= SCORE_EPSILON && prefers(record, best)) {
                    best = record;
                }
            }
            if (best != null) {
                log.debug("merge.fuzzy_match candidateId={} record={} score={}",
                        candidate.getCandidateId(), best.getRecordId(), bestScore);
            }
            return best;
        }

        /**
         * Tie-break between equally similar records. Iteration follows creation order, so a
         * record only displaces the current best when it is strictly preferred.
         */
        private boolean prefers(MergedRecord challenger, MergedRecord incumbent) {
            return switch (config.getTieBreakPolicy()) {
                case MORE_EVIDENCE -> challenger.evidenceCount() > incumbent.evidenceCount();
                case HIGHER_CONFIDENCE -> challenger.getConfidence() > incumbent.getConfidence();
            };
        }

        private double similarityTo(MergedRecord record, String matchText) {
            double best = 0.0;
            for (String memberText : matchTexts.getOrDefault(record.getRecordId(), List.of())) {
                SimilarityBreakdown breakdown = scorer.score(matchText, memberText,
                        embeddingOf(matchText), embeddingOf(memberText));
                best = Math.max(best, breakdown.combined());
            }
            return best;
        }

        private float[] embeddingOf(String text) {
            if (!embeddingsEnabled || text == null || text.isEmpty()) {
                return null;
            }
            if (embeddings.containsKey(text)) {
                return embeddings.get(text);
            }
            try {
                float[] vector = embeddingModel.embed(text);
                embeddings.put(text, vector);
                return vector;
            } catch (EnhancementException e) {
                // one failure switches the whole run to lexical scoring so that scores stay comparable
                log.warn("merge.embeddings_disabled documentId={} model={} error={}",
                        documentId, embeddingModel.getName(), e.getMessage());
                embeddingsEnabled = false;
                embeddings.clear();
                return null;
            }
        }

        private void addToKey(CanonicalKey key, Candidate candidate, CanonicalForm form) {
            MergedRecord record = records.get(key);
            if (record == null) {
                record = new MergedRecord(documentId, key);
                records.put(key, record);
                matchTexts.put(record.getRecordId(), new ArrayList<>());
                created++;
                metrics.incrementRecordCreated(candidate.getKind());
                auditTrail.record(AuditAction.RECORD_CREATED, documentId, record.getRecordId(),
                        Map.of("candidateId", candidate.getCandidateId(), "method", candidate.getExtractionMethod().tag()));
                applyEvidence(record, candidate, form);
                return;
            }
            append(record, candidate, form);
        }

        private void append(MergedRecord record, Candidate candidate, CanonicalForm form) {
            merged++;
            metrics.incrementEvidenceMerged(candidate.getKind());
            auditTrail.record(AuditAction.EVIDENCE_MERGED, documentId, record.getRecordId(),
                    Map.of("candidateId", candidate.getCandidateId(), "method", candidate.getExtractionMethod().tag()));
            applyEvidence(record, candidate, form);
        }

        private void applyEvidence(MergedRecord record, Candidate candidate, CanonicalForm form) {
            record.appendEvidence(Provenance.of(candidate));
            matchTexts.get(record.getRecordId()).add(form.matchText());
            record.offerBestText(candidate.getRawText(), candidate.getConfidence());

            if (form.definitionText() != null) {
                String current = record.getDefinitionText();
                boolean replaced = record.offerDefinitionText(form.definitionText(), candidate.getConfidence());
                if (current != null && !current.equalsIgnoreCase(form.definitionText())) {
                    conflicts++;
                    log.debug("merge.definition_conflict record={} kept={}", record.getRecordId(),
                            replaced ? "incoming" : "current");
                }
            }
            record.raiseConfidence(ConfidenceAggregator.aggregate(record.getProvenance()));
        }

        private String matchTextOf(MergedRecord record, Provenance evidence) {
            Candidate replay = Candidate.builder()
                    .kind(record.getKind())
                    .rawText(evidence.excerpt())
                    .sourceDocumentId(evidence.documentId())
                    .page(Math.max(1, evidence.page()))
                    .extractionMethod(evidence.extractionMethod())
                    .build();
            return canonicalizer.canonicalize(replay).matchText();
        }

        MergeStats stats(int received) {
            return new MergeStats(received, created, merged, fuzzy, skipped, dropped.size(), conflicts);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PipelineConfig config;
        private Canonicalizer canonicalizer;
        private CandidateSimilarityScorer scorer;
        private EmbeddingModel embeddingModel;
        private MetricsService metrics;
        private AuditTrail auditTrail;

        public Builder config(PipelineConfig config) {
            this.config = config;
            return this;
        }

        public Builder canonicalizer(Canonicalizer canonicalizer) {
            this.canonicalizer = canonicalizer;
            return this;
        }

        public Builder scorer(CandidateSimilarityScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        /**
         * Optional semantic signal for approximate matching. Without it only the lexical ratio is used.
         */
        public Builder embeddingModel(EmbeddingModel embeddingModel) {
            this.embeddingModel = embeddingModel;
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

        public ResultMerger build() {
            return new ResultMerger(this);
        }
    }
}
