package com.legal.extraction.enhance;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.legal.extraction.core.model.Candidate;
import com.legal.extraction.core.model.CandidateKind;
import com.legal.extraction.core.model.ExtractionMethod;
import com.legal.extraction.extract.PageText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Generative-model enhancement source backed by a local Ollama server.
 *
 * <p>Each page is sent in chunks of {@value TextChunker#DEFAULT_CHUNK_SIZE} characters with a
 * JSON-only prompt asking for citations and definitions. Model-reported confidence is capped at
 * {@value #MAX_CONFIDENCE}: the model is a corroborating source, never the sole authority.</p>
 *
 * <pre>
 * OllamaEnhancementAdapter adapter = OllamaEnhancementAdapter.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("llama3.2")
 *     .build();
 * </pre>
 */
public class OllamaEnhancementAdapter implements EnhancementAdapter {
    private static final Logger log = LoggerFactory.getLogger(OllamaEnhancementAdapter.class);

    static final double MAX_CONFIDENCE = 0.85;
    static final double DEFAULT_CONFIDENCE = 0.7;

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "llama3.2";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaEnhancementAdapter(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<Candidate> enrich(EnhancementDocument document) {
        List<Candidate> candidates = new ArrayList<>();
        for (PageText page : document.pages()) {
            for (String chunk : TextChunker.chunk(page.text(), TextChunker.DEFAULT_CHUNK_SIZE,
                    TextChunker.DEFAULT_OVERLAP)) {
                String answer = generate(buildPrompt(chunk));
                candidates.addAll(parseResponse(answer, document.documentId(), page.pageNumber()));
            }
        }
        log.info("enhance.completed adapter={} documentId={} candidates={}",
                getName(), document.documentId(), candidates.size());
        return candidates;
    }

    @Override
    public String getName() {
        return "ollama/" + model;
    }

    @Override
    public ExtractionMethod getExtractionMethod() {
        return ExtractionMethod.AI_ENHANCEMENT;
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/tags"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    String buildPrompt(String text) {
        return """
                You extract references to legal instruments and defined terms from legislation.

                Return ONLY a JSON object of this form:
                {"citations": [{"text": "...", "confidence": 0.0}],
                 "definitions": [{"term": "...", "definition": "...", "confidence": 0.0}]}

                Rules:
                - A citation names a law, decree-law, cabinet or ministerial resolution, or decree,
                  with its number and year, exactly as written in the text.
                - A definition is a term the text defines, with the full definition.
                - Confidence is between 0.0 and 1.0.
                - Use empty arrays when nothing is found.

                Text:
                """ + text;
    }

    private String generate(String prompt) {
        try {
            String body = objectMapper.writeValueAsString(new GenerateRequest(model, prompt, false, "json"));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/generate"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new EnhancementException(getName(),
                        "Ollama returned status " + response.statusCode() + ": " + response.body());
            }
            GenerateResponse parsed = objectMapper.readValue(response.body(), GenerateResponse.class);
            log.debug("Ollama response received, length: {}", parsed.response() != null ? parsed.response().length() : 0);
            return parsed.response();
        } catch (HttpTimeoutException e) {
            throw new AdapterTimeoutException(getName(), timeout);
        } catch (ConnectException e) {
            throw new AdapterUnavailableException(getName(), "Cannot connect to " + baseUrl, e);
        } catch (IOException e) {
            throw new EnhancementException(getName(), "Ollama call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EnhancementException(getName(), "Interrupted while calling Ollama", e);
        }
    }

    /**
     * Turns the model's JSON answer into candidates. Entries without text are skipped;
     * an answer that is not JSON at all yields nothing.
     */
    List<Candidate> parseResponse(String answer, String documentId, int page) {
        List<Candidate> candidates = new ArrayList<>();
        if (answer == null || answer.isBlank()) {
            return candidates;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(answer));
        } catch (JsonProcessingException e) {
            log.warn("enhance.unparsable adapter={} documentId={} page={} error={}",
                    getName(), documentId, page, e.getOriginalMessage());
            return candidates;
        }

        for (JsonNode node : root.path("citations")) {
            String text = node.path("text").asText("").strip();
            if (!text.isEmpty()) {
                candidates.add(Candidate.citation(text)
                        .page(page)
                        .sourceDocumentId(documentId)
                        .extractionMethod(ExtractionMethod.AI_ENHANCEMENT)
                        .confidence(cap(node.path("confidence").asDouble(DEFAULT_CONFIDENCE)))
                        .build());
            }
        }
        for (JsonNode node : root.path("definitions")) {
            String term = node.path("term").asText("").strip();
            String definition = node.path("definition").asText("").strip();
            if (!term.isEmpty() && !definition.isEmpty()) {
                candidates.add(Candidate.builder()
                        .kind(CandidateKind.DEFINITION)
                        .term(term)
                        .definitionText(definition)
                        .page(page)
                        .sourceDocumentId(documentId)
                        .extractionMethod(ExtractionMethod.AI_ENHANCEMENT)
                        .confidence(cap(node.path("confidence").asDouble(DEFAULT_CONFIDENCE)))
                        .build());
            }
        }
        return candidates;
    }

    private static double cap(double confidence) {
        if (Double.isNaN(confidence)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(MAX_CONFIDENCE, confidence));
    }

    private static String stripCodeFence(String answer) {
        String trimmed = answer.strip();
        if (trimmed.startsWith("```")) {
            trimmed = trimmed.replaceFirst("^```(?:json)?\\s*", "").replaceFirst("\\s*```$", "");
        }
        return trimmed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OllamaEnhancementAdapter build() {
            return new OllamaEnhancementAdapter(this);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record GenerateRequest(
            String model,
            String prompt,
            boolean stream,
            String format
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record GenerateResponse(
            String model,
            @JsonProperty("created_at") String createdAt,
            String response,
            boolean done
    ) {}
}
