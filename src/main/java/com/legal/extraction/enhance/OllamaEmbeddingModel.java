package com.legal.extraction.enhance;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Embeddings from an Ollama server's {@code /api/embeddings} endpoint.
 */
public class OllamaEmbeddingModel implements EmbeddingModel {
    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingModel.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "nomic-embed-text";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OllamaEmbeddingModel(String baseUrl, String model, Duration timeout) {
        this.baseUrl = baseUrl != null ? baseUrl : DEFAULT_BASE_URL;
        this.model = model != null ? model : DEFAULT_MODEL;
        this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder().connectTimeout(this.timeout).build();
    }

    public OllamaEmbeddingModel() {
        this(null, null, null);
    }

    @Override
    public float[] embed(String text) {
        try {
            String body = objectMapper.writeValueAsString(new EmbeddingRequest(model, text));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/embeddings"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new EnhancementException(getName(), "Embedding request returned status " + response.statusCode());
            }
            EmbeddingResponse parsed = objectMapper.readValue(response.body(), EmbeddingResponse.class);
            if (parsed.embedding() == null || parsed.embedding().length == 0) {
                throw new EnhancementException(getName(), "Empty embedding returned");
            }
            log.trace("embedding.received model={} dimensions={}", model, parsed.embedding().length);
            return parsed.embedding();
        } catch (HttpTimeoutException e) {
            throw new AdapterTimeoutException(getName(), timeout);
        } catch (IOException e) {
            throw new AdapterUnavailableException(getName(), "Embedding call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EnhancementException(getName(), "Interrupted while embedding", e);
        }
    }

    @Override
    public String getName() {
        return "ollama-embed/" + model;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingRequest(String model, String prompt) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingResponse(float[] embedding) {}
}
