package com.openforge.numen.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.numen.error.ProviderException;
import com.openforge.numen.error.ProviderTimeoutException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

/**
 * Embedding client over the OpenAI-compatible /embeddings endpoint, guarded
 * by the "embedding" circuit breaker. No retries: a failed embedding only
 * costs the turn its retrieved memories.
 */
@Slf4j
@Component
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingClient implements EmbeddingProvider {

    static final int MAX_INPUT_CHARS = 8000;

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;
    private final CircuitBreaker      circuitBreaker;

    public EmbeddingClient(HttpClient httpClient,
                           ObjectMapper objectMapper,
                           EmbeddingProperties props,
                           @Qualifier("embeddingCircuitBreaker") CircuitBreaker circuitBreaker) {
        this.httpClient     = httpClient;
        this.objectMapper   = objectMapper;
        this.props          = props;
        this.circuitBreaker = circuitBreaker;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * @return vector of {@link EmbeddingProperties#dimensions()} floats
     */
    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }
        String input = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;
        try {
            return circuitBreaker.executeSupplier(() -> call(input));
        } catch (CallNotPermittedException e) {
            throw new ProviderException("Embedding circuit is open", e);
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private float[] call(String input) {
        String body = serialize(new EmbeddingRequest(input, props.model(), props.dimensions()));
        log.debug("[Embed] → POST /embeddings model={} input-length={}", props.model(), input.length());

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/embeddings"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + props.apiKey())
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderTimeoutException("Embedding API timed out after %ds".formatted(props.timeoutSeconds()), e);
        } catch (IOException e) {
            throw new ProviderException("Network error calling embedding API", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while calling embedding API", e);
        }
        return parse(response);
    }

    private float[] parse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();

        if (status == 429) throw new ProviderException("Embedding API rate-limited");
        if (status < 200 || status >= 300) {
            throw new ProviderException("Embedding API returned HTTP %d: %s".formatted(status, body));
        }
        try {
            List<Float> vector = objectMapper.readValue(body, EmbeddingResponse.class).firstEmbedding();
            log.debug("[Embed] ← vector dim={}", vector.size());
            return VectorMath.toArray(vector);
        } catch (JsonProcessingException | IllegalStateException e) {
            throw new ProviderException("Failed to parse embedding response", e);
        }
    }

    private String serialize(EmbeddingRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize embedding request", e);
        }
    }
}
