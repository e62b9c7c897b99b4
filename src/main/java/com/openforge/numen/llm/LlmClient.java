package com.openforge.numen.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.numen.error.ProviderException;
import com.openforge.numen.error.ProviderTimeoutException;
import com.openforge.numen.llm.model.ChatRequest;
import com.openforge.numen.llm.model.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Stateless HTTP client for one OpenAI-compatible completion provider.
 *
 * Synchronous by intent: the caller's worker thread blocks for the whole
 * call, and interrupting that thread aborts the request.
 */
@Slf4j
public class LlmClient {

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public ChatResponse chat(ChatRequest request) {
        String body = serialize(request);
        log.debug("[LlmClient:{}] → POST /chat/completions model={} body-length={}",
                config.name(), request.model(), body.length());

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderTimeoutException("Provider [%s] timed out after %ds"
                    .formatted(config.name(), config.timeoutSeconds()), e);
        } catch (IOException e) {
            throw new ProviderException("Network error calling provider [%s]".formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while calling provider [%s]".formatted(config.name()), e);
        }
        return parse(response);
    }

    public String name() {
        return config.name();
    }

    /** The model name configured for this provider (e.g. "gpt-4o-mini"). */
    public String modelName() {
        return config.model();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ChatResponse parse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();

        if (status == 429) {
            throw new ProviderException("Rate-limited by provider [%s]".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            throw new ProviderException("Provider [%s] returned HTTP %d: %s"
                    .formatted(config.name(), status, abbreviate(body)));
        }
        try {
            ChatResponse parsed = objectMapper.readValue(body, ChatResponse.class);
            log.debug("[LlmClient:{}] ← id={} usage={}", config.name(), parsed.id(), parsed.usage());
            return parsed;
        } catch (JsonProcessingException e) {
            throw new ProviderException("Unparseable response from provider [%s]".formatted(config.name()), e);
        }
    }

    private String serialize(ChatRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize chat request", e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 2048 ? body.substring(0, 2048) + "…" : body;
    }
}
