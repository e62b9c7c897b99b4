package com.openforge.numen.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.numen.error.ProviderException;
import com.openforge.numen.llm.model.ChatRequest;
import com.openforge.numen.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.function.Supplier;

/**
 * Completion routing with circuit breaking.
 *
 *   complete(request)
 *     └─ primaryCircuitBreaker + primaryRetry (at most one immediate retry)
 *           └─ primaryClient.chat(request)
 *                 ↓ only when the primary circuit is OPEN
 *     └─ fallbackCircuitBreaker + fallbackRetry
 *           └─ fallbackClient.chat(request)
 *
 * A failed primary call is not replayed against the fallback: the caller
 * sees the failure and decides on its own retries. The fallback only takes
 * traffic the primary is refusing outright.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter implements CompletionProvider {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    @Autowired
    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this(new LlmClient(httpClient, objectMapper, properties.primary()),
                properties.fallback() != null && properties.fallback().isConfigured()
                        ? new LlmClient(httpClient, objectMapper, properties.fallback())
                        : null,
                primaryLlmCircuitBreaker, fallbackLlmCircuitBreaker,
                primaryLlmRetry, fallbackLlmRetry);
    }

    LlmRouter(LlmClient primaryClient,
              LlmClient fallbackClient,
              CircuitBreaker primaryCb,
              CircuitBreaker fallbackCb,
              Retry primaryRetry,
              Retry fallbackRetry) {
        this.primaryClient  = primaryClient;
        this.fallbackClient = fallbackClient;
        this.primaryCb      = primaryCb;
        this.fallbackCb     = fallbackCb;
        this.primaryRetry   = primaryRetry;
        this.fallbackRetry  = fallbackRetry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * The request's model wins on the primary provider when set; the
     * fallback always uses its own configured model.
     */
    @Override
    public ChatResponse complete(ChatRequest request) {
        ChatRequest primaryRequest = request.model() != null && !request.model().isBlank()
                ? request
                : request.toBuilder().model(primaryClient.modelName()).build();
        try {
            return execute(primaryCb, primaryRetry, () -> primaryClient.chat(primaryRequest));
        } catch (CallNotPermittedException open) {
            if (fallbackClient == null) {
                throw new ProviderException("Primary provider [%s] circuit is open and no fallback is configured"
                        .formatted(primaryClient.name()), open);
            }
            log.warn("[LlmRouter] Primary [{}] circuit open, routing to fallback [{}]",
                    primaryClient.name(), fallbackClient.name());
        }

        ChatRequest fallbackRequest = request.toBuilder().model(fallbackClient.modelName()).build();
        try {
            return execute(fallbackCb, fallbackRetry, () -> fallbackClient.chat(fallbackRequest));
        } catch (CallNotPermittedException open) {
            throw new ProviderException("All completion providers are unavailable (circuits open)", open);
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /** Circuit breaker outside, retry inside: one breaker call per attempt group. */
    private static ChatResponse execute(CircuitBreaker cb, Retry retry, Supplier<ChatResponse> call) {
        return CircuitBreaker.decorateSupplier(cb, Retry.decorateSupplier(retry, call)).get();
    }
}
