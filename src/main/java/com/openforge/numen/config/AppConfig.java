package com.openforge.numen.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - interaction executor → worker pool behind InteractionOrchestrator.processAsync
 *  - Java HttpClient      → the only HTTP engine for embedding and completion calls
 *  - Jackson ObjectMapper → snake_case, Java time as ISO-8601, tolerant deserialization
 */
@Configuration
public class AppConfig {

    /**
     * Fixed pool; each task is one blocking interaction. Cancelling the
     * returned Future interrupts the worker, which aborts the pending
     * provider call.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService interactionExecutor(
            @Value("${agent.runtime.worker-threads:16}") int workerThreads) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "interaction-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(workerThreads, factory);
    }

    /**
     * Single, shared HttpClient. Connect timeout only; per-request timeouts
     * come from each provider's configuration.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper, used for provider payloads and the stored
     * contract documents alike:
     *  - snake_case property names (short_description, max_tokens …)
     *  - ISO-8601 dates, not timestamps
     *  - unknown properties ignored
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
