package com.openforge.numen.memory;

import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

/**
 * Milvus client, only with {@code agent.milvus.enabled=true}.
 *
 * An unreachable server does not stop the application: the client bean is
 * null and {@link MilvusMemoryStore} serves searches from the relational
 * rows until the next restart.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MilvusProperties.class)
@ConditionalOnProperty(name = "agent.milvus.enabled", havingValue = "true")
public class MilvusConfig {

    @Bean(destroyMethod = "close")
    @Nullable
    public MilvusClientV2 milvusClient(MilvusProperties props) {
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        try {
            MilvusClientV2 client = new MilvusClientV2(
                    ConnectConfig.builder()
                            .uri("http://%s:%d".formatted(props.host(), props.port()))
                            .connectTimeoutMs(15_000)
                            .build());
            log.info("[Milvus] Connected.");
            return client;
        } catch (RuntimeException e) {
            log.warn("[Milvus] Connection failed, similarity search falls back to the relational store. Cause: {}",
                    e.getMessage());
            return null;
        }
    }
}
