package com.openforge.numen.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Retrieval defaults, used when a contract does not set its own.
 *
 * agent:
 *   runtime:
 *     memory-k: 6
 *     thread-window: 20
 *     user-memory-k: 3
 *     candidate-multiplier: 3
 *
 * candidate-multiplier: the store is asked for k × multiplier nearest
 * entries, which the hybrid scorer then re-ranks down to k.
 */
@ConfigurationProperties(prefix = "agent.runtime")
public record RuntimeProperties(
        @DefaultValue("6")  int memoryK,
        @DefaultValue("20") int threadWindow,
        @DefaultValue("3")  int userMemoryK,
        @DefaultValue("3")  int candidateMultiplier
) {

    public static RuntimeProperties defaults() {
        return new RuntimeProperties(6, 20, 3, 3);
    }
}
