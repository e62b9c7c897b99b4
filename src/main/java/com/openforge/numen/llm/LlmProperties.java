package com.openforge.numen.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Completion provider configuration, under "agent.llm":
 *
 * agent:
 *   llm:
 *     primary:
 *       name: openai
 *       base-url: https://api.openai.com/v1
 *       api-key: sk-...
 *       model: gpt-4o-mini
 *       timeout-seconds: 60
 *     fallback:            # optional
 *       name: deepseek
 *       base-url: https://api.deepseek.com/v1
 *       api-key: sk-...
 *       model: deepseek-chat
 *       timeout-seconds: 60
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("60") int timeoutSeconds
    ) {

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }
}
