package com.openforge.numen.contract;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;

/**
 * Contract store settings.
 *
 * application.yml:
 *
 * agent:
 *   contract:
 *     artifact-dir: ./data/agents
 *     trait-defaults:
 *       confidence: 70
 *       humor: 30
 *     validation:
 *       enabled: true
 *       cron: "0 0 * * * *"
 *       auto-repair: true
 */
@ConfigurationProperties(prefix = "agent.contract")
public record ContractProperties(
        @DefaultValue("./data/agents") String artifactDir,
        Map<String, Integer> traitDefaults,
        @DefaultValue Validation validation
) {

    public ContractProperties {
        traitDefaults = traitDefaults == null ? Map.of() : Map.copyOf(traitDefaults);
    }

    public record Validation(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("0 0 * * * *") String cron,
            @DefaultValue("true") boolean autoRepair
    ) {}
}
