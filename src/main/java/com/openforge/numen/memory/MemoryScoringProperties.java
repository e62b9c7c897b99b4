package com.openforge.numen.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Weights of the hybrid memory score.
 *
 *   score = semantic      · similarity
 *         + recency       · 0.5 ^ (age_hours / recency-half-life-hours)
 *         + reinforcement · min(access_count, saturation) / saturation
 *
 * agent:
 *   memory:
 *     scoring:
 *       semantic: 0.45
 *       recency: 0.35
 *       reinforcement: 0.20
 *       recency-half-life-hours: 72
 *       reinforcement-saturation: 10
 */
@ConfigurationProperties(prefix = "agent.memory.scoring")
public record MemoryScoringProperties(
        @DefaultValue("0.45") double semantic,
        @DefaultValue("0.35") double recency,
        @DefaultValue("0.20") double reinforcement,
        @DefaultValue("72")   double recencyHalfLifeHours,
        @DefaultValue("10")   int    reinforcementSaturation
) {

    public static MemoryScoringProperties defaults() {
        return new MemoryScoringProperties(0.45, 0.35, 0.20, 72, 10);
    }
}
