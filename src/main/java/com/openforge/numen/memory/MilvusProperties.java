package com.openforge.numen.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Milvus vector index.
 *
 * agent:
 *   milvus:
 *     enabled: false
 *     host: localhost
 *     port: 19530
 *     collection-name: numen_memories
 *     vector-dimensions: 1536
 */
@ConfigurationProperties(prefix = "agent.milvus")
public record MilvusProperties(
        @DefaultValue("false")          boolean enabled,
        @DefaultValue("localhost")      String  host,
        @DefaultValue("19530")          int     port,
        @DefaultValue("numen_memories") String  collectionName,
        @DefaultValue("1536")           int     vectorDimensions
) {}
