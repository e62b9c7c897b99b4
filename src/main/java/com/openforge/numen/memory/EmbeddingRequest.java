package com.openforge.numen.memory;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of POST /embeddings:
 * {
 *   "input": "text to embed",
 *   "model": "text-embedding-3-small",
 *   "dimensions": 1536
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmbeddingRequest(String input, String model, Integer dimensions) {}
