package com.openforge.numen.memory;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * A memory entry returned from a search.
 *
 * @param similarity cosine similarity to the query, in [-1, 1]
 * @param score      ranking score; equals {@code similarity} as returned by a
 *                   store, replaced by the hybrid score after re-ranking
 */
public record MemoryRecord(
        String id,
        String namespace,
        String content,
        String memoryType,
        Map<String, Object> metadata,
        double similarity,
        double score,
        int accessCount,
        LocalDateTime createdAt,
        LocalDateTime lastAccessedAt
) {

    public MemoryRecord withScore(double newScore) {
        return new MemoryRecord(id, namespace, content, memoryType, metadata,
                similarity, newScore, accessCount, createdAt, lastAccessedAt);
    }
}
