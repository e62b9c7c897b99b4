package com.openforge.numen.agent;

import java.util.Map;

/**
 * Outcome of one turn.
 *
 * metadata: memory_confidence, message_count, retrieved_memories, agent_version
 */
public record InteractionResult(
        String threadId,
        String response,
        Map<String, Object> metadata
) {}
