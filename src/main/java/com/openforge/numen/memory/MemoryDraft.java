package com.openforge.numen.memory;

import java.util.Map;

/**
 * A memory entry about to be written.
 *
 * @param memoryType free-form tag, see the TYPE_* constants on MemoryEntry
 * @param metadata   open key/value map, stored as JSON
 */
public record MemoryDraft(
        MemoryNamespace namespace,
        String content,
        float[] embedding,
        String memoryType,
        Map<String, Object> metadata
) {

    public MemoryDraft {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
