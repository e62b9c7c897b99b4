package com.openforge.numen.memory;

/**
 * Similarity search request.
 *
 * @param includeDescendants when true (the default) the namespace's whole
 *                           subtree is searched; when false only entries
 *                           stored exactly under {@code namespace}
 * @param typeFilter         optional memory_type to restrict to
 */
public record MemoryQuery(
        MemoryNamespace namespace,
        float[] embedding,
        int limit,
        String typeFilter,
        boolean includeDescendants
) {

    public static MemoryQuery subtree(MemoryNamespace namespace, float[] embedding, int limit) {
        return new MemoryQuery(namespace, embedding, limit, null, true);
    }

    public static MemoryQuery exact(MemoryNamespace namespace, float[] embedding, int limit) {
        return new MemoryQuery(namespace, embedding, limit, null, false);
    }

    public MemoryQuery ofType(String memoryType) {
        return new MemoryQuery(namespace, embedding, limit, memoryType, includeDescendants);
    }
}
