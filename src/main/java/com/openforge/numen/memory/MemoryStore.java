package com.openforge.numen.memory;

import java.util.Collection;
import java.util.List;

/**
 * Durable memory entries with namespace-scoped similarity search.
 *
 * Implementations must never return an entry whose namespace is not covered
 * by the queried namespace (exact match, or descendant when the query asks
 * for the subtree).
 */
public interface MemoryStore {

    /**
     * Stores {@code draft}. Identical content written again into the same
     * namespace refreshes the existing entry and returns its id.
     */
    String put(MemoryDraft draft);

    /** At most {@code limit} entries, similarity descending, newest first on ties. */
    List<MemoryRecord> search(MemoryQuery query);

    /** access_count + 1 and last_accessed_at = now for each id. */
    void touch(Collection<String> ids);

    default void touch(String id) {
        touch(List.of(id));
    }

    /** Entries stored exactly under {@code namespace}. */
    long count(MemoryNamespace namespace);

    boolean delete(String id);
}
