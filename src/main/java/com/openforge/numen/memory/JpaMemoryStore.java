package com.openforge.numen.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.numen.domain.MemoryEntry;
import com.openforge.numen.error.PersistenceException;
import com.openforge.numen.repository.MemoryEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Default memory store: rows in {@code memory_entries}, cosine similarity
 * computed in process over the candidate namespace.
 *
 * Fine for development and small tenants; with {@code agent.milvus.enabled}
 * the {@link MilvusMemoryStore} takes over search and keeps using this class
 * for the rows themselves.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaMemoryStore implements MemoryStore {

    static final Comparator<MemoryRecord> BY_SIMILARITY = Comparator
            .comparingDouble(MemoryRecord::similarity).reversed()
            .thenComparing(MemoryRecord::createdAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final MemoryEntryRepository repository;
    private final ObjectMapper          objectMapper;

    // ── Write ────────────────────────────────────────────────────────────────

    @Override
    public String put(MemoryDraft draft) {
        return store(draft).id();
    }

    /** Like {@link #put}, also reporting whether the row was new or a refresh of an equal entry. */
    Stored store(MemoryDraft draft) {
        MemoryNamespace ns = draft.namespace();
        String fingerprint = fingerprint(ns, draft.content());
        try {
            MemoryEntry entry = repository.findByFingerprint(fingerprint)
                    .orElseGet(() -> MemoryEntry.builder()
                            .tenantId(ns.tenantId())
                            .agentId(ns.agentId())
                            .namespace(ns.value())
                            .content(draft.content())
                            .fingerprint(fingerprint)
                            .build());
            boolean refresh = entry.getId() != null;
            entry.setEmbedding(draft.embedding());
            entry.setMemoryType(draft.memoryType() != null ? draft.memoryType() : MemoryEntry.TYPE_FACT);
            entry.setMetadata(writeMetadata(draft.metadata()));
            String id = repository.save(entry).getId();
            log.debug("[Memory] {} entry {} in {}", refresh ? "Refreshed" : "Stored", id, ns);
            return new Stored(id, !refresh);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to store memory in " + ns, e);
        }
    }

    @Override
    public void touch(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) return;
        try {
            repository.touch(ids, LocalDateTime.now());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to touch memories " + ids, e);
        }
    }

    @Override
    public boolean delete(String id) {
        if (!repository.existsById(id)) return false;
        repository.deleteById(id);
        return true;
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    @Override
    public List<MemoryRecord> search(MemoryQuery query) {
        if (query.limit() <= 0) return List.of();
        List<MemoryEntry> candidates = candidates(query);
        return candidates.stream()
                .filter(e -> query.typeFilter() == null || query.typeFilter().equals(e.getMemoryType()))
                .filter(e -> e.getEmbedding() != null && e.getEmbedding().length == query.embedding().length)
                .map(e -> toRecord(e, VectorMath.cosine(query.embedding(), e.getEmbedding())))
                .sorted(BY_SIMILARITY)
                .limit(query.limit())
                .toList();
    }

    @Override
    public long count(MemoryNamespace namespace) {
        return repository.countByNamespace(namespace.value());
    }

    // ── Shared with MilvusMemoryStore ────────────────────────────────────────

    List<MemoryEntry> findByIds(Collection<String> ids) {
        return repository.findByIdIn(ids);
    }

    MemoryRecord toRecord(MemoryEntry entry, double similarity) {
        return new MemoryRecord(
                entry.getId(),
                entry.getNamespace(),
                entry.getContent(),
                entry.getMemoryType(),
                readMetadata(entry),
                similarity,
                similarity,
                entry.getAccessCount() != null ? entry.getAccessCount() : 0,
                entry.getCreateTime(),
                entry.getLastAccessedAt());
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<MemoryEntry> candidates(MemoryQuery query) {
        MemoryNamespace ns = query.namespace();
        List<MemoryEntry> rows = query.includeDescendants()
                ? repository.findByNamespaceOrNamespaceStartingWith(ns.value(), ns.descendantPrefix())
                : repository.findByNamespace(ns.value());
        // scope re-checked in process
        return rows.stream()
                .filter(e -> query.includeDescendants() ? ns.covers(e.getNamespace()) : ns.value().equals(e.getNamespace()))
                .toList();
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Memory metadata is not serializable", e);
        }
    }

    private Map<String, Object> readMetadata(MemoryEntry entry) {
        if (entry.getMetadata() == null || entry.getMetadata().isBlank()) return Map.of();
        try {
            return objectMapper.readValue(entry.getMetadata(), METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[Memory] Unreadable metadata on entry {}: {}", entry.getId(), e.getOriginalMessage());
            return Map.of();
        }
    }

    static String fingerprint(MemoryNamespace namespace, String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(namespace.value().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '\n');
            digest.update(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    record Stored(String id, boolean created) {}
}
