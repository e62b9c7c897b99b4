package com.openforge.numen.memory;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.openforge.numen.domain.MemoryEntry;
import com.openforge.numen.error.PersistenceException;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.openforge.numen.memory.MilvusCollectionManager.F_CREATE_TIME;
import static com.openforge.numen.memory.MilvusCollectionManager.F_EMBEDDING;
import static com.openforge.numen.memory.MilvusCollectionManager.F_ID;
import static com.openforge.numen.memory.MilvusCollectionManager.F_MEMORY_TYPE;
import static com.openforge.numen.memory.MilvusCollectionManager.F_NAMESPACE;

/**
 * Memory store with the similarity index in Milvus.
 *
 * The {@code memory_entries} row (through {@link JpaMemoryStore}) stays the
 * record of truth for content, metadata and counters; Milvus holds only the
 * vector plus the scalar fields needed to filter a search. A search asks
 * Milvus for ids and scores, then loads the rows.
 */
@Slf4j
@Primary
@Component
@ConditionalOnProperty(name = "agent.milvus.enabled", havingValue = "true")
public class MilvusMemoryStore implements MemoryStore {

    private final MilvusClientV2          client;
    private final MilvusCollectionManager collectionManager;
    private final JpaMemoryStore          rows;
    private final MilvusProperties        props;

    @Autowired
    public MilvusMemoryStore(@Nullable MilvusClientV2 client, JpaMemoryStore rows, MilvusProperties props) {
        this(client, client != null ? new MilvusCollectionManager(client) : null, rows, props);
    }

    MilvusMemoryStore(MilvusClientV2 client, MilvusCollectionManager collectionManager,
                      JpaMemoryStore rows, MilvusProperties props) {
        this.client            = client;
        this.collectionManager = collectionManager;
        this.rows              = rows;
        this.props             = props;
        if (client == null) {
            log.warn("[Milvus] Client unavailable, memory search runs on the relational store.");
        }
    }

    // ── Write ────────────────────────────────────────────────────────────────

    @Override
    public String put(MemoryDraft draft) {
        if (client == null) return rows.put(draft);
        JpaMemoryStore.Stored stored = rows.store(draft);
        String id = stored.id();

        JsonObject row = new JsonObject();
        row.addProperty(F_ID, id);
        row.addProperty(F_NAMESPACE, draft.namespace().value());
        row.addProperty(F_MEMORY_TYPE, draft.memoryType() != null ? draft.memoryType() : MemoryEntry.TYPE_FACT);
        row.addProperty(F_CREATE_TIME, System.currentTimeMillis());
        JsonArray vector = new JsonArray();
        for (float f : draft.embedding()) vector.add(f);
        row.add(F_EMBEDDING, vector);

        try {
            collectionManager.ensureCollection(props.collectionName(), props.vectorDimensions());
            client.upsert(UpsertReq.builder()
                    .collectionName(props.collectionName())
                    .data(List.of(row))
                    .build());
        } catch (RuntimeException e) {
            // a new row without its vector would never be found by search
            if (stored.created()) {
                rows.delete(id);
                log.warn("[Milvus] Indexing failed, removed unindexed memory {}: {}", id, e.getMessage());
            }
            throw new PersistenceException("Failed to index memory " + id + " in Milvus", e);
        }
        log.debug("[Milvus] Indexed memory {} in {}", id, draft.namespace());
        return id;
    }

    @Override
    public void touch(Collection<String> ids) {
        rows.touch(ids);
    }

    @Override
    public boolean delete(String id) {
        boolean deleted = rows.delete(id);
        if (deleted && client != null) {
            client.delete(DeleteReq.builder()
                    .collectionName(props.collectionName())
                    .ids(List.of(id))
                    .build());
        }
        return deleted;
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    @Override
    public List<MemoryRecord> search(MemoryQuery query) {
        if (client == null) return rows.search(query);
        if (query.limit() <= 0) return List.of();

        collectionManager.ensureCollection(props.collectionName(), props.vectorDimensions());
        SearchResp resp = client.search(SearchReq.builder()
                .collectionName(props.collectionName())
                .data(List.of(new FloatVec(VectorMath.toList(query.embedding()))))
                .annsField(F_EMBEDDING)
                .topK(query.limit())
                .filter(filter(query))
                .outputFields(List.of(F_NAMESPACE))
                .build());

        Map<String, Double> scores = new HashMap<>();
        if (resp != null && resp.getSearchResults() != null) {
            for (List<SearchResp.SearchResult> hits : resp.getSearchResults()) {
                for (SearchResp.SearchResult hit : hits) {
                    Float score = hit.getScore();
                    scores.put(String.valueOf(hit.getId()), score == null ? 0.0 : score.doubleValue());
                }
            }
        }
        if (scores.isEmpty()) return List.of();

        MemoryNamespace ns = query.namespace();
        return rows.findByIds(scores.keySet()).stream()
                .filter(e -> query.includeDescendants() ? ns.covers(e.getNamespace()) : ns.value().equals(e.getNamespace()))
                .map(e -> rows.toRecord(e, scores.get(e.getId())))
                .sorted(JpaMemoryStore.BY_SIMILARITY)
                .limit(query.limit())
                .toList();
    }

    @Override
    public long count(MemoryNamespace namespace) {
        return rows.count(namespace);
    }

    /** Namespace components are restricted to a quote-free alphabet, see MemoryNamespace. */
    static String filter(MemoryQuery query) {
        String ns = query.namespace().value();
        String scope = query.includeDescendants()
                ? "(%s == \"%s\" or %s like \"%s%%\")".formatted(F_NAMESPACE, ns, F_NAMESPACE,
                        query.namespace().descendantPrefix())
                : "%s == \"%s\"".formatted(F_NAMESPACE, ns);
        if (query.typeFilter() == null) return scope;
        return scope + " and %s == \"%s\"".formatted(F_MEMORY_TYPE, query.typeFilter().replace("\"", ""));
    }
}
