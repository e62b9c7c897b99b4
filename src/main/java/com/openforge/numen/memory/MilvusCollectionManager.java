package com.openforge.numen.memory;

import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates the memory collection on first use and remembers that it exists.
 *
 * Collection schema:
 * ┌────────────────┬──────────────┬──────────────────────────────────────┐
 * │ Field          │ Type         │ Notes                                │
 * ├────────────────┼──────────────┼──────────────────────────────────────┤
 * │ id             │ VARCHAR(36)  │ PK, the memory_entries row id        │
 * │ namespace      │ VARCHAR(512) │ isolation key, filtered on search    │
 * │ memory_type    │ VARCHAR(32)  │                                      │
 * │ create_time_ms │ INT64        │ epoch millis                         │
 * │ embedding      │ FLOAT_VECTOR │ dim = vector-dimensions              │
 * └────────────────┴──────────────┴──────────────────────────────────────┘
 *
 * Index: HNSW with COSINE metric, so search scores are cosine similarities
 * and line up with the relational store's.
 */
@Slf4j
public class MilvusCollectionManager {

    static final String F_ID          = "id";
    static final String F_NAMESPACE   = "namespace";
    static final String F_MEMORY_TYPE = "memory_type";
    static final String F_CREATE_TIME = "create_time_ms";
    static final String F_EMBEDDING   = "embedding";

    private final MilvusClientV2 client;
    private final Set<String> existingCollections = ConcurrentHashMap.newKeySet();

    public MilvusCollectionManager(MilvusClientV2 client) {
        this.client = client;
    }

    public void ensureCollection(String name, int dimension) {
        if (existingCollections.contains(name)) return;
        if (client.hasCollection(HasCollectionReq.builder().collectionName(name).build())) {
            existingCollections.add(name);
            log.info("[Milvus] Collection '{}' confirmed existing.", name);
            return;
        }

        log.info("[Milvus] Creating collection '{}' (dim={})...", name, dimension);
        CreateCollectionReq.CollectionSchema schema = CreateCollectionReq.CollectionSchema.builder().build();
        schema.addField(AddFieldReq.builder().fieldName(F_ID)
                .dataType(DataType.VarChar).maxLength(36).isPrimaryKey(true).autoID(false).build());
        schema.addField(AddFieldReq.builder().fieldName(F_NAMESPACE)
                .dataType(DataType.VarChar).maxLength(512).build());
        schema.addField(AddFieldReq.builder().fieldName(F_MEMORY_TYPE)
                .dataType(DataType.VarChar).maxLength(32).build());
        schema.addField(AddFieldReq.builder().fieldName(F_CREATE_TIME)
                .dataType(DataType.Int64).build());
        schema.addField(AddFieldReq.builder().fieldName(F_EMBEDDING)
                .dataType(DataType.FloatVector).dimension(dimension).build());

        IndexParam vectorIndex = IndexParam.builder()
                .fieldName(F_EMBEDDING)
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.COSINE)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();
        IndexParam namespaceIndex = IndexParam.builder()
                .fieldName(F_NAMESPACE)
                .indexType(IndexParam.IndexType.TRIE)
                .build();

        client.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex, namespaceIndex))
                .build());
        existingCollections.add(name);
        log.info("[Milvus] Collection '{}' created.", name);
    }
}
