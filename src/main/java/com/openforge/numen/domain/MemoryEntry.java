package com.openforge.numen.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One unit of recallable content.
 *
 * namespace   : isolation key, always built by MemoryNamespace
 *                ({tenant}:{agent}[:thread:{id} | :user:{id}])
 * embedding   : JSON float array; dimension fixed by the embedding provider.
 *                With the Milvus backend the vector is also indexed there,
 *                keyed by this row's id.
 * fingerprint : SHA-256 over namespace + content; identical content written
 *                twice into one namespace refreshes the existing row.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "memory_entries",
    uniqueConstraints = @UniqueConstraint(name = "uq_memory_fingerprint", columnNames = "fingerprint"),
    indexes = {
        @Index(name = "idx_memory_namespace", columnList = "namespace"),
        @Index(name = "idx_memory_owner", columnList = "tenant_id, agent_id")
    }
)
public class MemoryEntry extends BaseEntity {

    public static final String TYPE_CONVERSATION = "conversation";
    public static final String TYPE_REFLECTION   = "reflection";
    public static final String TYPE_FACT         = "fact";
    public static final String TYPE_PREFERENCE   = "preference";
    public static final String TYPE_SYSTEM       = "system";

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "agent_id", nullable = false, length = 36)
    private String agentId;

    @Column(name = "namespace", nullable = false, length = 255)
    private String namespace;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Convert(converter = FloatArrayConverter.class)
    @Column(name = "embedding", nullable = false, columnDefinition = "LONGTEXT")
    private float[] embedding;

    @Column(name = "memory_type", nullable = false, length = 32)
    private String memoryType;

    /** JSON object with free-form metadata. */
    @Column(name = "metadata", columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;

    @Builder.Default
    @Column(name = "access_count", nullable = false)
    private Integer accessCount = 0;

    @Column(name = "last_accessed_at")
    private LocalDateTime lastAccessedAt;
}
