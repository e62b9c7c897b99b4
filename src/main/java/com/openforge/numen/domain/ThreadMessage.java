package com.openforge.numen.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

/**
 * One turn inside a thread. Write-once; ordered by {@code sequence}.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Immutable
@Table(
    name = "thread_messages",
    uniqueConstraints = @UniqueConstraint(name = "uq_thread_sequence", columnNames = {"thread_id", "sequence"}),
    indexes = @Index(name = "idx_messages_thread", columnList = "thread_id, sequence")
)
public class ThreadMessage extends BaseEntity {

    public enum Role {
        USER,
        ASSISTANT,
        SYSTEM;

        /** Wire name used by completion providers. */
        public String wireName() {
            return name().toLowerCase();
        }
    }

    @Column(name = "thread_id", nullable = false, length = 36, updatable = false)
    private String threadId;

    @Column(name = "sequence", nullable = false, updatable = false)
    private Integer sequence;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16, updatable = false)
    private Role role;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT", updatable = false)
    private String content;

    /** JSON object, e.g. {"confidence":0.82}. */
    @Column(name = "metadata", columnDefinition = "TEXT", updatable = false)
    private String metadata;
}
