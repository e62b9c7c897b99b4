package com.openforge.numen.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A conversation between one user and one agent.
 *
 * messageCount doubles as the sequence source for {@link ThreadMessage#getSequence()}:
 * appends take a row lock on the thread, so count and ordering can never drift.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "threads",
    indexes = @Index(name = "idx_threads_owner", columnList = "tenant_id, agent_id, user_id, status")
)
public class ConversationThread extends BaseEntity {

    public enum ThreadStatus {
        ACTIVE,
        ARCHIVED
    }

    @Column(name = "agent_id", nullable = false, length = 36)
    private String agentId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "title", length = 255)
    private String title;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ThreadStatus status = ThreadStatus.ACTIVE;

    @Builder.Default
    @Column(name = "message_count", nullable = false)
    private Integer messageCount = 0;

    @Column(name = "last_message_at")
    private LocalDateTime lastMessageAt;
}
