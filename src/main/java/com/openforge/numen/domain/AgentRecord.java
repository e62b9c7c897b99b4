package com.openforge.numen.domain;

import com.openforge.numen.contract.AgentStatus;
import com.openforge.numen.contract.AgentType;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * The current row of one agent contract.
 *
 * Exactly one row exists per agent id; every earlier state lives in
 * {@link ContractVersion}. The contract itself is stored as a JSON document
 * in {@code contract}; the identity columns are duplicated out of it so that
 * tenant-scoped listing and filtering stay index-driven.
 *
 *  contractVersion: semantic version string ("1.0.3"), bumped on every
 *                    mutation and used as the compare-and-swap token that
 *                    callers pass back with their update.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "agents",
    indexes = {
        @Index(name = "idx_agents_tenant", columnList = "tenant_id, status"),
        @Index(name = "idx_agents_owner", columnList = "tenant_id, owner_id")
    }
)
public class AgentRecord extends BaseEntity {

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32)
    private AgentType type;

    @Column(name = "contract_version", nullable = false, length = 32)
    private String contractVersion;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private AgentStatus status = AgentStatus.ACTIVE;

    /** Comma-joined tags, for LIKE filtering; the contract JSON holds the list. */
    @Column(name = "tags", length = 1024)
    private String tags;

    /** JSON-serialized AgentContract payload. */
    @Column(name = "contract", nullable = false, columnDefinition = "LONGTEXT")
    private String contract;

    @Builder.Default
    @Column(name = "interaction_count", nullable = false)
    private Long interactionCount = 0L;

    @Column(name = "last_interaction_at")
    private LocalDateTime lastInteractionAt;
}
