package com.openforge.numen.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

/**
 * Write-once snapshot of an agent contract as it was <em>before</em> a mutation.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Immutable
@Table(
    name = "agent_versions",
    indexes = @Index(name = "idx_versions_agent", columnList = "agent_id, create_time")
)
public class ContractVersion extends BaseEntity {

    @Column(name = "agent_id", nullable = false, length = 36, updatable = false)
    private String agentId;

    @Column(name = "tenant_id", nullable = false, length = 64, updatable = false)
    private String tenantId;

    @Column(name = "version", nullable = false, length = 32, updatable = false)
    private String version;

    @Column(name = "contract", nullable = false, columnDefinition = "LONGTEXT", updatable = false)
    private String contract;

    @Column(name = "change_summary", length = 1024, updatable = false)
    private String changeSummary;

    @Column(name = "created_by", length = 64, updatable = false)
    private String createdBy;
}
