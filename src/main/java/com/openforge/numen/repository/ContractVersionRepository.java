package com.openforge.numen.repository;

import com.openforge.numen.domain.ContractVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ContractVersionRepository extends JpaRepository<ContractVersion, String> {

    List<ContractVersion> findByAgentIdAndTenantIdOrderByCreateTimeAsc(String agentId, String tenantId);

    Optional<ContractVersion> findFirstByAgentIdAndTenantIdAndVersionOrderByCreateTimeDesc(
            String agentId, String tenantId, String version);

    long countByAgentId(String agentId);
}
