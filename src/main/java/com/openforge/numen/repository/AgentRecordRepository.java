package com.openforge.numen.repository;

import com.openforge.numen.contract.AgentStatus;
import com.openforge.numen.contract.AgentType;
import com.openforge.numen.domain.AgentRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface AgentRecordRepository extends JpaRepository<AgentRecord, String> {

    Optional<AgentRecord> findByIdAndTenantId(String id, String tenantId);

    List<AgentRecord> findByStatusNot(AgentStatus status);

    List<AgentRecord> findByTenantIdAndStatusNot(String tenantId, AgentStatus status);

    @Query("""
            SELECT a FROM AgentRecord a
            WHERE a.tenantId = :tenantId
              AND ((:status IS NULL AND a.status <> :archived) OR a.status = :status)
              AND (:type IS NULL OR a.type = :type)
              AND (:tag IS NULL OR a.tags LIKE CONCAT('%,', :tag, ',%'))
            ORDER BY a.createTime DESC
            """)
    List<AgentRecord> search(@Param("tenantId") String tenantId,
                             @Param("status") AgentStatus status,
                             @Param("archived") AgentStatus archived,
                             @Param("type") AgentType type,
                             @Param("tag") String tag,
                             Pageable pageable);

    /**
     * Usage counters only. A bulk JPQL update does not bump the @Version
     * revision, so it never collides with a concurrent contract update.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE AgentRecord a
            SET a.interactionCount = a.interactionCount + 1,
                a.lastInteractionAt = :now
            WHERE a.id = :id
            """)
    int recordInteraction(@Param("id") String id, @Param("now") LocalDateTime now);
}
