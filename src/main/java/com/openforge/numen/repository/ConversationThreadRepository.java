package com.openforge.numen.repository;

import com.openforge.numen.domain.ConversationThread;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ConversationThreadRepository extends JpaRepository<ConversationThread, String> {

    Optional<ConversationThread> findByIdAndAgentIdAndUserIdAndTenantIdAndStatus(
            String id, String agentId, String userId, String tenantId,
            ConversationThread.ThreadStatus status);

    List<ConversationThread> findByTenantIdAndAgentIdAndUserIdAndStatusOrderByLastMessageAtDesc(
            String tenantId, String agentId, String userId, ConversationThread.ThreadStatus status);

    /** Row lock that serializes appends on one thread. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM ConversationThread t WHERE t.id = :id")
    Optional<ConversationThread> lockById(@Param("id") String id);
}
