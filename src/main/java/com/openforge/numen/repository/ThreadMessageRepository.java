package com.openforge.numen.repository;

import com.openforge.numen.domain.ThreadMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface ThreadMessageRepository extends JpaRepository<ThreadMessage, String> {

    /** Newest first; callers reverse to chronological order. */
    List<ThreadMessage> findByThreadIdOrderBySequenceDesc(String threadId, Pageable pageable);

    long countByThreadId(String threadId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ThreadMessage m WHERE m.threadId = :threadId")
    int deleteByThreadId(@Param("threadId") String threadId);
}
