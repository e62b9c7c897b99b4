package com.openforge.numen.repository;

import com.openforge.numen.domain.MemoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface MemoryEntryRepository extends JpaRepository<MemoryEntry, String> {

    List<MemoryEntry> findByNamespace(String namespace);

    /** Exact namespace or any descendant ("{ns}:..."). LIKE wildcards in the prefix are escaped. */
    List<MemoryEntry> findByNamespaceOrNamespaceStartingWith(String namespace, String descendantPrefix);

    Optional<MemoryEntry> findByFingerprint(String fingerprint);

    List<MemoryEntry> findByIdIn(Collection<String> ids);

    long countByNamespace(String namespace);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE MemoryEntry m
            SET m.accessCount = m.accessCount + 1,
                m.lastAccessedAt = :now
            WHERE m.id IN :ids
            """)
    int touch(@Param("ids") Collection<String> ids, @Param("now") LocalDateTime now);
}
