package com.openforge.numen.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * Canonical audit columns shared by every runtime table.
 *
 * - id           : opaque UUID string, generated on first persist
 * - create_time  : set once on INSERT, never touched again
 * - update_time  : refreshed on every UPDATE
 * - revision     : JPA @Version, the optimistic-lock counter. Two writers
 *                  flushing the same row means one of them gets an
 *                  OptimisticLockException.
 */
@Getter
@Setter
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @CreatedDate
    @Column(name = "create_time", nullable = false, updatable = false)
    private LocalDateTime createTime;

    @LastModifiedDate
    @Column(name = "update_time", nullable = false)
    private LocalDateTime updateTime;

    @Version
    @Column(name = "revision", nullable = false)
    private Integer revision;
}
