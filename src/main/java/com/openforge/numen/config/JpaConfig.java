package com.openforge.numen.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Turns on Spring Data JPA auditing so @CreatedDate / @LastModifiedDate on
 * BaseEntity are filled in on persist and update.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
