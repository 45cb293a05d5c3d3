package com.github.dimitryivaniuta.essportal.gateway.model;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface TenantCredentialRepository extends ReactiveCrudRepository<TenantCredentialEntity, Long> {

    /** Unique by tenant (DB constraint). */
    Mono<TenantCredentialEntity> findByTenantId(Long tenantId);
}
