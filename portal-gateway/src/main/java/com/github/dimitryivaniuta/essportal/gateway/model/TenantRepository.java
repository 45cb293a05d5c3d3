package com.github.dimitryivaniuta.essportal.gateway.model;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface TenantRepository extends ReactiveCrudRepository<TenantEntity, Long> {

    Mono<Boolean> existsByNameIgnoreCase(String name);

    Flux<TenantEntity> findAllByOrderByIdAsc();

    /**
     * Activation toggle without loading the entity.
     *
     * @return rows updated (0 or 1)
     */
    @Modifying
    @Query("UPDATE tenants SET active = :active, updated_at = now() WHERE id = :id")
    Mono<Integer> updateActive(@Param("id") Long id, @Param("active") boolean active);
}
