package com.github.dimitryivaniuta.essportal.connector.model;

import java.time.OffsetDateTime;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ServiceTokenRepository extends ReactiveCrudRepository<ServiceTokenEntity, Long> {

    Mono<ServiceTokenEntity> findByTokenAndActiveTrue(String token);

    Flux<ServiceTokenEntity> findAllByOrderByIdAsc();

    /**
     * Touches the last-used timestamp without loading the row.
     *
     * @return rows updated (0 or 1)
     */
    @Modifying
    @Query("UPDATE ess_api_tokens SET last_used_at = :usedAt WHERE id = :id")
    Mono<Integer> touchLastUsed(@Param("id") Long id, @Param("usedAt") OffsetDateTime usedAt);
}
