package com.github.dimitryivaniuta.essportal.gateway.service;

import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import com.github.dimitryivaniuta.essportal.gateway.model.TenantEntity;
import com.github.dimitryivaniuta.essportal.gateway.model.TenantRepository;
import io.r2dbc.spi.R2dbcDataIntegrityViolationException;
import java.time.Clock;
import java.time.OffsetDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class TenantAdminService {

    static final String DELETE_CONFLICT = "Cannot delete tenant: It may have associated users or configurations."
            + " Please reassign or delete them first.";

    private final TenantRepository tenantRepository;
    private final Clock clock;

    public Flux<TenantEntity> list() {
        return tenantRepository.findAllByOrderByIdAsc();
    }

    public Mono<TenantEntity> get(final Long id) {
        return tenantRepository.findById(id)
                .switchIfEmpty(Mono.error(() -> GatewayException.notFound("Tenant not found.")));
    }

    /** Creates a tenant with a unique (case-insensitive) name. */
    public Mono<TenantEntity> create(final String name, final Boolean active) {
        String trimmed = name.trim();
        return tenantRepository.existsByNameIgnoreCase(trimmed)
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(GatewayException.validation("Tenant name already exists."));
                    }
                    OffsetDateTime now = OffsetDateTime.now(clock);
                    return tenantRepository.save(TenantEntity.builder()
                            .name(trimmed)
                            .active(active == null || active)
                            .createdAt(now)
                            .updatedAt(now)
                            .build());
                })
                .doOnSuccess(t -> log.info("Tenant created id={} name={}", t == null ? null : t.getId(), trimmed));
    }

    public Mono<TenantEntity> updateStatus(final Long id, final boolean active) {
        return tenantRepository.updateActive(id, active)
                .flatMap(rows -> rows == 0
                        ? Mono.<TenantEntity>error(GatewayException.notFound("Tenant not found."))
                        : get(id))
                .doOnSuccess(t -> log.info("Tenant id={} active={}", id, active));
    }

    /**
     * Deletes a tenant and, by cascade, its HR connection. Tenants that still have users
     * are refused with {@code CONFLICT}.
     */
    public Mono<Void> delete(final Long id) {
        return tenantRepository.findById(id)
                .switchIfEmpty(Mono.error(() -> GatewayException.notFound("Tenant not found for deletion.")))
                .flatMap(tenantRepository::delete)
                .onErrorMap(TenantAdminService::isReferenced, e -> {
                    log.warn("Tenant id={} still referenced: {}", id, e.getMessage());
                    return GatewayException.conflict(DELETE_CONFLICT);
                })
                .doOnSuccess(v -> log.info("Tenant id={} deleted", id));
    }

    private static boolean isReferenced(final Throwable e) {
        return e instanceof DataIntegrityViolationException || e instanceof R2dbcDataIntegrityViolationException;
    }
}
