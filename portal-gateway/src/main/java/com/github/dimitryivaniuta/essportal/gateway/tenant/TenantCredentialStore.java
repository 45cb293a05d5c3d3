package com.github.dimitryivaniuta.essportal.gateway.tenant;

import com.github.dimitryivaniuta.essportal.common.error.ConfigurationException;
import com.github.dimitryivaniuta.essportal.common.error.ErrorKind;
import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import com.github.dimitryivaniuta.essportal.gateway.model.TenantCredentialEntity;
import com.github.dimitryivaniuta.essportal.gateway.model.TenantCredentialRepository;
import com.github.dimitryivaniuta.essportal.gateway.model.TenantRepository;
import com.github.dimitryivaniuta.essportal.gateway.vault.CredentialVault;
import java.time.Clock;
import java.time.OffsetDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Per-tenant HR connection settings. Keys go in through the vault and come out only as a
 * request-scoped {@link DownstreamCredential}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantCredentialStore {

    static final String NOT_CONFIGURED_MESSAGE = "HR connection is not configured for this tenant.";

    private final TenantRepository tenantRepository;
    private final TenantCredentialRepository credentialRepository;
    private final CredentialVault vault;
    private final Clock clock;

    /**
     * Stored settings of a tenant.
     *
     * @return the row, or {@code NOT_CONFIGURED} error when the tenant has none
     */
    public Mono<TenantCredentialEntity> get(final Long tenantId) {
        if (tenantId == null) {
            return Mono.error(new GatewayException(ErrorKind.NOT_CONFIGURED, NOT_CONFIGURED_MESSAGE));
        }
        return credentialRepository.findByTenantId(tenantId)
                .switchIfEmpty(Mono.error(() -> new GatewayException(ErrorKind.NOT_CONFIGURED, NOT_CONFIGURED_MESSAGE)));
    }

    /**
     * Creates or fully overwrites the tenant's settings. The key is encrypted before saving.
     */
    public Mono<TenantCredentialEntity> upsert(final Long tenantId, final CredentialUpdate update) {
        return tenantRepository.existsById(tenantId)
                .flatMap(exists -> exists
                        ? Mono.just(tenantId)
                        : Mono.error(GatewayException.notFound("Tenant not found.")))
                .then(Mono.fromCallable(() -> vault.encrypt(update.apiKey())))
                .flatMap(ciphertext -> credentialRepository.findByTenantId(tenantId)
                        .defaultIfEmpty(TenantCredentialEntity.builder()
                                .tenantId(tenantId)
                                .createdAt(OffsetDateTime.now(clock))
                                .build())
                        .flatMap(row -> {
                            row.setBaseUrl(update.baseUrl().trim());
                            row.setDbName(update.dbName());
                            row.setAccountLogin(update.accountLogin());
                            row.setEncryptedApiKey(ciphertext);
                            row.setUpdatedAt(OffsetDateTime.now(clock));
                            return credentialRepository.save(row);
                        }))
                .doOnSuccess(saved -> log.info("HR connection settings saved tenant={} baseUrl={}",
                        tenantId, saved == null ? null : saved.getBaseUrl()));
    }

    /** Settings as shown to administrators; the key is reduced to a flag. */
    public Mono<CredentialView> view(final Long tenantId) {
        return get(tenantId).map(row -> new CredentialView(
                row.getTenantId(),
                row.getBaseUrl(),
                row.getDbName(),
                row.getAccountLogin(),
                row.getEncryptedApiKey() != null && !row.getEncryptedApiKey().isBlank(),
                row.getUpdatedAt()));
    }

    /**
     * Decrypts the tenant's key for a single outbound call.
     * A ciphertext the vault cannot open is a server-side configuration fault.
     */
    public Mono<DownstreamCredential> resolve(final Long tenantId) {
        return get(tenantId).map(row -> vault.decrypt(row.getEncryptedApiKey())
                .map(key -> new DownstreamCredential(tenantId, row.getBaseUrl(), key))
                .orElseThrow(() -> {
                    log.error("Stored HR API key of tenant={} cannot be decrypted", tenantId);
                    return new ConfigurationException("Security configuration error.");
                }));
    }
}
