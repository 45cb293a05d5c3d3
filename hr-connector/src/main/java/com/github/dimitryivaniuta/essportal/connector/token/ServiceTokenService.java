package com.github.dimitryivaniuta.essportal.connector.token;

import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import com.github.dimitryivaniuta.essportal.common.security.BearerTokenExtractor;
import com.github.dimitryivaniuta.essportal.connector.model.ConnectorAccountRepository;
import com.github.dimitryivaniuta.essportal.connector.model.ServiceTokenEntity;
import com.github.dimitryivaniuta.essportal.connector.model.ServiceTokenRepository;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Base64;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Service-token lifecycle and lookup.
 *
 * <p>Token values are 32 random bytes, URL-safe Base64 without padding. Callers never
 * set a value; {@link #regenerate(Long)} replaces it on the same record.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ServiceTokenService {

    static final int TOKEN_BYTES = 32;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final ServiceTokenRepository tokenRepository;
    private final ConnectorAccountRepository accountRepository;
    private final Clock clock;

    /**
     * Creates an active token bound to an existing account.
     *
     * @param scope comma-separated resource kinds; blank means unrestricted
     */
    public Mono<ServiceTokenEntity> create(final String label, final Long accountId,
                                           final String scope, final String note) {
        if (label == null || label.isBlank()) {
            return Mono.error(GatewayException.validation("Token label is required."));
        }
        if (accountId == null) {
            return Mono.error(GatewayException.validation("Account id is required."));
        }
        final TokenScope parsed;
        try {
            parsed = TokenScope.parse(scope);
        } catch (GatewayException e) {
            return Mono.error(e);
        }
        return accountRepository.findById(accountId)
                .switchIfEmpty(Mono.error(GatewayException.notFound("ESS account not found.")))
                .flatMap(account -> tokenRepository.save(ServiceTokenEntity.builder()
                        .label(label.trim())
                        .accountId(account.getId())
                        .token(newTokenValue())
                        .scope(parsed)
                        .active(true)
                        .note(note)
                        .createdAt(OffsetDateTime.now(clock))
                        .build()))
                .doOnNext(t -> log.info("Created service token id={} label='{}' account={} scope={}",
                        t.getId(), t.getLabel(), t.getAccountId(), t.getScope()));
    }

    public Flux<ServiceTokenEntity> list() {
        return tokenRepository.findAllByOrderByIdAsc();
    }

    /** Writes a fresh value on the same record; the old value stops working at once. */
    public Mono<ServiceTokenEntity> regenerate(final Long id) {
        return load(id)
                .flatMap(t -> {
                    t.setToken(newTokenValue());
                    return tokenRepository.save(t);
                })
                .doOnNext(t -> log.info("Regenerated service token id={}", t.getId()));
    }

    public Mono<ServiceTokenEntity> setActive(final Long id, final boolean active) {
        return load(id)
                .flatMap(t -> {
                    t.setActive(active);
                    return tokenRepository.save(t);
                })
                .doOnNext(t -> log.info("Service token id={} active={}", t.getId(), t.isActive()));
    }

    public Mono<ServiceTokenEntity> toggle(final Long id) {
        return load(id).flatMap(t -> setActive(t.getId(), !t.isActive()));
    }

    /**
     * Resolves an active token whose account is active. Empty when the value is unknown,
     * inactive, or bound to a missing/inactive account. Updating {@code last_used_at} is
     * best-effort.
     */
    public Mono<AuthenticatedCaller> validate(final String tokenValue) {
        if (tokenValue == null || tokenValue.isBlank()) {
            return Mono.empty();
        }
        return tokenRepository.findByTokenAndActiveTrue(tokenValue)
                .flatMap(token -> accountRepository.findById(token.getAccountId())
                        .filter(account -> account.isActive())
                        .map(account -> new AuthenticatedCaller(token, account))
                        .switchIfEmpty(Mono.defer(() -> {
                            log.warn("Service token id={} is bound to a missing or inactive account {}",
                                    token.getId(), token.getAccountId());
                            return Mono.empty();
                        })))
                .flatMap(caller -> touch(caller).thenReturn(caller))
                .doOnNext(caller -> log.debug("Service token {} resolved to account {}",
                        BearerTokenExtractor.abbreviate(tokenValue), caller.account().getLogin()));
    }

    private Mono<Void> touch(final AuthenticatedCaller caller) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        caller.token().setLastUsedAt(now);
        return Mono.defer(() -> tokenRepository.touchLastUsed(caller.token().getId(), now))
                .then()
                .onErrorResume(e -> {
                    log.warn("Could not update last_used_at for service token id={}: {}",
                            caller.token().getId(), e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<ServiceTokenEntity> load(final Long id) {
        return tokenRepository.findById(id)
                .switchIfEmpty(Mono.error(GatewayException.notFound("Service token not found.")));
    }

    static String newTokenValue() {
        byte[] bytes = new byte[TOKEN_BYTES];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
