package com.github.dimitryivaniuta.essportal.gateway.service;

import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import com.github.dimitryivaniuta.essportal.gateway.model.TenantRepository;
import com.github.dimitryivaniuta.essportal.gateway.model.UserEntity;
import com.github.dimitryivaniuta.essportal.gateway.model.UserRepository;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.AdminUserCreateRequest;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.AdminUserUpdateRequest;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Administrator user management.
 *
 * <p>Updates are partial: only non-null fields of {@link AdminUserUpdateRequest} are
 * applied, each through its own setter.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserAdminService {

    static final String TENANT_REQUIRED = "Tenant is required.";
    static final String SELF_DELETE = "Administrators cannot delete their own account.";

    private final UserRepository userRepository;
    private final TenantRepository tenantRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public Flux<UserEntity> list() {
        return userRepository.findAllByOrderByIdAsc();
    }

    public Mono<UserEntity> get(final Long id) {
        return userRepository.findById(id)
                .switchIfEmpty(Mono.error(() -> GatewayException.notFound("User not found.")));
    }

    /**
     * Deletes a user. An administrator cannot delete the account they are signed in with.
     *
     * @param actingEmail subject of the administrator's token
     */
    public Mono<Void> delete(final Long id, final String actingEmail) {
        return userRepository.findById(id)
                .switchIfEmpty(Mono.error(() -> GatewayException.notFound("User not found for deletion.")))
                .flatMap(user -> {
                    if (actingEmail != null && user.getEmail().equalsIgnoreCase(actingEmail.trim())) {
                        return Mono.<Void>error(GatewayException.forbidden(SELF_DELETE));
                    }
                    return userRepository.delete(user);
                })
                .doOnSuccess(v -> log.info("User id={} deleted by {}", id, actingEmail));
    }

    /** Every user belongs to exactly one existing tenant. */
    public Mono<UserEntity> create(final AdminUserCreateRequest request) {
        if (request.tenantId() == null) {
            return Mono.error(GatewayException.validation(TENANT_REQUIRED));
        }
        String email = normalize(request.email());
        return userRepository.existsByEmailIgnoreCase(email)
                .flatMap(exists -> exists
                        ? Mono.<Boolean>error(GatewayException.validation("Email already registered."))
                        : requireTenant(request.tenantId()))
                .then(hash(request.password()))
                .flatMap(hash -> {
                    OffsetDateTime now = OffsetDateTime.now(clock);
                    return userRepository.save(UserEntity.builder()
                            .email(email)
                            .passwordHash(hash)
                            .fullName(request.fullName())
                            .tenantId(request.tenantId())
                            .hrEmployeeId(request.hrEmployeeId())
                            .jobTitle(request.jobTitle())
                            .phone(request.phone())
                            .admin(Boolean.TRUE.equals(request.isAdmin()))
                            .active(request.isActive() == null || request.isActive())
                            .createdAt(now)
                            .updatedAt(now)
                            .build());
                })
                .doOnSuccess(u -> log.info("User created id={} email={}", u == null ? null : u.getId(), email));
    }

    public Mono<UserEntity> update(final Long id, final AdminUserUpdateRequest request) {
        return userRepository.findById(id)
                .switchIfEmpty(Mono.error(() -> GatewayException.notFound("User not found.")))
                .flatMap(user -> checkEmailChange(user, request.email())
                        .then(requireTenant(request.tenantId()))
                        .then(request.password() == null
                                ? Mono.just(Optional.<String>empty())
                                : hash(request.password()).map(Optional::of))
                        .map(newHash -> apply(user, request, newHash)))
                .flatMap(userRepository::save)
                .doOnSuccess(u -> log.info("User updated id={}", id));
    }

    private UserEntity apply(final UserEntity user, final AdminUserUpdateRequest request, final Optional<String> newHash) {
        if (request.email() != null) {
            user.setEmail(normalize(request.email()));
        }
        if (request.fullName() != null) {
            user.setFullName(request.fullName());
        }
        newHash.ifPresent(user::setPasswordHash);
        if (request.tenantId() != null) {
            user.setTenantId(request.tenantId());
        }
        if (request.isAdmin() != null) {
            user.setAdmin(request.isAdmin());
        }
        if (request.isActive() != null) {
            user.setActive(request.isActive());
        }
        if (request.hrEmployeeId() != null) {
            user.setHrEmployeeId(request.hrEmployeeId());
        }
        if (request.jobTitle() != null) {
            user.setJobTitle(request.jobTitle());
        }
        if (request.phone() != null) {
            user.setPhone(request.phone());
        }
        user.setUpdatedAt(OffsetDateTime.now(clock));
        return user;
    }

    private Mono<Boolean> checkEmailChange(final UserEntity user, final String email) {
        if (email == null || normalize(email).equalsIgnoreCase(user.getEmail())) {
            return Mono.just(Boolean.TRUE);
        }
        return userRepository.existsByEmailIgnoreCase(normalize(email))
                .flatMap(taken -> taken
                        ? Mono.error(GatewayException.validation("Email already registered."))
                        : Mono.just(Boolean.TRUE));
    }

    /** A null id on update means "keep the current tenant". */
    private Mono<Boolean> requireTenant(final Long tenantId) {
        if (tenantId == null) {
            return Mono.just(Boolean.TRUE);
        }
        return tenantRepository.existsById(tenantId)
                .flatMap(exists -> exists
                        ? Mono.just(Boolean.TRUE)
                        : Mono.error(GatewayException.notFound("Tenant not found.")));
    }

    private Mono<String> hash(final String password) {
        return Mono.fromCallable(() -> passwordEncoder.encode(password))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static String normalize(final String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
