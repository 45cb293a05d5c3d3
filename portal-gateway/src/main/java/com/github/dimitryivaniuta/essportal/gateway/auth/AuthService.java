package com.github.dimitryivaniuta.essportal.gateway.auth;

import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import com.github.dimitryivaniuta.essportal.gateway.model.UserEntity;
import com.github.dimitryivaniuta.essportal.gateway.model.UserRepository;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Password login and refresh-token exchange.
 *
 * <p>Refresh re-reads the user: the administrator flag of the new pair is the current one,
 * and a disabled or deleted user cannot refresh.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    static final String BAD_CREDENTIALS = "Incorrect email or password";
    static final String INACTIVE_USER = "Inactive user";
    static final String BAD_REFRESH = "Invalid or expired refresh token";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;

    /**
     * Verifies credentials and issues a token pair.
     * Unknown email and wrong password are indistinguishable to the caller.
     */
    public Mono<TokenPair> login(final String email, final String password) {
        return userRepository.findByEmailIgnoreCase(email)
                .switchIfEmpty(Mono.error(() -> GatewayException.unauthorized(BAD_CREDENTIALS)))
                .flatMap(user -> Mono.fromCallable(() -> passwordEncoder.matches(password, user.getPasswordHash()))
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMap(ok -> {
                            if (!ok) {
                                log.warn("Login failed: bad credentials for userId={}", user.getId());
                                return Mono.error(GatewayException.unauthorized(BAD_CREDENTIALS));
                            }
                            if (!user.isActive()) {
                                log.warn("Login refused: inactive userId={}", user.getId());
                                return Mono.error(GatewayException.validation(INACTIVE_USER));
                            }
                            return issuePair(user);
                        }))
                .doOnSuccess(pair -> log.info("Login succeeded for {}", email));
    }

    /**
     * Exchanges a valid refresh token for a new pair, using the user's current privileges.
     */
    public Mono<TokenPair> refresh(final String refreshToken) {
        return tokenService.verifyRefresh(refreshToken)
                .onErrorMap(GatewayException.class, e -> GatewayException.unauthorized(BAD_REFRESH))
                .flatMap(claims -> userRepository.findByEmailIgnoreCase(claims.subject())
                        .filter(UserEntity::isActive)
                        .switchIfEmpty(Mono.error(() -> {
                            log.warn("Refresh refused: subject {} missing or inactive", claims.subject());
                            return GatewayException.unauthorized(BAD_REFRESH);
                        }))
                        .doOnNext(user -> {
                            if (user.isAdmin() != claims.admin()) {
                                log.info("Admin flag of {} changed since last login: {} -> {}",
                                        user.getEmail(), claims.admin(), user.isAdmin());
                            }
                        }))
                .flatMap(this::issuePair);
    }

    private Mono<TokenPair> issuePair(final UserEntity user) {
        Map<String, Object> claims = Map.of(TokenService.CLAIM_ADMIN, user.isAdmin());
        return Mono.zip(
                tokenService.issueAccess(user.getEmail(), claims),
                tokenService.issueRefresh(user.getEmail(), claims),
                TokenPair::new);
    }
}
