package com.github.dimitryivaniuta.essportal.gateway.auth;

import com.github.dimitryivaniuta.essportal.common.error.ErrorKind;
import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import com.github.dimitryivaniuta.essportal.gateway.model.UserEntity;
import com.github.dimitryivaniuta.essportal.gateway.model.UserRepository;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Base64;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Single-use, time-limited password reset.
 *
 * <p>Requesting a reset always answers with the same acknowledgement, whether or not the
 * address belongs to an active account. Consuming a token is one conditional update, so
 * two concurrent uses of the same token cannot both succeed.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetService {

    public static final String REQUEST_ACK =
            "If an account with that email exists, a password reset link has been sent.";
    public static final String RESET_DONE = "Password has been reset successfully.";
    static final int MIN_PASSWORD_LENGTH = 8;
    private static final int TOKEN_BYTES = 32;

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final ResetMailer mailer;
    private final PasswordResetProperties properties;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    /**
     * Issues a reset token for an active account and emails the link.
     *
     * @return the generic acknowledgement; errors only when the email cannot be sent
     */
    public Mono<String> requestReset(final String email) {
        return userRepository.findByEmailIgnoreCase(email)
                .filter(UserEntity::isActive)
                .flatMap(user -> {
                    String token = newToken();
                    OffsetDateTime expiresAt = OffsetDateTime.now(clock).plus(properties.ttl());
                    return userRepository.storePasswordResetToken(user.getId(), token, expiresAt)
                            .then(mailer.send(message(user, token)))
                            .onErrorMap(e -> !(e instanceof GatewayException), e -> {
                                log.error("Password reset for userId={} failed", user.getId(), e);
                                return new GatewayException(ErrorKind.INTERNAL,
                                        "Could not send password reset email. Please try again later.", e);
                            })
                            .thenReturn(Boolean.TRUE);
                })
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Password reset requested for unknown or inactive account");
                    return Mono.just(Boolean.FALSE);
                }))
                .thenReturn(REQUEST_ACK);
    }

    /**
     * Sets a new password if the token is current and unexpired, then invalidates it.
     */
    public Mono<String> resetPassword(final String token, final String newPassword) {
        if (newPassword == null || newPassword.length() < MIN_PASSWORD_LENGTH) {
            return Mono.error(GatewayException.validation(
                    "Password must be at least " + MIN_PASSWORD_LENGTH + " characters long."));
        }
        if (token == null || token.isBlank()) {
            return Mono.error(new InvalidResetTokenException());
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        return userRepository.findByValidPasswordResetToken(token, now)
                .switchIfEmpty(Mono.error(InvalidResetTokenException::new))
                .flatMap(user -> Mono.fromCallable(() -> passwordEncoder.encode(newPassword))
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMap(hash -> userRepository.consumePasswordResetToken(user.getId(), token, hash, now))
                        .flatMap(rows -> {
                            if (rows == null || rows != 1) {
                                log.warn("Reset token for userId={} was consumed concurrently", user.getId());
                                return Mono.error(new InvalidResetTokenException());
                            }
                            log.info("Password reset completed for userId={}", user.getId());
                            return Mono.just(RESET_DONE);
                        }));
    }

    private ResetMessage message(final UserEntity user, final String token) {
        String link = UriComponentsBuilder.fromHttpUrl(properties.frontendUrl())
                .path("/reset-password")
                .queryParam("token", token)
                .build()
                .toUriString();
        String name = user.getFullName() == null || user.getFullName().isBlank() ? user.getEmail() : user.getFullName();
        return new ResetMessage(user.getEmail(), name, link, properties.ttl().toMinutes());
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
