package com.github.dimitryivaniuta.essportal.gateway.service;

import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import com.github.dimitryivaniuta.essportal.gateway.model.UserEntity;
import com.github.dimitryivaniuta.essportal.gateway.model.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Maps the authenticated token subject to an active portal user.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CurrentUserResolver {

    private final UserRepository userRepository;

    public Mono<UserEntity> resolve(final String subject) {
        return userRepository.findByEmailIgnoreCase(subject)
                .switchIfEmpty(Mono.error(() -> GatewayException.unauthorized("Could not validate credentials")))
                .flatMap(user -> {
                    if (!user.isActive()) {
                        log.warn("Inactive userId={} presented a valid access token", user.getId());
                        return Mono.error(GatewayException.forbidden("User not authorized or inactive."));
                    }
                    return Mono.just(user);
                });
    }
}
