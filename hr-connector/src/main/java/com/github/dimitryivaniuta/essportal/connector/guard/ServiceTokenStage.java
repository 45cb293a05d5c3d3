package com.github.dimitryivaniuta.essportal.connector.guard;

import com.github.dimitryivaniuta.essportal.common.security.BearerTokenExtractor;
import com.github.dimitryivaniuta.essportal.connector.token.ServiceTokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;

@Slf4j
@RequiredArgsConstructor
public class ServiceTokenStage implements GuardStage {

    static final String INVALID = "Invalid or inactive API token.";

    private final ServiceTokenService tokenService;

    @Override
    public Mono<StageResult> apply(final GuardContext context) {
        return tokenService.validate(context.bearerToken())
                .map(caller -> StageResult.proceed(context.withCaller(caller)))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("Unauthorized: token {} is unknown or inactive ({} {})",
                            BearerTokenExtractor.abbreviate(context.bearerToken()), context.method(), context.endpoint());
                    return StageResult.reject(context, HttpStatus.UNAUTHORIZED, INVALID);
                }));
    }
}
