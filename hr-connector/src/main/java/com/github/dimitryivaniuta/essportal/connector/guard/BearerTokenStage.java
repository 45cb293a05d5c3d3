package com.github.dimitryivaniuta.essportal.connector.guard;

import com.github.dimitryivaniuta.essportal.common.security.BearerTokenExtractor;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;

public class BearerTokenStage implements GuardStage {

    static final String MISSING = "Missing Bearer token.";

    @Override
    public Mono<StageResult> apply(final GuardContext context) {
        return Mono.just(BearerTokenExtractor.extract(context.authorization())
                .map(token -> StageResult.proceed(context.withBearerToken(token)))
                .orElseGet(() -> StageResult.reject(context, HttpStatus.UNAUTHORIZED, MISSING)));
    }
}
