package com.github.dimitryivaniuta.essportal.connector.guard;

import com.github.dimitryivaniuta.essportal.connector.token.ResourceKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;

/**
 * Runs after token validation, so the caller is always resolved here.
 */
@Slf4j
public class ScopeStage implements GuardStage {

    @Override
    public Mono<StageResult> apply(final GuardContext context) {
        ResourceKind kind = context.resourceKind();
        if (context.caller().scope().permits(kind)) {
            return Mono.just(StageResult.proceed(context));
        }
        log.warn("Forbidden: Token scope does not grant access to '{}'. token id={}", kind.tag(), context.tokenId());
        return Mono.just(StageResult.reject(context, HttpStatus.FORBIDDEN,
                "Token does not have scope for '" + kind.tag() + "'."));
    }
}
