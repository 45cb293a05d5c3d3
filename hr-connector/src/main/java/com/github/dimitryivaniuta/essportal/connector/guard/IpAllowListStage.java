package com.github.dimitryivaniuta.essportal.connector.guard;

import com.github.dimitryivaniuta.essportal.connector.config.ConnectorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;

/**
 * Exact-match address allow-list. An empty list allows everyone.
 */
@Slf4j
@RequiredArgsConstructor
public class IpAllowListStage implements GuardStage {

    private final ConnectorProperties properties;

    @Override
    public Mono<StageResult> apply(final GuardContext context) {
        if (properties.allowedIps().isEmpty() || properties.allowedIps().contains(context.clientIp())) {
            return Mono.just(StageResult.proceed(context));
        }
        log.warn("Forbidden: IP {} not in allow-list ({} {})", context.clientIp(), context.method(), context.endpoint());
        return Mono.just(StageResult.reject(context, HttpStatus.FORBIDDEN,
                "IP " + context.clientIp() + " not allowed."));
    }
}
