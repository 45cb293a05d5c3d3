package com.github.dimitryivaniuta.essportal.connector.guard;

import com.github.dimitryivaniuta.essportal.connector.config.ConnectorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;

@Slf4j
@RequiredArgsConstructor
public class KillSwitchStage implements GuardStage {

    static final String DISABLED = "ESS API disabled.";

    private final ConnectorProperties properties;

    @Override
    public Mono<StageResult> apply(final GuardContext context) {
        if (!properties.integrationEnabled()) {
            log.warn("ESS API disabled; rejecting {}", context);
            return Mono.just(StageResult.reject(context, HttpStatus.SERVICE_UNAVAILABLE, DISABLED));
        }
        return Mono.just(StageResult.proceed(context));
    }
}
