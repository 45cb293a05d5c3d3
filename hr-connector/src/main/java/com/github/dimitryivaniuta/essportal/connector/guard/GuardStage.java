package com.github.dimitryivaniuta.essportal.connector.guard;

import reactor.core.publisher.Mono;

/**
 * One check in the inbound pipeline.
 */
@FunctionalInterface
public interface GuardStage {

    Mono<StageResult> apply(GuardContext context);
}
