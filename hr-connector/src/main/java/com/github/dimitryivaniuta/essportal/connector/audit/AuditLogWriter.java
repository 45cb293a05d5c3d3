package com.github.dimitryivaniuta.essportal.connector.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Append-only audit sink. A persistence failure is logged and dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditLogWriter {

    /** Longest message stored per entry. */
    static final int MAX_MESSAGE_LENGTH = 255;

    private final AuditLogRepository repository;

    /**
     * Persists the entry. The returned Mono always completes empty.
     */
    public Mono<Void> record(final AuditLogEntry entry) {
        if (entry.getMessage() != null && entry.getMessage().length() > MAX_MESSAGE_LENGTH) {
            entry.setMessage(entry.getMessage().substring(0, MAX_MESSAGE_LENGTH));
        }
        return Mono.defer(() -> repository.save(entry))
                .doOnNext(saved -> log.debug("Audit {} {} -> {} ({} ms)",
                        saved.getMethod(), saved.getEndpoint(), saved.getStatusCode(), saved.getDurationMs()))
                .then()
                .onErrorResume(e -> {
                    log.error("Failed to write ESS API log for {} {} (status {}): {}",
                            entry.getMethod(), entry.getEndpoint(), entry.getStatusCode(), e.getMessage(), e);
                    return Mono.empty();
                });
    }
}
