package com.github.dimitryivaniuta.essportal.connector.guard;

import com.github.dimitryivaniuta.essportal.connector.audit.AuditLogEntry;
import com.github.dimitryivaniuta.essportal.connector.audit.AuditLogWriter;
import com.github.dimitryivaniuta.essportal.connector.config.ConnectorProperties;
import com.github.dimitryivaniuta.essportal.connector.token.ResourceKind;
import com.github.dimitryivaniuta.essportal.connector.token.ServiceTokenService;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Wraps every ESS API handler in the stage pipeline:
 * kill switch, IP allow-list, bearer presence, token validation, scope.
 *
 * <p>Exactly one audit entry is written per call, for rejections, handled calls and
 * handler failures alike, and with status 499 when the caller goes away first.</p>
 */
@Slf4j
@Component
public class InboundGuard {

    /** Status recorded when the caller goes away before a response is produced. */
    static final int CLIENT_CLOSED_REQUEST = 499;

    static final String INTERNAL_MESSAGE = "An error occurred processing your request.";

    private final List<GuardStage> stages;
    private final AuditLogWriter auditLogWriter;
    private final Clock clock;

    @Autowired
    public InboundGuard(final ConnectorProperties properties,
                        final ServiceTokenService tokenService,
                        final AuditLogWriter auditLogWriter,
                        final Clock clock) {
        this(List.of(
                new KillSwitchStage(properties),
                new IpAllowListStage(properties),
                new BearerTokenStage(),
                new ServiceTokenStage(tokenService),
                new ScopeStage()
        ), auditLogWriter, clock);
    }

    InboundGuard(final List<GuardStage> stages, final AuditLogWriter auditLogWriter, final Clock clock) {
        this.stages = List.copyOf(stages);
        this.auditLogWriter = auditLogWriter;
        this.clock = clock;
    }

    /**
     * Runs the pipeline and, when every stage passes, the handler.
     *
     * <p>Every endpoint passes the {@link ResourceKind} of the records it reads or writes, so
     * the scope stage can refuse a token limited to other kinds. Only endpoints that expose no
     * HR records, such as the auth test, pass null, which any active token may call.</p>
     *
     * @param kind    resource kind the handler touches, or null for unscoped endpoints
     * @param handler receives the context with the resolved caller
     */
    public Mono<ResponseEntity<Object>> execute(final ServerWebExchange exchange,
                                                final ResourceKind kind,
                                                final Function<GuardContext, Mono<ResponseEntity<Object>>> handler) {
        final long startedAt = clock.millis();
        final GuardContext initial = GuardContext.from(exchange, kind);
        final AtomicReference<GuardContext> latest = new AtomicReference<>(initial);
        final AtomicBoolean audited = new AtomicBoolean();

        return runStages(initial, 0)
                .flatMap(result -> {
                    latest.set(result.context());
                    if (result.rejected()) {
                        return Mono.just(new Outcome(
                                errorResponse(result.rejectStatus(), result.message()),
                                result.rejectStatus().value(),
                                result.message()));
                    }
                    return invoke(handler, result.context());
                })
                .onErrorResume(e -> {
                    log.error("Internal Server Error in guard pipeline for {}: {}", latest.get(), e.getMessage(), e);
                    return Mono.just(internalError(e));
                })
                .map(outcome -> {
                    // Written on its own subscription so a late disconnect cannot cancel the save
                    audit(latest.get(), outcome.status(), outcome.message(), startedAt, audited).subscribe();
                    return outcome.response();
                })
                .doOnCancel(() -> audit(latest.get(), CLIENT_CLOSED_REQUEST, "Client closed request", startedAt, audited)
                        .subscribe());
    }

    private Mono<StageResult> runStages(final GuardContext context, final int index) {
        if (index >= stages.size()) {
            return Mono.just(StageResult.proceed(context));
        }
        return Mono.defer(() -> stages.get(index).apply(context))
                .flatMap(result -> result.rejected() ? Mono.just(result) : runStages(result.context(), index + 1));
    }

    private Mono<Outcome> invoke(final Function<GuardContext, Mono<ResponseEntity<Object>>> handler,
                                 final GuardContext context) {
        return Mono.defer(() -> handler.apply(context))
                .map(response -> new Outcome(response, response.getStatusCode().value(), describe(response)))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Handler produced no response")))
                .onErrorResume(e -> {
                    log.error("Internal Server Error in controller for {}: {}", context, e.getMessage(), e);
                    return Mono.just(internalError(e));
                });
    }

    private Mono<Void> audit(final GuardContext context, final int status, final String message,
                             final long startedAt, final AtomicBoolean audited) {
        if (!audited.compareAndSet(false, true)) {
            return Mono.empty();
        }
        AuditLogEntry entry = AuditLogEntry.builder()
                .createdAt(OffsetDateTime.now(clock))
                .accountId(context.accountId())
                .tokenId(context.tokenId())
                .endpoint(context.endpoint())
                .method(context.method())
                .ipAddress(context.clientIp())
                .statusCode(status)
                .message(message)
                .durationMs(Math.max(0, clock.millis() - startedAt))
                .build();
        return auditLogWriter.record(entry);
    }

    private static Outcome internalError(final Throwable e) {
        return new Outcome(errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_MESSAGE),
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error: " + e.getMessage());
    }

    static ResponseEntity<Object> errorResponse(final HttpStatus status, final String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }

    /** "Success: msg" / "Error: msg" when the body carries a message, else the bare status. */
    private static String describe(final ResponseEntity<Object> response) {
        int status = response.getStatusCode().value();
        if (response.getBody() instanceof Map<?, ?> body && body.get("message") instanceof String msg) {
            return (status < 400 ? "Success: " : "Error: ") + msg;
        }
        return (status < 400 ? "Success" : "Error") + " (Status: " + status + ")";
    }

    private record Outcome(ResponseEntity<Object> response, int status, String message) {
    }
}
