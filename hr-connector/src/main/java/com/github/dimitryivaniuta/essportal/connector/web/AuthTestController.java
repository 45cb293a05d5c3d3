package com.github.dimitryivaniuta.essportal.connector.web;

import com.github.dimitryivaniuta.essportal.connector.guard.InboundGuard;
import com.github.dimitryivaniuta.essportal.connector.model.ConnectorAccountEntity;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * ESS API endpoints served by the connector itself.
 */
@Slf4j
@RestController
@RequestMapping("/ess/api")
@RequiredArgsConstructor
public class AuthTestController {

    private final InboundGuard guard;

    /** Confirms the presented service token and reports the account it acts as. */
    @GetMapping("/auth-test")
    public Mono<ResponseEntity<Object>> authTest(final ServerWebExchange exchange) {
        return guard.execute(exchange, null, ctx -> {
            ConnectorAccountEntity account = ctx.caller().account();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "success");
            body.put("message", "Authentication successful.");
            body.put("authenticated_user_login", account.getLogin());
            body.put("authenticated_user_id", account.getId());
            body.put("authenticated_user_name", account.getDisplayName());
            log.info("Auth test successful for account {} (id={})", account.getLogin(), account.getId());
            return Mono.just(ResponseEntity.ok(body));
        });
    }
}
