package com.github.dimitryivaniuta.essportal.connector.guard;

import com.github.dimitryivaniuta.essportal.connector.token.AuthenticatedCaller;
import com.github.dimitryivaniuta.essportal.connector.token.ResourceKind;
import java.net.InetSocketAddress;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ServerWebExchange;

/**
 * What the guard knows about an inbound call so far. Each stage returns a copy with
 * more filled in.
 *
 * @param endpoint       request path
 * @param method         HTTP method name
 * @param clientIp       caller address, {@code "unknown"} when the transport does not expose one
 * @param authorization  raw Authorization header, may be null
 * @param resourceKind   kind the operation touches; null when it is not resource-scoped
 * @param bearerToken    extracted token, set by the presence stage
 * @param caller         resolved token and account, set by the validation stage
 */
public record GuardContext(
        String endpoint,
        String method,
        String clientIp,
        String authorization,
        ResourceKind resourceKind,
        String bearerToken,
        AuthenticatedCaller caller
) {

    static final String UNKNOWN_IP = "unknown";

    public static GuardContext from(final ServerWebExchange exchange, final ResourceKind kind) {
        ServerHttpRequest request = exchange.getRequest();
        return new GuardContext(
                request.getPath().value(),
                request.getMethod().name(),
                clientIp(request.getRemoteAddress()),
                request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION),
                kind,
                null,
                null);
    }

    public GuardContext withBearerToken(final String token) {
        return new GuardContext(endpoint, method, clientIp, authorization, resourceKind, token, caller);
    }

    public GuardContext withCaller(final AuthenticatedCaller resolved) {
        return new GuardContext(endpoint, method, clientIp, authorization, resourceKind, bearerToken, resolved);
    }

    public Long accountId() {
        return caller == null ? null : caller.account().getId();
    }

    public Long tokenId() {
        return caller == null ? null : caller.token().getId();
    }

    @Override
    public String toString() {
        return "GuardContext[" + method + " " + endpoint + " from " + clientIp
                + ", kind=" + (resourceKind == null ? "-" : resourceKind.tag())
                + ", account=" + accountId() + "]";
    }

    private static String clientIp(final InetSocketAddress address) {
        if (address == null) {
            return UNKNOWN_IP;
        }
        return address.getAddress() != null ? address.getAddress().getHostAddress() : address.getHostString();
    }
}
