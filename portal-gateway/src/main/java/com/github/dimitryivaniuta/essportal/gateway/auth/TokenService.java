package com.github.dimitryivaniuta.essportal.gateway.auth;

import java.time.Duration;
import java.util.Map;
import reactor.core.publisher.Mono;

/**
 * Mints and verifies the portal's HMAC-signed bearer tokens.
 *
 * <p>Verification failures are signalled as
 * {@link com.github.dimitryivaniuta.essportal.common.error.GatewayException} of kind
 * {@code UNAUTHORIZED}; the message never echoes the token.</p>
 */
public interface TokenService {

    /** Claim carrying the administrator flag. */
    String CLAIM_ADMIN = "is_admin";

    /** Claim distinguishing access from refresh tokens. */
    String CLAIM_TOKEN_TYPE = "token_type";

    Mono<MintedToken> issueAccess(String subject, Map<String, Object> claims, Duration ttl);

    Mono<MintedToken> issueRefresh(String subject, Map<String, Object> claims, Duration ttl);

    default Mono<MintedToken> issueAccess(String subject, Map<String, Object> claims) {
        return issueAccess(subject, claims, null);
    }

    default Mono<MintedToken> issueRefresh(String subject, Map<String, Object> claims) {
        return issueRefresh(subject, claims, null);
    }

    Mono<TokenClaims> verifyAccess(String token);

    Mono<TokenClaims> verifyRefresh(String token);
}
