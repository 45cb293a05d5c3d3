package com.github.dimitryivaniuta.essportal.gateway.auth;

import java.time.Instant;
import java.util.Map;

/**
 * Verified content of a bearer token.
 *
 * @param subject   user identity (email)
 * @param admin     administrator flag at the time of minting
 * @param type      token kind
 * @param issuedAt  {@code iat}
 * @param expiresAt {@code exp}
 * @param custom    non-registered claims, including {@code is_admin} and {@code token_type}
 */
public record TokenClaims(
        String subject,
        boolean admin,
        TokenType type,
        Instant issuedAt,
        Instant expiresAt,
        Map<String, Object> custom
) { }
