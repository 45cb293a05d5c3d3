package com.github.dimitryivaniuta.essportal.gateway.security;

import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import com.github.dimitryivaniuta.essportal.gateway.auth.TokenService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import reactor.core.publisher.Mono;

/**
 * Adapts {@link TokenService#verifyAccess(String)} to Spring Security's resource server,
 * so refresh tokens and expired tokens are rejected by the same code that mints them.
 */
@RequiredArgsConstructor
public class AccessTokenJwtDecoder implements ReactiveJwtDecoder {

    private final TokenService tokenService;

    @Override
    public Mono<Jwt> decode(final String token) throws JwtException {
        return tokenService.verifyAccess(token)
                .map(claims -> Jwt.withTokenValue(token)
                        .header("typ", "JWT")
                        .claims(c -> c.putAll(claims.custom()))
                        .subject(claims.subject())
                        .issuedAt(claims.issuedAt())
                        .expiresAt(claims.expiresAt())
                        .build())
                .onErrorMap(GatewayException.class, e -> new BadJwtException(e.getMessage(), e));
    }
}
