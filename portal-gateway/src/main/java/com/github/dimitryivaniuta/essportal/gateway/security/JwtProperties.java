package com.github.dimitryivaniuta.essportal.gateway.security;

import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Bearer token settings for the portal: HMAC secret, algorithm and lifetimes.
 * Bound once at startup and never re-read.
 *
 * @param secret          shared HMAC secret (raw string, at least as long as the algorithm's hash)
 * @param algorithm       JWS algorithm name: HS256, HS384 or HS512
 * @param accessTokenTtl  access token lifetime
 * @param refreshTokenTtl refresh token lifetime
 * @param issuer          optional {@code iss} claim
 */
@Validated
@ConfigurationProperties(prefix = "security.jwt")
public record JwtProperties(
        String secret,
        @DefaultValue("HS256") @Pattern(regexp = "HS(256|384|512)") String algorithm,
        @DefaultValue("PT30M") Duration accessTokenTtl,
        @DefaultValue("P7D") Duration refreshTokenTtl,
        String issuer
) {
    @Override
    public String toString() {
        return "JwtProperties[algorithm=" + algorithm + ", accessTokenTtl=" + accessTokenTtl
                + ", refreshTokenTtl=" + refreshTokenTtl + ", issuer=" + issuer + "]";
    }
}
