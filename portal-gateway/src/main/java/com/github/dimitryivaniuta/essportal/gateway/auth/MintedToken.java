package com.github.dimitryivaniuta.essportal.gateway.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of token minting: compact JWS plus its effective lifetime.
 */
public record MintedToken(String token, Duration ttl, Instant expiresAt) {

    @Override
    public String toString() {
        return "MintedToken[ttl=" + ttl + ", expiresAt=" + expiresAt + "]";
    }
}
