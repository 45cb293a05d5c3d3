package com.github.dimitryivaniuta.essportal.gateway.web.dto;

/**
 * OAuth-style token response. Serialized in snake_case.
 */
public record TokenResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        long expiresIn
) {
    public static TokenResponse bearer(final String accessToken, final String refreshToken, final long expiresIn) {
        return new TokenResponse(accessToken, refreshToken, "bearer", expiresIn);
    }
}
