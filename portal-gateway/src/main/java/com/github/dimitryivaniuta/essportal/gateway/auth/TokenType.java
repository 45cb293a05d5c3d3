package com.github.dimitryivaniuta.essportal.gateway.auth;

/**
 * Kind of bearer token, carried in the {@code token_type} claim so that a refresh
 * token can never be presented where an access token is expected and vice versa.
 */
public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenType(final String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }
}
