package com.github.dimitryivaniuta.essportal.common.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Reads the credential out of an {@code Authorization: Bearer <token>} header value.
 */
public final class BearerTokenExtractor {

    private static final String PREFIX = "bearer ";

    /** Characters of a token that are safe to show in logs. */
    private static final int LOG_PREFIX_LENGTH = 6;

    private BearerTokenExtractor() {}

    /**
     * @param header raw header value, may be null
     * @return the token, or empty when the header is absent, not a Bearer scheme, or blank
     */
    public static Optional<String> extract(final String header) {
        if (header == null) return Optional.empty();
        String v = header.trim();
        if (v.length() < PREFIX.length() || !v.substring(0, PREFIX.length()).toLowerCase(Locale.ROOT).equals(PREFIX)) {
            return Optional.empty();
        }
        String token = v.substring(PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    /** Log-safe abbreviation: first six characters followed by an ellipsis. */
    public static String abbreviate(final String token) {
        if (token == null || token.isEmpty()) return "<none>";
        return token.length() <= LOG_PREFIX_LENGTH ? "***" : token.substring(0, LOG_PREFIX_LENGTH) + "...";
    }
}
