package com.github.dimitryivaniuta.essportal.gateway.web.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of a tenant connectivity check.
 *
 * @param status  {@code success} or {@code failure}
 * @param details downstream auth-test payload on success
 */
public record ConnectionTestResponse(String status, String message, JsonNode details) {

    public static ConnectionTestResponse success(final JsonNode details) {
        return new ConnectionTestResponse("success", "Connection to HR system succeeded.", details);
    }

    public static ConnectionTestResponse failure(final String message) {
        return new ConnectionTestResponse("failure", message, null);
    }
}
