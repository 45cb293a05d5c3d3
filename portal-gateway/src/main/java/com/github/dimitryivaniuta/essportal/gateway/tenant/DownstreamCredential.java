package com.github.dimitryivaniuta.essportal.gateway.tenant;

/**
 * Decrypted, request-scoped credential for one HR backend call. Never persisted or logged.
 */
public record DownstreamCredential(Long tenantId, String baseUrl, String apiKey) {

    @Override
    public String toString() {
        return "DownstreamCredential[tenantId=" + tenantId + ", baseUrl=" + baseUrl + ", apiKey=<redacted>]";
    }
}
