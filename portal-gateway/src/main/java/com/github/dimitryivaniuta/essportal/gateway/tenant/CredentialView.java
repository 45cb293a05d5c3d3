package com.github.dimitryivaniuta.essportal.gateway.tenant;

import java.time.OffsetDateTime;

/**
 * Stored connection settings without the key, for admin display.
 */
public record CredentialView(
        Long tenantId,
        String baseUrl,
        String dbName,
        String accountLogin,
        boolean apiKeyConfigured,
        OffsetDateTime updatedAt
) { }
