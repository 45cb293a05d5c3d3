package com.github.dimitryivaniuta.essportal.gateway.web.dto;

import java.time.OffsetDateTime;

/**
 * Stored HR connection settings. The key itself is never returned.
 */
public record HrConfigResponse(
        Long tenantId,
        String baseUrl,
        String dbName,
        String accountLogin,
        boolean apiKeyConfigured,
        OffsetDateTime updatedAt
) { }
