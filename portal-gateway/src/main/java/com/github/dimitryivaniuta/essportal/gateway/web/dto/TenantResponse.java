package com.github.dimitryivaniuta.essportal.gateway.web.dto;

import java.time.OffsetDateTime;

public record TenantResponse(
        Long id,
        String name,
        boolean active,
        OffsetDateTime createdAt
) { }
