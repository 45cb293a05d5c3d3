package com.github.dimitryivaniuta.essportal.gateway.web.dto;

import java.time.OffsetDateTime;

public record UserResponse(
        Long id,
        String email,
        String fullName,
        Long tenantId,
        Long hrEmployeeId,
        String jobTitle,
        String phone,
        boolean isAdmin,
        boolean isActive,
        OffsetDateTime createdAt
) { }
