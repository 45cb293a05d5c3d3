package com.github.dimitryivaniuta.essportal.gateway.web.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Portal user merged with the HR employee profile when it could be fetched.
 *
 * @param hrProfile downstream employee record, null when unlinked or unavailable
 */
public record UserProfileResponse(
        Long id,
        String email,
        String fullName,
        Long tenantId,
        Long hrEmployeeId,
        String jobTitle,
        String phone,
        boolean isAdmin,
        JsonNode hrProfile
) { }
