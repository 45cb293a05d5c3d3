package com.github.dimitryivaniuta.essportal.gateway.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

/**
 * Partial update; null means "leave unchanged".
 */
public record AdminUserUpdateRequest(
        @Email String email,
        @Size(min = 8) String password,
        String fullName,
        Long tenantId,
        Long hrEmployeeId,
        String jobTitle,
        String phone,
        Boolean isAdmin,
        Boolean isActive
) {
    @Override
    public String toString() {
        return "AdminUserUpdateRequest[email=" + email + ", tenantId=" + tenantId
                + ", hrEmployeeId=" + hrEmployeeId + ", isAdmin=" + isAdmin + ", isActive=" + isActive + "]";
    }
}
