package com.github.dimitryivaniuta.essportal.gateway.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AdminUserCreateRequest(
        @NotBlank @Email String email,
        @NotBlank @Size(min = 8) String password,
        String fullName,
        @NotNull Long tenantId,
        Long hrEmployeeId,
        String jobTitle,
        String phone,
        Boolean isAdmin,
        Boolean isActive
) {
    @Override
    public String toString() {
        return "AdminUserCreateRequest[email=" + email + ", tenantId=" + tenantId + "]";
    }
}
