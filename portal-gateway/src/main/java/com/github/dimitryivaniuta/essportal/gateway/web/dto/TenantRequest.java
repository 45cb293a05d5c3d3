package com.github.dimitryivaniuta.essportal.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record TenantRequest(
        @NotBlank @Size(max = 200) String name,
        Boolean active
) { }
