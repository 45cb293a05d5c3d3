package com.github.dimitryivaniuta.essportal.gateway.web.dto;

import jakarta.validation.constraints.NotNull;

public record TenantStatusRequest(@NotNull Boolean active) { }
