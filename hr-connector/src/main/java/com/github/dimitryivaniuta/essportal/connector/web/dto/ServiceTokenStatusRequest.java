package com.github.dimitryivaniuta.essportal.connector.web.dto;

import jakarta.validation.constraints.NotNull;

public record ServiceTokenStatusRequest(@NotNull Boolean active) {
}
