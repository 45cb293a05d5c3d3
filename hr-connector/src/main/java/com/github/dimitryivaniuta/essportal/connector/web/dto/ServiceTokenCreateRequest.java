package com.github.dimitryivaniuta.essportal.connector.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * @param scope comma-separated resource kinds, e.g. {@code hr.leave,hr.leave.type}; blank = unrestricted
 */
public record ServiceTokenCreateRequest(
        @NotBlank @Size(max = 255) String label,
        @NotNull Long accountId,
        String scope,
        String note
) {
}
