package com.github.dimitryivaniuta.essportal.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Full replacement of a tenant's HR connection settings.
 */
public record HrConfigRequest(
        @NotBlank @Pattern(regexp = "^https?://.+", message = "must be an http(s) URL") String baseUrl,
        @NotBlank String dbName,
        @NotBlank String accountLogin,
        @NotBlank String apiKey
) {
    @Override
    public String toString() {
        return "HrConfigRequest[baseUrl=" + baseUrl + ", dbName=" + dbName + ", accountLogin=" + accountLogin + "]";
    }
}
