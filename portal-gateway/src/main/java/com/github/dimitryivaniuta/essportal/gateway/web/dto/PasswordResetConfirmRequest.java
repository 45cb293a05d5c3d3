package com.github.dimitryivaniuta.essportal.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Reset confirmation. Password length is enforced by the service so the message is uniform.
 */
public record PasswordResetConfirmRequest(
        @NotBlank String token,
        @NotBlank String newPassword
) {
    @Override
    public String toString() {
        return "PasswordResetConfirmRequest[token=<redacted>]";
    }
}
