package com.github.dimitryivaniuta.essportal.gateway.auth;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Password reset flow settings.
 *
 * @param ttl         lifetime of a reset token
 * @param frontendUrl portal base URL used to build the reset link
 * @param from        sender address of the reset email
 * @param subject     subject line of the reset email
 */
@Validated
@ConfigurationProperties(prefix = "portal.password-reset")
public record PasswordResetProperties(
        @DefaultValue("PT60M") Duration ttl,
        @DefaultValue("http://localhost:3000") @NotBlank String frontendUrl,
        @DefaultValue("no-reply@ess-portal.local") String from,
        @DefaultValue("Password Reset Request - ESS Portal") String subject
) { }
