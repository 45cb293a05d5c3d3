package com.github.dimitryivaniuta.essportal.connector.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Connector switches.
 *
 * @param integrationEnabled kill switch; false rejects every ESS API call with 503
 * @param allowedIps         caller IP allow-list; empty allows any address
 * @param admin              HTTP Basic credentials for service-token administration
 */
@Validated
@ConfigurationProperties(prefix = "connector")
public record ConnectorProperties(
        @DefaultValue("true") boolean integrationEnabled,
        @DefaultValue List<String> allowedIps,
        @Valid @NotNull Admin admin
) {

    public ConnectorProperties {
        allowedIps = allowedIps == null
                ? List.of()
                : allowedIps.stream().map(String::trim).filter(ip -> !ip.isEmpty()).toList();
    }

    /**
     * @param username admin login
     * @param password admin password (plain; encoded at startup)
     */
    public record Admin(@NotBlank String username, @NotBlank String password) {

        @Override
        public String toString() {
            return "Admin[username=" + username + ", password=<redacted>]";
        }
    }
}
