package com.github.dimitryivaniuta.essportal.gateway.vault;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credential vault key material.
 *
 * @param key Base64-encoded 256-bit AES key ({@code openssl rand -base64 32})
 */
@ConfigurationProperties(prefix = "security.vault")
public record VaultProperties(String key) {

    @Override
    public String toString() {
        return "VaultProperties[key=" + (key == null || key.isBlank() ? "<unset>" : "<redacted>") + "]";
    }
}
