package com.github.dimitryivaniuta.essportal.gateway.tenant;

/**
 * Full replacement of a tenant's HR connection settings. The key is plaintext here and
 * is encrypted before it reaches the repository.
 */
public record CredentialUpdate(String baseUrl, String dbName, String accountLogin, String apiKey) {

    @Override
    public String toString() {
        return "CredentialUpdate[baseUrl=" + baseUrl + ", dbName=" + dbName
                + ", accountLogin=" + accountLogin + ", apiKey=<redacted>]";
    }
}
