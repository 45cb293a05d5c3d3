package com.github.dimitryivaniuta.essportal.gateway.model;

import java.time.OffsetDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Connection settings of a tenant's HR backend. At most one row per tenant.
 * The API key is only ever stored encrypted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("tenant_credentials")
public class TenantCredentialEntity {

    /** Login of the account the API key belongs to. */
    @Column("account_login")
    private String accountLogin;

    /** Base URL of the HR backend, e.g. {@code https://hr.example/db}. */
    @Column("base_url")
    private String baseUrl;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Column("db_name")
    private String dbName;

    /** Vault ciphertext of the downstream API key. */
    @ToString.Exclude
    @Column("encrypted_api_key")
    private String encryptedApiKey;

    @Id
    @Column("id")
    private Long id;

    @Column("tenant_id")
    private Long tenantId;

    @Column("updated_at")
    private OffsetDateTime updatedAt;
}
