package com.github.dimitryivaniuta.essportal.connector.model;

import com.github.dimitryivaniuta.essportal.connector.token.TokenScope;
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
 * Persisted service token. The value is only ever replaced by regeneration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("ess_api_tokens")
public class ServiceTokenEntity {

    @Column("account_id")
    private Long accountId;

    @Column("active")
    private boolean active;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Id
    @Column("id")
    private Long id;

    @Column("label")
    private String label;

    @Column("last_used_at")
    private OffsetDateTime lastUsedAt;

    @Column("note")
    private String note;

    /** Resource kinds; empty means unrestricted. */
    @Column("scope")
    private TokenScope scope;

    @ToString.Exclude
    @Column("token")
    private String token;
}
