package com.github.dimitryivaniuta.essportal.connector.audit;

import java.time.OffsetDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * One row per inbound ESS API call attempt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("ess_api_logs")
public class AuditLogEntry {

    @Column("account_id")
    private Long accountId;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Column("duration_ms")
    private long durationMs;

    @Column("endpoint")
    private String endpoint;

    @Id
    @Column("id")
    private Long id;

    @Column("ip_address")
    private String ipAddress;

    @Column("message")
    private String message;

    @Column("method")
    private String method;

    @Column("status_code")
    private int statusCode;

    @Column("token_id")
    private Long tokenId;
}
