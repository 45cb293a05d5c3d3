package com.github.dimitryivaniuta.essportal.gateway.model;

import java.io.Serial;
import java.io.Serializable;
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
 * Reactive R2DBC entity for the {@code users} table.
 *
 * <p>A portal user belongs to at most one tenant and is optionally linked to an employee
 * record in that tenant's HR backend. Reset token columns are both null or both set.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("users")
public class UserEntity implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    /** Disabled users cannot log in, refresh or use the portal. */
    @Column("active")
    private boolean active;

    /** Administrator flag, mirrored into the {@code is_admin} token claim. */
    @Column("admin")
    private boolean admin;

    /** Creation timestamp (UTC); set by DB default {@code now()}. */
    @Column("created_at")
    private OffsetDateTime createdAt;

    /** Case-insensitive unique email, also the token subject. */
    @Column("email")
    private String email;

    @Column("full_name")
    private String fullName;

    /** Employee id in the tenant's HR backend, null when not linked. */
    @Column("hr_employee_id")
    private Long hrEmployeeId;

    @Id
    @Column("id")
    private Long id;

    /** BCrypt password hash; never expose in APIs/logs. */
    @ToString.Exclude
    @Column("password_hash")
    private String passwordHash;

    @Column("job_title")
    private String jobTitle;

    @Column("password_reset_expires_at")
    private OffsetDateTime passwordResetExpiresAt;

    @ToString.Exclude
    @Column("password_reset_token")
    private String passwordResetToken;

    @Column("phone")
    private String phone;

    @Column("tenant_id")
    private Long tenantId;

    /** Last update timestamp (UTC). */
    @Column("updated_at")
    private OffsetDateTime updatedAt;
}
