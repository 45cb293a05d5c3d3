package com.github.dimitryivaniuta.essportal.gateway.model;

import java.time.OffsetDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Customer organization that owns one HR backend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("tenants")
public class TenantEntity {

    @Column("active")
    private boolean active;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Id
    @Column("id")
    private Long id;

    /** Unique display name. */
    @Column("name")
    private String name;

    @Column("updated_at")
    private OffsetDateTime updatedAt;
}
