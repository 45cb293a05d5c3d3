package com.github.dimitryivaniuta.essportal.connector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * HR backend account a service token acts as.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("ess_accounts")
public class ConnectorAccountEntity {

    @Column("active")
    private boolean active;

    @Column("display_name")
    private String displayName;

    @Id
    @Column("id")
    private Long id;

    @Column("login")
    private String login;
}
