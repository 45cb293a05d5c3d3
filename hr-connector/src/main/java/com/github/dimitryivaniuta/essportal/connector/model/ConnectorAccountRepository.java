package com.github.dimitryivaniuta.essportal.connector.model;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ConnectorAccountRepository extends ReactiveCrudRepository<ConnectorAccountEntity, Long> {
}
