package com.github.dimitryivaniuta.essportal.connector.audit;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AuditLogRepository extends ReactiveCrudRepository<AuditLogEntry, Long> {
}
