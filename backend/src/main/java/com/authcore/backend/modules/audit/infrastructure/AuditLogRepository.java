package com.authcore.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import com.authcore.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface AuditLogRepository extends Repository<AuditLog, UUID> {

    AuditLog save(AuditLog auditLog);

    @Query("select a from AuditLog a where a.actorAccountId = :accountId order by a.createdAt desc")
    List<AuditLog> findByActorAccountId(@Param("accountId") UUID accountId);
}
