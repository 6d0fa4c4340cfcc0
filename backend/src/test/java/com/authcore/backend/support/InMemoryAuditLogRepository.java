package com.authcore.backend.support;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.authcore.backend.modules.audit.domain.AuditLog;
import com.authcore.backend.modules.audit.infrastructure.AuditLogRepository;

public class InMemoryAuditLogRepository implements AuditLogRepository {

    private final List<AuditLog> logs = new ArrayList<>();

    @Override
    public AuditLog save(AuditLog auditLog) {
        logs.add(auditLog);
        return auditLog;
    }

    @Override
    public List<AuditLog> findByActorAccountId(UUID accountId) {
        return logs.stream().filter(log -> accountId.equals(log.getActorAccountId())).toList();
    }

    public List<String> actionTypes() {
        return logs.stream().map(AuditLog::getActionType).toList();
    }
}
