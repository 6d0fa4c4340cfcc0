package com.authcore.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.authcore.backend.modules.audit.domain.AuditLog;
import com.authcore.backend.modules.audit.infrastructure.AuditLogRepository;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    public static final String RESOURCE_ACCOUNT = "ACCOUNT";

    private static final String REQUEST_ID_MDC_KEY = "requestId";

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorAccountId(command.actorAccountId());
        auditLog.setCorrelationId(command.correlationId() != null ? command.correlationId() : MDC.get(REQUEST_ID_MDC_KEY));
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    /**
     * Shorthand for events about a single account.
     */
    public void recordAccountEvent(String actionType, UUID accountId, Map<String, Object> detail) {
        record(new AuditLogCommand(
                actionType,
                RESOURCE_ACCOUNT,
                accountId != null ? accountId.toString() : "unknown",
                accountId,
                null,
                detail
        ));
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorAccountId,
            String correlationId,
            Map<String, Object> detail
    ) {
    }
}
