package com.evidencelocker.core.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record AuditLogEntry(
        UUID id,
        UUID principalId,
        AuditAction action,
        ResourceType resourceType,
        UUID resourceId,
        Map<String, Object> details,
        OffsetDateTime occurredAt
) {
}
