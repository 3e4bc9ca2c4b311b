package com.evidencelocker.core.domain.ports;

import com.evidencelocker.core.domain.AuditAction;
import com.evidencelocker.core.domain.AuditLogEntry;
import com.evidencelocker.core.domain.AuditQuery;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only store for audit entries.
 */
public interface AuditLogRepository {
    AuditLogEntry append(AuditLogEntry entry);
    Optional<AuditLogEntry> findById(UUID entryId);
    List<AuditLogEntry> findNewestFirst(AuditQuery query, int limit);
    long countByResourceAndAction(UUID resourceId, AuditAction action);
}
