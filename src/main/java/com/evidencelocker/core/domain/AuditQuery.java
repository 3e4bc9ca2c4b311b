package com.evidencelocker.core.domain;

import java.util.UUID;

/**
 * Optional filters for audit listings; null fields do not filter.
 */
public record AuditQuery(ResourceType resourceType, AuditAction action, UUID resourceId, UUID principalId) {

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null);
    }

    public AuditQuery withPrincipal(UUID principal) {
        return new AuditQuery(resourceType, action, resourceId, principal);
    }
}
