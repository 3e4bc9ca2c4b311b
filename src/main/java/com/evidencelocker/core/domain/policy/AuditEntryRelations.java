package com.evidencelocker.core.domain.policy;

import com.evidencelocker.core.domain.ResourceType;

import java.util.UUID;

public record AuditEntryRelations(UUID entryId, UUID principalId) implements ProtectedResource {

    @Override
    public ResourceType type() {
        return ResourceType.AUDIT_ENTRY;
    }

    @Override
    public UUID id() {
        return entryId;
    }
}
