package com.evidencelocker.core.domain.policy;

import com.evidencelocker.core.domain.ResourceType;

import java.util.Objects;
import java.util.UUID;

public record CustodyEntryRelations(UUID entryId, EvidenceRelations evidence) implements ProtectedResource {

    public CustodyEntryRelations {
        Objects.requireNonNull(entryId, "entryId");
        Objects.requireNonNull(evidence, "evidence");
    }

    @Override
    public ResourceType type() {
        return ResourceType.CUSTODY_ENTRY;
    }

    @Override
    public UUID id() {
        return entryId;
    }
}
