package com.evidencelocker.core.domain.policy;

import com.evidencelocker.core.domain.ResourceType;

import java.util.UUID;

public record TagRelations(UUID tagId, UUID creatorId) implements ProtectedResource {

    @Override
    public ResourceType type() {
        return ResourceType.TAG;
    }

    @Override
    public UUID id() {
        return tagId;
    }
}
