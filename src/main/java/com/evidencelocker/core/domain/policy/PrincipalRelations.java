package com.evidencelocker.core.domain.policy;

import com.evidencelocker.core.domain.ResourceType;

import java.util.UUID;

public record PrincipalRelations(UUID principalId) implements ProtectedResource {

    @Override
    public ResourceType type() {
        return ResourceType.PRINCIPAL;
    }

    @Override
    public UUID id() {
        return principalId;
    }
}
