package com.evidencelocker.core.domain.policy;

import com.evidencelocker.core.domain.ResourceType;

import java.util.Objects;
import java.util.UUID;

public record CaseRelations(UUID caseId, UUID creatorId, UUID leadInvestigatorId, UUID assignedToId)
        implements ProtectedResource {

    public CaseRelations {
        Objects.requireNonNull(caseId, "caseId");
        Objects.requireNonNull(creatorId, "creatorId");
    }

    public boolean involves(UUID principalId) {
        return principalId.equals(creatorId)
                || principalId.equals(leadInvestigatorId)
                || principalId.equals(assignedToId);
    }

    @Override
    public ResourceType type() {
        return ResourceType.CASE;
    }

    @Override
    public UUID id() {
        return caseId;
    }
}
