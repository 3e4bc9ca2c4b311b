package com.evidencelocker.core.domain.policy;

import com.evidencelocker.core.domain.ResourceType;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Evidence relations plus its owning case's relations (one hop) and every principal that has ever
 * been named as a custody recipient.
 */
public record EvidenceRelations(UUID evidenceId, UUID uploaderId, CaseRelations caseRelations, Set<UUID> custodianIds)
        implements ProtectedResource {

    public EvidenceRelations {
        Objects.requireNonNull(evidenceId, "evidenceId");
        Objects.requireNonNull(uploaderId, "uploaderId");
        Objects.requireNonNull(caseRelations, "caseRelations");
        custodianIds = custodianIds == null ? Set.of() : Set.copyOf(custodianIds);
    }

    public boolean isCustodian(UUID principalId) {
        return custodianIds.contains(principalId);
    }

    @Override
    public ResourceType type() {
        return ResourceType.EVIDENCE;
    }

    @Override
    public UUID id() {
        return evidenceId;
    }
}
