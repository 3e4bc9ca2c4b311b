package com.evidencelocker.core.domain.ports;

import com.evidencelocker.core.domain.Evidence;
import com.evidencelocker.core.domain.EvidenceStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface EvidenceRepository {
    Evidence save(Evidence evidence);
    Optional<Evidence> findById(UUID evidenceId);
    List<Evidence> findAllById(Collection<UUID> evidenceIds);
    long countByCase(UUID caseId);
    Evidence updateStatus(UUID evidenceId, EvidenceStatus status, Long expectedVersion);

    /** Takes a write lock on the evidence row for the rest of the current transaction. */
    boolean lockForAppend(UUID evidenceId);
}
