package com.evidencelocker.core.domain.ports;

import com.evidencelocker.core.domain.CaseChanges;
import com.evidencelocker.core.domain.CaseRecord;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CaseRepository {
    CaseRecord save(CaseRecord caseRecord);
    Optional<CaseRecord> findById(UUID caseId);
    List<CaseRecord> findAllNewestFirst();
    boolean existsByCaseNumber(String caseNumber);

    /**
     * Applies {@code changes}; when {@code expectedVersion} is given and no longer current the
     * update is rejected with a conflict.
     */
    CaseRecord update(UUID caseId, CaseChanges changes, Long expectedVersion);
}
