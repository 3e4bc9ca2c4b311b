package com.evidencelocker.core.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpringCustodyRepository extends JpaRepository<CustodyEntryEntity, UUID> {
    Optional<CustodyEntryEntity> findFirstByEvidenceIdOrderBySequenceNoDesc(UUID evidenceId);
    List<CustodyEntryEntity> findByEvidenceIdOrderBySequenceNoDesc(UUID evidenceId);
    List<CustodyEntryEntity> findByEvidenceIdOrderBySequenceNoAsc(UUID evidenceId);
}
