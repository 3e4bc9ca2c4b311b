package com.evidencelocker.core.infrastructure.jpa;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface SpringEvidenceRepository extends JpaRepository<EvidenceEntity, UUID> {
    long countByCaseId(UUID caseId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from EvidenceEntity e where e.id = :id")
    Optional<EvidenceEntity> findForUpdateById(@Param("id") UUID id);
}
