package com.evidencelocker.core.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SpringCaseRepository extends JpaRepository<CaseEntity, UUID> {
    List<CaseEntity> findAllByOrderByCreatedAtDesc();
    boolean existsByCaseNumber(String caseNumber);
}
