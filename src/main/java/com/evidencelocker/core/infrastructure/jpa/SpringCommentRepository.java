package com.evidencelocker.core.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SpringCommentRepository extends JpaRepository<CommentEntity, UUID> {
    List<CommentEntity> findByCaseIdOrderByCreatedAtAsc(UUID caseId);
    List<CommentEntity> findByEvidenceIdOrderByCreatedAtAsc(UUID evidenceId);
}
