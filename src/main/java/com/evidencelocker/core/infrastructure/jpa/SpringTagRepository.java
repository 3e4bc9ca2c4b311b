package com.evidencelocker.core.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpringTagRepository extends JpaRepository<TagEntity, UUID> {
    Optional<TagEntity> findByName(String name);
    List<TagEntity> findAllByOrderByCreatedAtDesc();

    @Query(value = "SELECT t.* FROM tags t JOIN evidence_tags et ON et.tag_id = t.id " +
            "WHERE et.evidence_id = :evidenceId ORDER BY t.name", nativeQuery = true)
    List<TagEntity> findByEvidenceId(@Param("evidenceId") UUID evidenceId);

    @Query(value = "SELECT COUNT(*) FROM evidence_tags WHERE evidence_id = :evidenceId AND tag_id = :tagId",
            nativeQuery = true)
    long countLinks(@Param("evidenceId") UUID evidenceId, @Param("tagId") UUID tagId);

    @Modifying
    @Query(value = "INSERT INTO evidence_tags (evidence_id, tag_id) VALUES (:evidenceId, :tagId)", nativeQuery = true)
    int insertLink(@Param("evidenceId") UUID evidenceId, @Param("tagId") UUID tagId);

    @Modifying
    @Query(value = "DELETE FROM evidence_tags WHERE evidence_id = :evidenceId AND tag_id = :tagId", nativeQuery = true)
    int deleteLink(@Param("evidenceId") UUID evidenceId, @Param("tagId") UUID tagId);
}
