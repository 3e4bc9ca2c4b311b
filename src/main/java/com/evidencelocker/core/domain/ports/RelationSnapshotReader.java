package com.evidencelocker.core.domain.ports;

import com.evidencelocker.core.domain.policy.CaseRelations;
import com.evidencelocker.core.domain.policy.CommentRelations;
import com.evidencelocker.core.domain.policy.CustodyEntryRelations;
import com.evidencelocker.core.domain.policy.EvidenceRelations;
import com.evidencelocker.core.domain.policy.TagRelations;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Loads the relation sets the access policy evaluates. Each method answers from a single read of
 * the underlying tables, so a grant committed concurrently is either fully visible or not at all.
 * Custody recipients are read fresh on every call.
 */
public interface RelationSnapshotReader {
    Optional<CaseRelations> caseRelations(UUID caseId);
    Optional<EvidenceRelations> evidenceRelations(UUID evidenceId);
    List<EvidenceRelations> evidenceRelationsInCase(UUID caseId);
    Optional<CommentRelations> commentRelations(UUID commentId);
    Optional<CustodyEntryRelations> custodyEntryRelations(UUID entryId);
    Optional<TagRelations> tagRelations(UUID tagId);
}
