package com.evidencelocker.core.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A note attached to exactly one parent: a case or an evidence item, never both.
 */
public record Comment(
        UUID id,
        String content,
        UUID caseId,
        UUID evidenceId,
        UUID authorId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public Comment {
        if ((caseId == null) == (evidenceId == null)) {
            throw new IllegalArgumentException("Comment must reference exactly one of case or evidence");
        }
    }

    public ResourceType parentType() {
        return caseId != null ? ResourceType.CASE : ResourceType.EVIDENCE;
    }

    public UUID parentId() {
        return caseId != null ? caseId : evidenceId;
    }
}
