package com.evidencelocker.core.domain.policy;

import com.evidencelocker.core.domain.ResourceType;

import java.util.Objects;
import java.util.UUID;

public record CommentRelations(UUID commentId, UUID authorId, CaseRelations parentCase, EvidenceRelations parentEvidence)
        implements ProtectedResource {

    public CommentRelations {
        Objects.requireNonNull(commentId, "commentId");
        if ((parentCase == null) == (parentEvidence == null)) {
            throw new IllegalArgumentException("Comment " + commentId + " must have exactly one parent");
        }
    }

    public ProtectedResource parent() {
        return parentCase != null ? parentCase : parentEvidence;
    }

    @Override
    public ResourceType type() {
        return ResourceType.COMMENT;
    }

    @Override
    public UUID id() {
        return commentId;
    }
}
