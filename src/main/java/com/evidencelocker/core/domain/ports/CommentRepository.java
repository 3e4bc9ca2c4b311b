package com.evidencelocker.core.domain.ports;

import com.evidencelocker.core.domain.Comment;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CommentRepository {
    Comment save(Comment comment);
    Optional<Comment> findById(UUID commentId);
    List<Comment> findByCase(UUID caseId);
    List<Comment> findByEvidence(UUID evidenceId);
    Comment updateContent(UUID commentId, String content);
    void delete(UUID commentId);
}
