package com.evidencelocker.core.infrastructure.adapters;

import com.evidencelocker.core.domain.Comment;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.ports.CommentRepository;
import com.evidencelocker.core.exception.ResourceNotFoundException;
import com.evidencelocker.core.infrastructure.jpa.CommentEntity;
import com.evidencelocker.core.infrastructure.jpa.SpringCommentRepository;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaCommentRepositoryAdapter implements CommentRepository {
    private final SpringCommentRepository comments;
    private final Clock clock;

    public JpaCommentRepositoryAdapter(SpringCommentRepository comments, Clock clock) {
        this.comments = comments;
        this.clock = clock;
    }

    @Override
    public Comment save(Comment c) {
        CommentEntity e = new CommentEntity();
        e.setId(c.id());
        e.setContent(c.content());
        e.setCaseId(c.caseId());
        e.setEvidenceId(c.evidenceId());
        e.setAuthorId(c.authorId());
        e.setCreatedAt(c.createdAt());
        e.setUpdatedAt(c.updatedAt());
        return toDomain(comments.save(e));
    }

    @Override
    public Optional<Comment> findById(UUID commentId) {
        return comments.findById(commentId).map(JpaCommentRepositoryAdapter::toDomain);
    }

    @Override
    public List<Comment> findByCase(UUID caseId) {
        return comments.findByCaseIdOrderByCreatedAtAsc(caseId).stream().map(JpaCommentRepositoryAdapter::toDomain).toList();
    }

    @Override
    public List<Comment> findByEvidence(UUID evidenceId) {
        return comments.findByEvidenceIdOrderByCreatedAtAsc(evidenceId).stream().map(JpaCommentRepositoryAdapter::toDomain).toList();
    }

    @Override
    public Comment updateContent(UUID commentId, String content) {
        CommentEntity e = comments.findById(commentId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.COMMENT, commentId));
        e.setContent(content);
        e.setUpdatedAt(OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS));
        return toDomain(comments.save(e));
    }

    @Override
    public void delete(UUID commentId) {
        comments.deleteById(commentId);
    }

    private static Comment toDomain(CommentEntity e) {
        return new Comment(e.getId(), e.getContent(), e.getCaseId(), e.getEvidenceId(), e.getAuthorId(),
                e.getCreatedAt(), e.getUpdatedAt());
    }
}
