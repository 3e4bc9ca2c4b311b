package com.evidencelocker.core.application;

import com.evidencelocker.core.domain.AuditAction;
import com.evidencelocker.core.domain.Comment;
import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.policy.CommentRelations;
import com.evidencelocker.core.domain.policy.PolicyAction;
import com.evidencelocker.core.domain.ports.CommentRepository;
import com.evidencelocker.core.exception.ResourceNotFoundException;
import com.evidencelocker.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class CommentService {

    private static final Logger log = LoggerFactory.getLogger(CommentService.class);
    private static final int MAX_CONTENT_LENGTH = 4000;

    private final CommentRepository comments;
    private final AccessGuard guard;
    private final AuditTrailService auditTrail;
    private final Clock clock;

    public CommentService(CommentRepository comments, AccessGuard guard, AuditTrailService auditTrail, Clock clock) {
        this.comments = comments;
        this.guard = guard;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    @Transactional
    public Comment add(Principal author, ResourceType parentType, UUID parentId, String content) {
        requireParentReadable(author, parentType, parentId);
        String text = requireContent(content);

        OffsetDateTime now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        Comment saved = comments.save(new Comment(
                UUID.randomUUID(),
                text,
                parentType == ResourceType.CASE ? parentId : null,
                parentType == ResourceType.EVIDENCE ? parentId : null,
                author.id(),
                now,
                now
        ));

        auditTrail.record(author, AuditAction.ADD_COMMENT, ResourceType.COMMENT, saved.id(), details(saved));
        log.info("Comment {} added to {} {} by {}", saved.id(), parentType, parentId, author.id());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Comment> list(Principal requester, ResourceType parentType, UUID parentId) {
        requireParentReadable(requester, parentType, parentId);
        return parentType == ResourceType.CASE ? comments.findByCase(parentId) : comments.findByEvidence(parentId);
    }

    @Transactional
    public Comment edit(Principal requester, UUID commentId, String content) {
        guard.requireComment(requester, PolicyAction.UPDATE, commentId);
        String text = requireContent(content);

        Comment updated = comments.updateContent(commentId, text);
        auditTrail.record(requester, AuditAction.UPDATE_COMMENT, ResourceType.COMMENT, commentId, details(updated));
        log.info("Comment {} edited by {}", commentId, requester.id());
        return updated;
    }

    @Transactional
    public void delete(Principal requester, UUID commentId) {
        CommentRelations relations = guard.requireComment(requester, PolicyAction.DELETE, commentId);
        Comment existing = comments.findById(commentId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.COMMENT, commentId));

        comments.delete(commentId);

        Map<String, Object> details = details(existing);
        details.put("author", relations.authorId());
        auditTrail.record(requester, AuditAction.DELETE_COMMENT, ResourceType.COMMENT, commentId, details);
        log.info("Comment {} deleted by {}", commentId, requester.id());
    }

    private void requireParentReadable(Principal principal, ResourceType parentType, UUID parentId) {
        switch (parentType) {
            case CASE -> guard.requireCase(principal, PolicyAction.READ, parentId);
            case EVIDENCE -> guard.requireEvidence(principal, PolicyAction.READ, parentId);
            default -> throw new ValidationException("Comments attach to a case or an evidence item, not " + parentType);
        }
    }

    private static String requireContent(String content) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("content is required");
        }
        if (content.length() > MAX_CONTENT_LENGTH) {
            throw new ValidationException("content exceeds " + MAX_CONTENT_LENGTH + " characters");
        }
        return content.trim();
    }

    private static Map<String, Object> details(Comment comment) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("parentType", comment.parentType());
        details.put("parentId", comment.parentId());
        details.put("content", comment.content());
        return details;
    }
}
