package com.evidencelocker.core.application;

import com.evidencelocker.core.domain.AuditAction;
import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.Tag;
import com.evidencelocker.core.domain.policy.PolicyAction;
import com.evidencelocker.core.domain.ports.TagRepository;
import com.evidencelocker.core.exception.ConflictException;
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
import java.util.regex.Pattern;

@Service
public class TagService {

    private static final Logger log = LoggerFactory.getLogger(TagService.class);

    static final String DEFAULT_COLOR = "#3b82f6";
    private static final Pattern COLOR = Pattern.compile("^#[0-9a-fA-F]{6}$");

    private final TagRepository tags;
    private final AccessGuard guard;
    private final AuditTrailService auditTrail;
    private final Clock clock;

    public TagService(TagRepository tags, AccessGuard guard, AuditTrailService auditTrail, Clock clock) {
        this.tags = tags;
        this.guard = guard;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    @Transactional
    public Tag create(Principal creator, String name, String color) {
        guard.requireCreation(creator, ResourceType.TAG);
        String tagName = requireName(name);
        String tagColor = normaliseColor(color);
        if (tags.findByName(tagName).isPresent()) {
            throw new ConflictException("Tag name already in use: " + tagName);
        }

        Tag saved = tags.save(new Tag(UUID.randomUUID(), tagName, tagColor, creator.id(),
                OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS)));
        auditTrail.record(creator, AuditAction.CREATE_TAG, ResourceType.TAG, saved.id(),
                Map.of("name", saved.name(), "color", saved.color()));
        log.info("Tag {} '{}' created by {}", saved.id(), saved.name(), creator.id());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Tag> list(Principal requester) {
        log.debug("Listing tags for {}", requester.id());
        return tags.findAllNewestFirst();
    }

    @Transactional
    public Tag update(Principal requester, UUID tagId, String name, String color) {
        guard.requireTag(requester, PolicyAction.UPDATE, tagId);
        String tagName = requireName(name);
        String tagColor = normaliseColor(color);
        tags.findByName(tagName)
                .filter(other -> !other.id().equals(tagId))
                .ifPresent(other -> {
                    throw new ConflictException("Tag name already in use: " + tagName);
                });

        Tag updated = tags.update(tagId, tagName, tagColor);
        auditTrail.record(requester, AuditAction.UPDATE_TAG, ResourceType.TAG, tagId,
                Map.of("name", updated.name(), "color", updated.color()));
        return updated;
    }

    @Transactional
    public void delete(Principal requester, UUID tagId) {
        guard.requireTag(requester, PolicyAction.DELETE, tagId);
        Tag existing = tags.findById(tagId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.TAG, tagId));

        tags.delete(tagId);
        auditTrail.record(requester, AuditAction.DELETE_TAG, ResourceType.TAG, tagId, Map.of("name", existing.name()));
        log.info("Tag {} '{}' deleted by {}", tagId, existing.name(), requester.id());
    }

    /** Idempotent; no audit entry when the tag was already attached. */
    @Transactional
    public void attach(Principal requester, UUID evidenceId, UUID tagId) {
        guard.requireEvidence(requester, PolicyAction.UPDATE, evidenceId);
        Tag tag = tags.findById(tagId).orElseThrow(() -> new ResourceNotFoundException(ResourceType.TAG, tagId));

        if (tags.attach(evidenceId, tagId)) {
            auditTrail.record(requester, AuditAction.TAG_EVIDENCE, ResourceType.EVIDENCE, evidenceId, tagDetails(tag));
        } else {
            log.debug("Tag {} already attached to evidence {}", tagId, evidenceId);
        }
    }

    /** Idempotent; no audit entry when the tag was not attached. */
    @Transactional
    public void detach(Principal requester, UUID evidenceId, UUID tagId) {
        guard.requireEvidence(requester, PolicyAction.UPDATE, evidenceId);
        Tag tag = tags.findById(tagId).orElseThrow(() -> new ResourceNotFoundException(ResourceType.TAG, tagId));

        if (tags.detach(evidenceId, tagId)) {
            auditTrail.record(requester, AuditAction.UNTAG_EVIDENCE, ResourceType.EVIDENCE, evidenceId, tagDetails(tag));
        } else {
            log.debug("Tag {} was not attached to evidence {}", tagId, evidenceId);
        }
    }

    @Transactional(readOnly = true)
    public List<Tag> tagsFor(Principal requester, UUID evidenceId) {
        guard.requireEvidence(requester, PolicyAction.READ, evidenceId);
        return tags.findByEvidence(evidenceId);
    }

    private static Map<String, Object> tagDetails(Tag tag) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tagId", tag.id());
        details.put("tagName", tag.name());
        return details;
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name is required");
        }
        String trimmed = name.trim();
        if (trimmed.length() > 100) {
            throw new ValidationException("name exceeds 100 characters");
        }
        return trimmed;
    }

    private static String normaliseColor(String color) {
        if (color == null || color.isBlank()) {
            return DEFAULT_COLOR;
        }
        if (!COLOR.matcher(color.trim()).matches()) {
            throw new ValidationException("color must be a #rrggbb hex value");
        }
        return color.trim().toLowerCase();
    }
}
