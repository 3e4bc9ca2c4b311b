package com.evidencelocker.core.application;

import com.evidencelocker.core.config.AppProperties;
import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.policy.AccessPolicy;
import com.evidencelocker.core.domain.policy.AuditScope;
import com.evidencelocker.core.domain.policy.CaseRelations;
import com.evidencelocker.core.domain.policy.CommentRelations;
import com.evidencelocker.core.domain.policy.CustodyEntryRelations;
import com.evidencelocker.core.domain.policy.EvidenceRelations;
import com.evidencelocker.core.domain.policy.PolicyAction;
import com.evidencelocker.core.domain.policy.PolicyDecision;
import com.evidencelocker.core.domain.policy.ProtectedResource;
import com.evidencelocker.core.domain.policy.TagRelations;
import com.evidencelocker.core.domain.ports.RelationSnapshotReader;
import com.evidencelocker.core.exception.ForbiddenException;
import com.evidencelocker.core.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * The one enforcement point in front of {@link AccessPolicy}: loads a relation snapshot, asks the
 * policy, and turns absence or denial into the matching exception.
 */
@Component
public class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final AccessPolicy policy;
    private final RelationSnapshotReader relations;
    private final boolean hideExistence;

    public AccessGuard(AccessPolicy policy, RelationSnapshotReader relations, AppProperties properties) {
        this.policy = policy;
        this.relations = relations;
        this.hideExistence = properties.getPolicy().isHideExistence();
        log.info("AccessGuard initialized - hideExistence: {}", hideExistence);
    }

    public CaseRelations requireCase(Principal principal, PolicyAction action, UUID caseId) {
        return enforce(principal, action, ResourceType.CASE, caseId, relations.caseRelations(caseId));
    }

    public EvidenceRelations requireEvidence(Principal principal, PolicyAction action, UUID evidenceId) {
        return enforce(principal, action, ResourceType.EVIDENCE, evidenceId, relations.evidenceRelations(evidenceId));
    }

    public CommentRelations requireComment(Principal principal, PolicyAction action, UUID commentId) {
        return enforce(principal, action, ResourceType.COMMENT, commentId, relations.commentRelations(commentId));
    }

    public CustodyEntryRelations requireCustodyEntry(Principal principal, PolicyAction action, UUID entryId) {
        return enforce(principal, action, ResourceType.CUSTODY_ENTRY, entryId, relations.custodyEntryRelations(entryId));
    }

    public TagRelations requireTag(Principal principal, PolicyAction action, UUID tagId) {
        return enforce(principal, action, ResourceType.TAG, tagId, relations.tagRelations(tagId));
    }

    /**
     * Enforces against a snapshot the caller already holds, e.g. the relations of a row it just
     * read for update.
     */
    public <T extends ProtectedResource> T require(Principal principal, PolicyAction action,
                                                   ResourceType type, UUID id, Optional<T> snapshot) {
        return enforce(principal, action, type, id, snapshot);
    }

    public void requireCreation(Principal principal, ResourceType type) {
        PolicyDecision decision = policy.evaluateCreation(principal, type);
        if (decision.denied()) {
            log.info("Creation denied - principal: {}, type: {}, reason: {}", principal.id(), type, decision.reason());
            throw new ForbiddenException(type, null, decision.reason());
        }
    }

    public boolean permits(Principal principal, PolicyAction action, ProtectedResource resource) {
        return policy.evaluate(principal, action, resource).allowed();
    }

    public AuditScope auditScope(Principal principal) {
        return policy.auditScope(principal);
    }

    private <T extends ProtectedResource> T enforce(Principal principal, PolicyAction action,
                                                    ResourceType type, UUID id, Optional<T> snapshot) {
        if (snapshot.isEmpty()) {
            throw new ResourceNotFoundException(type, id);
        }
        T resource = snapshot.get();
        PolicyDecision decision = policy.evaluate(principal, action, resource);
        if (decision.allowed()) {
            log.debug("Access granted - principal: {}, action: {}, {} {}", principal.id(), action, type, id);
            return resource;
        }

        log.info("Access denied - principal: {}, role: {}, action: {}, {} {}, reason: {}",
                principal.id(), principal.role(), action, type, id, decision.reason());
        if (hideExistence) {
            throw new ResourceNotFoundException(type, id);
        }
        throw new ForbiddenException(type, id, decision.reason());
    }
}
