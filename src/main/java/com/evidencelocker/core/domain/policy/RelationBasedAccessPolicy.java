package com.evidencelocker.core.domain.policy;

import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.Role;

import java.util.Objects;
import java.util.UUID;

/**
 * Access rules derived from ownership, assignment and custody relations.
 *
 * <p>Order of evaluation: structural denials (append-only records, never-deleted entities),
 * then the admin bypass, then the per-type relation rule. Accessor sets are transitive by one hop
 * only: evidence looks at its case, a comment looks at its parent using that parent's own rule.
 */
public class RelationBasedAccessPolicy implements AccessPolicy {

    @Override
    public PolicyDecision evaluate(Principal principal, PolicyAction action, ProtectedResource resource) {
        Objects.requireNonNull(principal, "principal");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(resource, "resource");

        return switch (resource.type()) {
            case CASE -> evaluateCase(principal, action, as(resource, CaseRelations.class));
            case EVIDENCE -> evaluateEvidence(principal, action, as(resource, EvidenceRelations.class));
            case COMMENT -> evaluateComment(principal, action, as(resource, CommentRelations.class));
            case CUSTODY_ENTRY -> evaluateCustodyEntry(principal, action, as(resource, CustodyEntryRelations.class));
            case AUDIT_ENTRY -> evaluateAuditEntry(principal, action, as(resource, AuditEntryRelations.class));
            case TAG -> evaluateTag(principal, action, as(resource, TagRelations.class));
            case PRINCIPAL -> evaluatePrincipal(principal, action, as(resource, PrincipalRelations.class));
        };
    }

    @Override
    public PolicyDecision evaluateCreation(Principal principal, ResourceType type) {
        Objects.requireNonNull(principal, "principal");
        return switch (type) {
            case CASE -> principal.role() == Role.ADMIN || principal.role() == Role.INVESTIGATOR
                    ? PolicyDecision.allow()
                    : PolicyDecision.deny("Role " + principal.role() + " may not open cases");
            case PRINCIPAL -> principal.isAdmin()
                    ? PolicyDecision.allow()
                    : PolicyDecision.deny("Only administrators register principals");
            case AUDIT_ENTRY -> PolicyDecision.deny("Audit entries are written by the audit trail only");
            case EVIDENCE, COMMENT, CUSTODY_ENTRY, TAG -> PolicyDecision.allow();
        };
    }

    @Override
    public AuditScope auditScope(Principal principal) {
        return principal.isAdmin() ? AuditScope.unrestricted() : AuditScope.ownEntriesOf(principal.id());
    }

    private PolicyDecision evaluateCase(Principal principal, PolicyAction action, CaseRelations c) {
        if (action == PolicyAction.DELETE) {
            return PolicyDecision.deny("Cases are archived through their status, never deleted");
        }
        if (principal.isAdmin()) {
            return PolicyDecision.allow();
        }
        return c.involves(principal.id())
                ? PolicyDecision.allow()
                : PolicyDecision.deny("Principal " + principal.id() + " has no relation to case " + c.caseId());
    }

    private PolicyDecision evaluateEvidence(Principal principal, PolicyAction action, EvidenceRelations e) {
        if (action == PolicyAction.DELETE) {
            return PolicyDecision.deny("Evidence is disposed through its status, never deleted");
        }
        if (principal.isAdmin()) {
            return PolicyDecision.allow();
        }
        UUID id = principal.id();
        if (e.caseRelations().involves(id) || id.equals(e.uploaderId()) || e.isCustodian(id)) {
            return PolicyDecision.allow();
        }
        return PolicyDecision.deny("Principal " + principal.id() + " is neither case member, uploader nor custodian of evidence " + e.evidenceId());
    }

    private PolicyDecision evaluateComment(Principal principal, PolicyAction action, CommentRelations c) {
        if (principal.isAdmin()) {
            return PolicyDecision.allow();
        }
        // every action on a comment first needs the parent to be readable
        PolicyDecision parent = evaluate(principal, PolicyAction.READ, c.parent());
        if (action == PolicyAction.READ || parent.denied()) {
            return parent;
        }
        return principal.id().equals(c.authorId())
                ? PolicyDecision.allow()
                : PolicyDecision.deny("Only the author may change or delete comment " + c.commentId());
    }

    private PolicyDecision evaluateCustodyEntry(Principal principal, PolicyAction action, CustodyEntryRelations c) {
        if (action != PolicyAction.READ) {
            return PolicyDecision.deny("Custody entries are append-only");
        }
        return evaluateEvidence(principal, PolicyAction.READ, c.evidence());
    }

    private PolicyDecision evaluateAuditEntry(Principal principal, PolicyAction action, AuditEntryRelations a) {
        if (action != PolicyAction.READ) {
            return PolicyDecision.deny("Audit entries are append-only");
        }
        if (principal.isAdmin() || principal.id().equals(a.principalId())) {
            return PolicyDecision.allow();
        }
        return PolicyDecision.deny("Audit entry " + a.entryId() + " belongs to another principal");
    }

    private PolicyDecision evaluateTag(Principal principal, PolicyAction action, TagRelations t) {
        if (action == PolicyAction.READ || principal.isAdmin() || principal.id().equals(t.creatorId())) {
            return PolicyDecision.allow();
        }
        return PolicyDecision.deny("Only the creator may change tag " + t.tagId());
    }

    private PolicyDecision evaluatePrincipal(Principal principal, PolicyAction action, PrincipalRelations p) {
        if (action == PolicyAction.READ || principal.isAdmin()) {
            return PolicyDecision.allow();
        }
        if (action == PolicyAction.UPDATE && principal.id().equals(p.principalId())) {
            return PolicyDecision.allow();
        }
        return PolicyDecision.deny("Principal " + principal.id() + " may not change principal " + p.principalId());
    }

    private static <T extends ProtectedResource> T as(ProtectedResource resource, Class<T> type) {
        if (!type.isInstance(resource)) {
            throw new IllegalArgumentException("Resource of type " + resource.type()
                    + " must be described by " + type.getSimpleName());
        }
        return type.cast(resource);
    }
}
