package com.evidencelocker.core.domain.policy;

import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.ResourceType;

/**
 * Single source of truth for who may see or change what. Implementations are pure: every input
 * arrives as arguments and nothing is cached between calls.
 */
public interface AccessPolicy {

    /**
     * Decides whether {@code principal} may perform {@code action} on the resource described by
     * the given relation snapshot.
     */
    PolicyDecision evaluate(Principal principal, PolicyAction action, ProtectedResource resource);

    /**
     * Role-level capability to create a resource of the given type. Creation inside a parent
     * (evidence in a case, a comment on a case or evidence item) is additionally gated on the
     * parent by the caller.
     */
    PolicyDecision evaluateCreation(Principal principal, ResourceType type);

    /**
     * Which audit entries {@code principal} may list.
     */
    AuditScope auditScope(Principal principal);

    default boolean canRead(Principal principal, ProtectedResource resource) {
        return evaluate(principal, PolicyAction.READ, resource).allowed();
    }
}
