package com.evidencelocker.core.domain.policy;

import java.util.Optional;
import java.util.UUID;

/**
 * Query restriction for audit listings. An empty owner means every entry is visible.
 */
public record AuditScope(UUID ownerId) {

    public static AuditScope unrestricted() {
        return new AuditScope(null);
    }

    public static AuditScope ownEntriesOf(UUID principalId) {
        return new AuditScope(principalId);
    }

    public boolean isUnrestricted() {
        return ownerId == null;
    }

    public Optional<UUID> owner() {
        return Optional.ofNullable(ownerId);
    }

    /** Whether a listing filtered to {@code requestedPrincipal} (null for "anyone") fits in this scope. */
    public boolean permits(UUID requestedPrincipal) {
        return isUnrestricted() || ownerId.equals(requestedPrincipal);
    }
}
