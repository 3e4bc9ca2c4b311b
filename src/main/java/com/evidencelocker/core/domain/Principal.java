package com.evidencelocker.core.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * An authenticated actor as seen by the policy engine: nothing but an id and a role.
 * Passed explicitly into every policy, audit and ledger call.
 */
public record Principal(UUID id, Role role) {

    public Principal {
        Objects.requireNonNull(id, "principal id");
        Objects.requireNonNull(role, "principal role");
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
