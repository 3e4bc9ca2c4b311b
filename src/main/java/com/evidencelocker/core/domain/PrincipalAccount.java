package com.evidencelocker.core.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Directory record behind a {@link Principal}. Only the directory and login see the password hash.
 */
public record PrincipalAccount(
        UUID id,
        String username,
        String fullName,
        String email,
        String passwordHash,
        Role role,
        String badgeNumber,
        String department,
        OffsetDateTime createdAt
) {

    public Principal toPrincipal() {
        return new Principal(id, role);
    }
}
