package com.evidencelocker.core.api.dto;

import com.evidencelocker.core.domain.PrincipalAccount;
import com.evidencelocker.core.domain.Role;

import java.time.OffsetDateTime;
import java.util.UUID;

public record PrincipalView(UUID id, String username, String fullName, String email, Role role,
                            String badgeNumber, String department, OffsetDateTime createdAt) {

    public static PrincipalView of(PrincipalAccount a) {
        return new PrincipalView(a.id(), a.username(), a.fullName(), a.email(), a.role(),
                a.badgeNumber(), a.department(), a.createdAt());
    }
}
