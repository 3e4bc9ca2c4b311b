package com.evidencelocker.core.domain.ports;

import com.evidencelocker.core.domain.PrincipalAccount;
import com.evidencelocker.core.domain.Role;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PrincipalDirectory {
    PrincipalAccount save(PrincipalAccount account);
    Optional<PrincipalAccount> findById(UUID principalId);
    Optional<PrincipalAccount> findByEmail(String email);
    boolean existsById(UUID principalId);
    boolean existsByUsername(String username);
    boolean existsByEmail(String email);
    long countByRole(Role role);
    List<PrincipalAccount> findAllByName();
    PrincipalAccount updateRole(UUID principalId, Role role);
    PrincipalAccount updateProfile(UUID principalId, String fullName, String badgeNumber, String department);
}
