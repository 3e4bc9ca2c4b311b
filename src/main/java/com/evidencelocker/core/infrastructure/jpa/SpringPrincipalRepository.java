package com.evidencelocker.core.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpringPrincipalRepository extends JpaRepository<PrincipalEntity, UUID> {
    Optional<PrincipalEntity> findByEmail(String email);
    boolean existsByUsername(String username);
    boolean existsByEmail(String email);
    long countByRole(String role);
    List<PrincipalEntity> findAllByOrderByFullNameAsc();
}
