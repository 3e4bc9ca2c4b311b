package com.evidencelocker.core.infrastructure.adapters;

import com.evidencelocker.core.domain.PrincipalAccount;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.Role;
import com.evidencelocker.core.domain.ports.PrincipalDirectory;
import com.evidencelocker.core.exception.ResourceNotFoundException;
import com.evidencelocker.core.infrastructure.jpa.PrincipalEntity;
import com.evidencelocker.core.infrastructure.jpa.SpringPrincipalRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaPrincipalDirectoryAdapter implements PrincipalDirectory {
    private final SpringPrincipalRepository principals;

    public JpaPrincipalDirectoryAdapter(SpringPrincipalRepository principals) {
        this.principals = principals;
    }

    @Override
    public PrincipalAccount save(PrincipalAccount a) {
        PrincipalEntity e = new PrincipalEntity();
        e.setId(a.id());
        e.setUsername(a.username());
        e.setFullName(a.fullName());
        e.setEmail(a.email());
        e.setPasswordHash(a.passwordHash());
        e.setRole(a.role().name());
        e.setBadgeNumber(a.badgeNumber());
        e.setDepartment(a.department());
        e.setCreatedAt(a.createdAt());
        return toDomain(principals.save(e));
    }

    @Override
    public long countByRole(Role role) {
        return principals.countByRole(role.name());
    }

    @Override
    public Optional<PrincipalAccount> findById(UUID principalId) {
        return principals.findById(principalId).map(JpaPrincipalDirectoryAdapter::toDomain);
    }

    @Override
    public Optional<PrincipalAccount> findByEmail(String email) {
        return principals.findByEmail(email).map(JpaPrincipalDirectoryAdapter::toDomain);
    }

    @Override
    public boolean existsById(UUID principalId) {
        return principals.existsById(principalId);
    }

    @Override
    public boolean existsByUsername(String username) {
        return principals.existsByUsername(username);
    }

    @Override
    public boolean existsByEmail(String email) {
        return principals.existsByEmail(email);
    }

    @Override
    public List<PrincipalAccount> findAllByName() {
        return principals.findAllByOrderByFullNameAsc().stream().map(JpaPrincipalDirectoryAdapter::toDomain).toList();
    }

    @Override
    public PrincipalAccount updateRole(UUID principalId, Role role) {
        PrincipalEntity e = load(principalId);
        e.setRole(role.name());
        return toDomain(principals.save(e));
    }

    @Override
    public PrincipalAccount updateProfile(UUID principalId, String fullName, String badgeNumber, String department) {
        PrincipalEntity e = load(principalId);
        if (fullName != null) e.setFullName(fullName.trim());
        if (badgeNumber != null) e.setBadgeNumber(badgeNumber);
        if (department != null) e.setDepartment(department);
        return toDomain(principals.save(e));
    }

    private PrincipalEntity load(UUID principalId) {
        return principals.findById(principalId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.PRINCIPAL, principalId));
    }

    private static PrincipalAccount toDomain(PrincipalEntity e) {
        return new PrincipalAccount(e.getId(), e.getUsername(), e.getFullName(), e.getEmail(), e.getPasswordHash(),
                Role.valueOf(e.getRole()), e.getBadgeNumber(), e.getDepartment(), e.getCreatedAt());
    }
}
