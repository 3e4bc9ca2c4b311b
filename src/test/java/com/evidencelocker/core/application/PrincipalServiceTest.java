package com.evidencelocker.core.application;

import com.evidencelocker.core.domain.AuditAction;
import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.PrincipalAccount;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.Role;
import com.evidencelocker.core.domain.ports.PrincipalDirectory;
import com.evidencelocker.core.exception.ConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PrincipalServiceTest {

    @Mock
    private PrincipalDirectory directory;

    @Mock
    private PasswordEncoder encoder;

    @Mock
    private AccessGuard guard;

    @Mock
    private AuditTrailService auditTrail;

    private PrincipalService service;

    private final PrincipalAccount admin = account(Role.ADMIN);
    private final Principal requester = admin.toPrincipal();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-05-11T08:00:00Z"), ZoneOffset.UTC);
        service = new PrincipalService(directory, encoder, guard, auditTrail, clock);
    }

    private static PrincipalAccount account(Role role) {
        UUID id = UUID.randomUUID();
        return new PrincipalAccount(id, "user-" + id, "Test User", id + "@evidence.test", "hash", role,
                null, null, OffsetDateTime.parse("2026-01-01T00:00:00Z"));
    }

    private static PrincipalAccount withRole(PrincipalAccount a, Role role) {
        return new PrincipalAccount(a.id(), a.username(), a.fullName(), a.email(), a.passwordHash(), role,
                a.badgeNumber(), a.department(), a.createdAt());
    }

    @Test
    void lastAdministratorCannotBeDemoted() {
        when(directory.findById(admin.id())).thenReturn(Optional.of(admin));
        when(directory.countByRole(Role.ADMIN)).thenReturn(1L);

        assertThatThrownBy(() -> service.changeRole(requester, admin.id(), Role.INVESTIGATOR))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("last administrator");

        verify(directory, never()).updateRole(any(), any());
        verifyNoInteractions(auditTrail);
    }

    @Test
    void administratorMayBeDemotedWhileAnotherRemains() {
        PrincipalAccount other = account(Role.ADMIN);
        when(directory.findById(other.id())).thenReturn(Optional.of(other));
        when(directory.countByRole(Role.ADMIN)).thenReturn(2L);
        when(directory.updateRole(other.id(), Role.LEGAL)).thenReturn(withRole(other, Role.LEGAL));

        assertThat(service.changeRole(requester, other.id(), Role.LEGAL).role()).isEqualTo(Role.LEGAL);

        verify(auditTrail).record(eq(requester), eq(AuditAction.CHANGE_ROLE), eq(ResourceType.PRINCIPAL),
                eq(other.id()), anyMap());
    }

    @Test
    void promotingOrKeepingAdminSkipsTheCount() {
        PrincipalAccount analyst = account(Role.ANALYST);
        when(directory.findById(analyst.id())).thenReturn(Optional.of(analyst));
        when(directory.updateRole(analyst.id(), Role.ADMIN)).thenReturn(withRole(analyst, Role.ADMIN));

        service.changeRole(requester, analyst.id(), Role.ADMIN);

        verify(directory, never()).countByRole(any());
    }
}
