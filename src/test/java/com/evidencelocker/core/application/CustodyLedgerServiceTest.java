package com.evidencelocker.core.application;

import com.evidencelocker.core.domain.AuditAction;
import com.evidencelocker.core.domain.CustodyAction;
import com.evidencelocker.core.domain.CustodyEntry;
import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.Role;
import com.evidencelocker.core.domain.policy.CaseRelations;
import com.evidencelocker.core.domain.policy.EvidenceRelations;
import com.evidencelocker.core.domain.policy.PolicyAction;
import com.evidencelocker.core.domain.ports.CustodyLedgerRepository;
import com.evidencelocker.core.domain.ports.EvidenceRepository;
import com.evidencelocker.core.domain.ports.PrincipalDirectory;
import com.evidencelocker.core.exception.ForbiddenException;
import com.evidencelocker.core.exception.ResourceNotFoundException;
import com.evidencelocker.core.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CustodyLedgerServiceTest {

    @Mock
    private CustodyLedgerRepository ledger;

    @Mock
    private EvidenceRepository evidence;

    @Mock
    private PrincipalDirectory principals;

    @Mock
    private AccessGuard guard;

    @Mock
    private AuditTrailService auditTrail;

    private CustodyLedgerService service;

    private final UUID evidenceId = UUID.randomUUID();
    private final Principal holder = new Principal(UUID.randomUUID(), Role.INVESTIGATOR);
    private final Principal recipient = new Principal(UUID.randomUUID(), Role.ANALYST);

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-04-02T12:00:00Z"), ZoneOffset.UTC);
        service = new CustodyLedgerService(ledger, evidence, principals, guard, auditTrail, clock);
        CaseRelations caseRelations = new CaseRelations(UUID.randomUUID(), holder.id(), null, null);
        lenient().when(guard.requireEvidence(any(), any(), eq(evidenceId)))
                .thenReturn(new EvidenceRelations(evidenceId, holder.id(), caseRelations, Set.of()));
        lenient().when(principals.existsById(any())).thenReturn(true);
        lenient().when(ledger.append(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    private CustodyAppendCommand transfer(UUID from, UUID to, String location) {
        return new CustodyAppendCommand(evidenceId, CustodyAction.TRANSFERRED, from, to, location, "handover");
    }

    @Test
    void firstAppendStartsAtSequenceOneAndIsAudited() {
        when(evidence.lockForAppend(evidenceId)).thenReturn(true);
        when(ledger.findLatest(evidenceId)).thenReturn(Optional.empty());

        CustodyEntry entry = service.append(holder, transfer(holder.id(), recipient.id(), "  Evidence room B  "));

        assertThat(entry.sequenceNo()).isEqualTo(1);
        assertThat(entry.location()).isEqualTo("Evidence room B");
        assertThat(entry.previousHash()).isNull();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> details = ArgumentCaptor.forClass(Map.class);
        verify(auditTrail).record(eq(holder), eq(AuditAction.APPEND_CUSTODY), eq(ResourceType.CUSTODY_ENTRY),
                eq(entry.id()), details.capture());
        assertThat(details.getValue())
                .containsEntry("evidenceId", evidenceId)
                .containsEntry("sequenceNo", 1L)
                .containsEntry("toPrincipal", recipient.id());
    }

    @Test
    void appendContinuesFromLatestEntry() {
        CustodyEntry previous = new CustodyEntry(UUID.randomUUID(), evidenceId, 4, CustodyAction.ACCESSED,
                holder.id(), null, "Lab", null, Instant.parse("2026-04-02T11:00:00Z").atOffset(ZoneOffset.UTC),
                "a".repeat(64), "b".repeat(64));
        when(evidence.lockForAppend(evidenceId)).thenReturn(true);
        when(ledger.findLatest(evidenceId)).thenReturn(Optional.of(previous));

        CustodyEntry entry = service.append(holder, transfer(holder.id(), recipient.id(), "Lab"));

        assertThat(entry.sequenceNo()).isEqualTo(5);
        assertThat(entry.previousHash()).isEqualTo(previous.entryHash());
        assertThat(entry.occurredAt()).isAfter(previous.occurredAt());
    }

    @Test
    void requesterMustBeAPartyUnlessAdmin() {
        Principal bystander = new Principal(UUID.randomUUID(), Role.INVESTIGATOR);
        when(guard.requireEvidence(eq(bystander), eq(PolicyAction.UPDATE), eq(evidenceId)))
                .thenReturn(new EvidenceRelations(evidenceId, bystander.id(),
                        new CaseRelations(UUID.randomUUID(), bystander.id(), null, null), Set.of()));

        assertThatThrownBy(() -> service.append(bystander, transfer(holder.id(), recipient.id(), "Lab")))
                .isInstanceOf(ForbiddenException.class);
        verify(ledger, never()).append(any());
        verifyNoInteractions(auditTrail);
    }

    @Test
    void adminMayRecordATransferBetweenOthers() {
        Principal admin = new Principal(UUID.randomUUID(), Role.ADMIN);
        when(guard.requireEvidence(eq(admin), eq(PolicyAction.UPDATE), eq(evidenceId)))
                .thenReturn(new EvidenceRelations(evidenceId, holder.id(),
                        new CaseRelations(UUID.randomUUID(), holder.id(), null, null), Set.of()));
        when(evidence.lockForAppend(evidenceId)).thenReturn(true);
        when(ledger.findLatest(evidenceId)).thenReturn(Optional.empty());

        CustodyEntry entry = service.append(admin, transfer(holder.id(), recipient.id(), "Vault"));

        assertThat(entry.fromPrincipalId()).isEqualTo(holder.id());
        verify(auditTrail).record(eq(admin), eq(AuditAction.APPEND_CUSTODY), any(), any(), anyMap());
    }

    @Test
    void blankLocationIsRejected() {
        assertThatThrownBy(() -> service.append(holder, transfer(holder.id(), recipient.id(), "   ")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("location");
        verify(ledger, never()).append(any());
    }

    @Test
    void entryNeedsAtLeastOneParty() {
        assertThatThrownBy(() -> service.append(holder, transfer(null, null, "Lab")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void unknownRecipientIsRejected() {
        UUID ghost = UUID.randomUUID();
        when(principals.existsById(ghost)).thenReturn(false);

        assertThatThrownBy(() -> service.append(holder, transfer(holder.id(), ghost, "Lab")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("toPrincipal");
    }

    @Test
    void vanishedEvidenceRowIsNotFound() {
        when(evidence.lockForAppend(evidenceId)).thenReturn(false);

        assertThatThrownBy(() -> service.append(holder, transfer(holder.id(), recipient.id(), "Lab")))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(auditTrail);
    }
}
