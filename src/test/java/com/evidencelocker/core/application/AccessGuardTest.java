package com.evidencelocker.core.application;

import com.evidencelocker.core.config.AppProperties;
import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.Role;
import com.evidencelocker.core.domain.policy.CaseRelations;
import com.evidencelocker.core.domain.policy.EvidenceRelations;
import com.evidencelocker.core.domain.policy.PolicyAction;
import com.evidencelocker.core.domain.policy.RelationBasedAccessPolicy;
import com.evidencelocker.core.domain.ports.RelationSnapshotReader;
import com.evidencelocker.core.exception.ForbiddenException;
import com.evidencelocker.core.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccessGuardTest {

    @Mock
    private RelationSnapshotReader relations;

    private final UUID caseId = UUID.randomUUID();
    private final UUID creator = UUID.randomUUID();
    private final UUID stranger = UUID.randomUUID();

    private CaseRelations caseRelations;

    @BeforeEach
    void setUp() {
        caseRelations = new CaseRelations(caseId, creator, null, null);
    }

    private AccessGuard guard(boolean hideExistence) {
        AppProperties properties = new AppProperties();
        properties.getPolicy().setHideExistence(hideExistence);
        return new AccessGuard(new RelationBasedAccessPolicy(), relations, properties);
    }

    @Test
    void returnsSnapshotWhenAllowed() {
        when(relations.caseRelations(caseId)).thenReturn(Optional.of(caseRelations));

        CaseRelations result = guard(false).requireCase(new Principal(creator, Role.INVESTIGATOR), PolicyAction.UPDATE, caseId);

        assertThat(result).isEqualTo(caseRelations);
    }

    @Test
    void missingResourceIsNotFoundInBothModes() {
        when(relations.caseRelations(caseId)).thenReturn(Optional.empty());
        Principal admin = new Principal(stranger, Role.ADMIN);

        assertThatThrownBy(() -> guard(false).requireCase(admin, PolicyAction.READ, caseId))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> guard(true).requireCase(admin, PolicyAction.READ, caseId))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void denialIsForbiddenWhenExistenceIsDisclosed() {
        when(relations.caseRelations(caseId)).thenReturn(Optional.of(caseRelations));

        assertThatThrownBy(() -> guard(false).requireCase(new Principal(stranger, Role.ANALYST), PolicyAction.READ, caseId))
                .isInstanceOfSatisfying(ForbiddenException.class, e -> {
                    assertThat(e.getResourceType()).isEqualTo(ResourceType.CASE);
                    assertThat(e.getResourceId()).isEqualTo(caseId);
                });
    }

    @Test
    void denialLooksLikeAbsenceWhenExistenceIsHidden() {
        when(relations.caseRelations(caseId)).thenReturn(Optional.of(caseRelations));

        assertThatThrownBy(() -> guard(true).requireCase(new Principal(stranger, Role.ANALYST), PolicyAction.READ, caseId))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("CASE " + caseId + " not found");
    }

    @Test
    void freshCustodyGrantIsSeenOnTheNextCall() {
        UUID evidenceId = UUID.randomUUID();
        Principal recipient = new Principal(stranger, Role.LEGAL);
        EvidenceRelations before = new EvidenceRelations(evidenceId, creator, caseRelations, Set.of());
        EvidenceRelations after = new EvidenceRelations(evidenceId, creator, caseRelations, Set.of(stranger));
        when(relations.evidenceRelations(evidenceId)).thenReturn(Optional.of(before), Optional.of(after));
        AccessGuard guard = guard(false);

        assertThatThrownBy(() -> guard.requireEvidence(recipient, PolicyAction.READ, evidenceId))
                .isInstanceOf(ForbiddenException.class);
        assertThat(guard.requireEvidence(recipient, PolicyAction.READ, evidenceId)).isEqualTo(after);
    }

    @Test
    void creationDenialIsAlwaysForbidden() {
        assertThatThrownBy(() -> guard(true).requireCreation(new Principal(stranger, Role.ANALYST), ResourceType.CASE))
                .isInstanceOf(ForbiddenException.class);
    }
}
