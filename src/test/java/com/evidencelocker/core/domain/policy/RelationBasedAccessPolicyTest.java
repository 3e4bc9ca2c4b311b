package com.evidencelocker.core.domain.policy;

import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelationBasedAccessPolicyTest {

    private final AccessPolicy policy = new RelationBasedAccessPolicy();

    private final UUID creator = UUID.randomUUID();
    private final UUID lead = UUID.randomUUID();
    private final UUID assignee = UUID.randomUUID();
    private final UUID uploader = UUID.randomUUID();
    private final UUID custodian = UUID.randomUUID();
    private final UUID stranger = UUID.randomUUID();

    private final CaseRelations aCase = new CaseRelations(UUID.randomUUID(), creator, lead, assignee);
    private final EvidenceRelations anItem = new EvidenceRelations(UUID.randomUUID(), uploader, aCase, Set.of(custodian));

    private static Principal as(UUID id, Role role) {
        return new Principal(id, role);
    }

    private boolean allowed(Principal p, PolicyAction action, ProtectedResource r) {
        return policy.evaluate(p, action, r).allowed();
    }

    @Nested
    @DisplayName("cases")
    class Cases {

        @ParameterizedTest
        @EnumSource(value = Role.class, names = {"INVESTIGATOR", "ANALYST", "LEGAL"})
        void relatedPrincipalsMayReadAndUpdate(Role role) {
            for (UUID member : new UUID[]{creator, lead, assignee}) {
                assertThat(allowed(as(member, role), PolicyAction.READ, aCase)).isTrue();
                assertThat(allowed(as(member, role), PolicyAction.UPDATE, aCase)).isTrue();
            }
        }

        @ParameterizedTest
        @EnumSource(value = Role.class, names = {"INVESTIGATOR", "ANALYST", "LEGAL"})
        void unrelatedNonAdminIsDenied(Role role) {
            PolicyDecision decision = policy.evaluate(as(stranger, role), PolicyAction.READ, aCase);

            assertThat(decision.denied()).isTrue();
            assertThat(decision.reason()).contains(stranger.toString());
        }

        @Test
        void adminMayReadAnyCase() {
            assertThat(allowed(as(stranger, Role.ADMIN), PolicyAction.READ, aCase)).isTrue();
            assertThat(allowed(as(stranger, Role.ADMIN), PolicyAction.UPDATE, aCase)).isTrue();
        }

        @ParameterizedTest
        @EnumSource(Role.class)
        void nobodyDeletesCases(Role role) {
            assertThat(allowed(as(creator, role), PolicyAction.DELETE, aCase)).isFalse();
        }

        @Test
        void unsetRelationsGrantNothing() {
            CaseRelations bare = new CaseRelations(UUID.randomUUID(), creator, null, null);

            assertThat(allowed(as(lead, Role.INVESTIGATOR), PolicyAction.READ, bare)).isFalse();
            assertThat(allowed(as(creator, Role.INVESTIGATOR), PolicyAction.READ, bare)).isTrue();
        }
    }

    @Nested
    @DisplayName("evidence")
    class EvidenceItems {

        @Test
        @DisplayName("read is allowed exactly when admin, case member, uploader or custodian")
        void everyRelationCombination() {
            for (Role role : Role.values()) {
                for (int mask = 0; mask < 32; mask++) {
                    UUID me = UUID.randomUUID();
                    CaseRelations c = new CaseRelations(UUID.randomUUID(),
                            (mask & 1) != 0 ? me : creator,
                            (mask & 2) != 0 ? me : null,
                            (mask & 4) != 0 ? me : null);
                    EvidenceRelations e = new EvidenceRelations(UUID.randomUUID(),
                            (mask & 8) != 0 ? me : uploader, c,
                            (mask & 16) != 0 ? Set.of(me, custodian) : Set.of(custodian));

                    boolean expected = role == Role.ADMIN || mask != 0;
                    assertThat(allowed(as(me, role), PolicyAction.READ, e))
                            .as("role %s, relations %s", role, Integer.toBinaryString(mask))
                            .isEqualTo(expected);
                    assertThat(allowed(as(me, role), PolicyAction.UPDATE, e)).isEqualTo(expected);
                }
            }
        }

        @Test
        void custodianWithoutCaseRelationMayReadItemButNotCase() {
            Principal holder = as(custodian, Role.ANALYST);

            assertThat(allowed(holder, PolicyAction.READ, anItem)).isTrue();
            assertThat(allowed(holder, PolicyAction.READ, aCase)).isFalse();
        }

        @ParameterizedTest
        @EnumSource(Role.class)
        void nobodyDeletesEvidence(Role role) {
            assertThat(allowed(as(uploader, role), PolicyAction.DELETE, anItem)).isFalse();
        }
    }

    @Nested
    @DisplayName("comments")
    class Comments {

        private final UUID author = lead;

        @Test
        void readFollowsTheParentRule() {
            CommentRelations onCase = new CommentRelations(UUID.randomUUID(), author, aCase, null);
            CommentRelations onItem = new CommentRelations(UUID.randomUUID(), author, null, anItem);

            assertThat(allowed(as(assignee, Role.ANALYST), PolicyAction.READ, onCase)).isTrue();
            assertThat(allowed(as(custodian, Role.ANALYST), PolicyAction.READ, onCase)).isFalse();
            assertThat(allowed(as(custodian, Role.ANALYST), PolicyAction.READ, onItem)).isTrue();
            assertThat(allowed(as(stranger, Role.LEGAL), PolicyAction.READ, onItem)).isFalse();
        }

        @Test
        void onlyTheAuthorMayEdit() {
            CommentRelations comment = new CommentRelations(UUID.randomUUID(), author, aCase, null);

            assertThat(allowed(as(author, Role.INVESTIGATOR), PolicyAction.UPDATE, comment)).isTrue();
            assertThat(allowed(as(assignee, Role.INVESTIGATOR), PolicyAction.UPDATE, comment)).isFalse();
        }

        @Test
        void authorWhoLostParentAccessMayNeitherEditNorDelete() {
            CaseRelations reassigned = new CaseRelations(aCase.caseId(), creator, null, assignee);
            CommentRelations comment = new CommentRelations(UUID.randomUUID(), author, reassigned, null);

            assertThat(allowed(as(author, Role.INVESTIGATOR), PolicyAction.READ, comment)).isFalse();
            assertThat(allowed(as(author, Role.INVESTIGATOR), PolicyAction.UPDATE, comment)).isFalse();
            assertThat(allowed(as(author, Role.INVESTIGATOR), PolicyAction.DELETE, comment)).isFalse();
        }

        @Test
        void adminMayDeleteAnyComment() {
            CommentRelations comment = new CommentRelations(UUID.randomUUID(), author, aCase, null);

            assertThat(allowed(as(stranger, Role.ADMIN), PolicyAction.DELETE, comment)).isTrue();
            assertThat(allowed(as(creator, Role.INVESTIGATOR), PolicyAction.DELETE, comment)).isFalse();
        }

        @Test
        void exactlyOneParentIsRequired() {
            assertThatThrownBy(() -> new CommentRelations(UUID.randomUUID(), author, aCase, anItem))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new CommentRelations(UUID.randomUUID(), author, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("append-only records")
    class AppendOnly {

        @ParameterizedTest
        @EnumSource(Role.class)
        void custodyEntriesAreNeverChanged(Role role) {
            CustodyEntryRelations entry = new CustodyEntryRelations(UUID.randomUUID(), anItem);

            assertThat(allowed(as(uploader, role), PolicyAction.UPDATE, entry)).isFalse();
            assertThat(allowed(as(uploader, role), PolicyAction.DELETE, entry)).isFalse();
            assertThat(allowed(as(uploader, role), PolicyAction.READ, entry)).isTrue();
        }

        @Test
        void custodyEntryReadFollowsEvidence() {
            CustodyEntryRelations entry = new CustodyEntryRelations(UUID.randomUUID(), anItem);

            assertThat(allowed(as(custodian, Role.LEGAL), PolicyAction.READ, entry)).isTrue();
            assertThat(allowed(as(stranger, Role.LEGAL), PolicyAction.READ, entry)).isFalse();
        }

        @ParameterizedTest
        @EnumSource(Role.class)
        void auditEntriesAreNeverChanged(Role role) {
            AuditEntryRelations own = new AuditEntryRelations(UUID.randomUUID(), stranger);

            assertThat(allowed(as(stranger, role), PolicyAction.UPDATE, own)).isFalse();
            assertThat(allowed(as(stranger, role), PolicyAction.DELETE, own)).isFalse();
        }

        @Test
        void auditEntriesAreReadableByTheirPrincipalAndAdmins() {
            AuditEntryRelations entry = new AuditEntryRelations(UUID.randomUUID(), lead);

            assertThat(allowed(as(lead, Role.INVESTIGATOR), PolicyAction.READ, entry)).isTrue();
            assertThat(allowed(as(creator, Role.INVESTIGATOR), PolicyAction.READ, entry)).isFalse();
            assertThat(allowed(as(stranger, Role.ADMIN), PolicyAction.READ, entry)).isTrue();
        }
    }

    @Nested
    @DisplayName("tags, principals and creation")
    class Directory {

        @Test
        void tagsAreReadableByAllAndChangedByCreator() {
            TagRelations tag = new TagRelations(UUID.randomUUID(), creator);

            assertThat(allowed(as(stranger, Role.LEGAL), PolicyAction.READ, tag)).isTrue();
            assertThat(allowed(as(stranger, Role.LEGAL), PolicyAction.UPDATE, tag)).isFalse();
            assertThat(allowed(as(creator, Role.ANALYST), PolicyAction.DELETE, tag)).isTrue();
            assertThat(allowed(as(stranger, Role.ADMIN), PolicyAction.DELETE, tag)).isTrue();
        }

        @Test
        void principalsMayUpdateOnlyThemselves() {
            PrincipalRelations self = new PrincipalRelations(lead);

            assertThat(allowed(as(lead, Role.ANALYST), PolicyAction.UPDATE, self)).isTrue();
            assertThat(allowed(as(stranger, Role.ANALYST), PolicyAction.UPDATE, self)).isFalse();
            assertThat(allowed(as(stranger, Role.ANALYST), PolicyAction.READ, self)).isTrue();
        }

        @Test
        void caseCreationIsLimitedToAdminsAndInvestigators() {
            assertThat(policy.evaluateCreation(as(stranger, Role.ADMIN), ResourceType.CASE).allowed()).isTrue();
            assertThat(policy.evaluateCreation(as(stranger, Role.INVESTIGATOR), ResourceType.CASE).allowed()).isTrue();
            assertThat(policy.evaluateCreation(as(stranger, Role.ANALYST), ResourceType.CASE).allowed()).isFalse();
            assertThat(policy.evaluateCreation(as(stranger, Role.LEGAL), ResourceType.CASE).allowed()).isFalse();
        }

        @Test
        void onlyAdminsRegisterPrincipals() {
            assertThat(policy.evaluateCreation(as(stranger, Role.ADMIN), ResourceType.PRINCIPAL).allowed()).isTrue();
            assertThat(policy.evaluateCreation(as(stranger, Role.INVESTIGATOR), ResourceType.PRINCIPAL).allowed()).isFalse();
        }

        @ParameterizedTest
        @EnumSource(Role.class)
        void auditEntriesAreNeverCreatedThroughThePolicy(Role role) {
            assertThat(policy.evaluateCreation(as(stranger, role), ResourceType.AUDIT_ENTRY).allowed()).isFalse();
        }

        @Test
        void auditScopeIsOwnEntriesForNonAdmins() {
            assertThat(policy.auditScope(as(stranger, Role.ADMIN)).isUnrestricted()).isTrue();

            AuditScope scope = policy.auditScope(as(lead, Role.LEGAL));
            assertThat(scope.isUnrestricted()).isFalse();
            assertThat(scope.owner()).contains(lead);
            assertThat(scope.permits(lead)).isTrue();
            assertThat(scope.permits(creator)).isFalse();
            assertThat(scope.permits(null)).isFalse();
        }
    }

    @Test
    void mismatchedSnapshotTypeIsRejected() {
        ProtectedResource lying = new ProtectedResource() {
            @Override
            public ResourceType type() {
                return ResourceType.CASE;
            }

            @Override
            public UUID id() {
                return UUID.randomUUID();
            }
        };

        assertThatThrownBy(() -> policy.evaluate(as(creator, Role.ADMIN), PolicyAction.READ, lying))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
