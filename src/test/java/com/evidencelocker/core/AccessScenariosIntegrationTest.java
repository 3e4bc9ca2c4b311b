package com.evidencelocker.core;

import com.evidencelocker.core.application.AuditTrailService;
import com.evidencelocker.core.application.CaseService;
import com.evidencelocker.core.application.CommentService;
import com.evidencelocker.core.application.CustodyAppendCommand;
import com.evidencelocker.core.application.CustodyLedgerService;
import com.evidencelocker.core.application.EvidenceService;
import com.evidencelocker.core.application.NewCaseCommand;
import com.evidencelocker.core.application.NewEvidenceCommand;
import com.evidencelocker.core.domain.AuditAction;
import com.evidencelocker.core.domain.AuditLogEntry;
import com.evidencelocker.core.domain.CaseRecord;
import com.evidencelocker.core.domain.CustodyAction;
import com.evidencelocker.core.domain.CustodyChainVerification;
import com.evidencelocker.core.domain.CustodyEntry;
import com.evidencelocker.core.domain.Evidence;
import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.Role;
import com.evidencelocker.core.domain.ports.AuditLogRepository;
import com.evidencelocker.core.domain.ports.CaseRepository;
import com.evidencelocker.core.domain.ports.PrincipalDirectory;
import com.evidencelocker.core.exception.ForbiddenException;
import com.evidencelocker.core.support.TestPrincipals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end access checks against the Flyway schema. Not @Transactional: every service call
 * commits on its own.
 */
@SpringBootTest
@ActiveProfiles("test")
class AccessScenariosIntegrationTest {

    @Autowired
    private PrincipalDirectory directory;

    @Autowired
    private CaseService cases;

    @Autowired
    private CaseRepository caseRepository;

    @Autowired
    private EvidenceService evidence;

    @Autowired
    private CustodyLedgerService custody;

    @Autowired
    private CommentService comments;

    @Autowired
    private AuditTrailService auditTrail;

    @Autowired
    private AuditLogRepository auditLog;

    private TestPrincipals principals;
    private Principal admin;
    private Principal lead;

    @BeforeEach
    void setUp() {
        principals = new TestPrincipals(directory);
        admin = principals.create(Role.ADMIN);
        lead = principals.create(Role.INVESTIGATOR);
    }

    private CaseRecord openCase(Principal creator, UUID leadId, UUID assigneeId) {
        return cases.create(creator, new NewCaseCommand(TestPrincipals.uniqueCaseNumber(), "Warehouse break-in",
                null, null, null, leadId, assigneeId, null));
    }

    private Evidence upload(Principal uploader, UUID caseId, String title, String intakeLocation) {
        return evidence.register(uploader, caseId, new NewEvidenceCommand(title, null, title + ".jpg",
                "store://" + UUID.randomUUID(), 2048L, "image/jpeg", "abc123", null, null, null, intakeLocation));
    }

    @Test
    void adminListsEveryCaseRegardlessOfRelations() {
        Principal other = principals.create(Role.INVESTIGATOR);
        CaseRecord unrelated = openCase(other, null, null);
        CaseRecord own = openCase(lead, lead.id(), null);

        List<CaseRecord> visible = cases.listVisible(admin);

        assertThat(visible).extracting(CaseRecord::getId).contains(unrelated.getId(), own.getId());
        assertThat(visible).hasSameSizeAs(caseRepository.findAllNewestFirst());
        assertThat(cases.listVisible(other)).extracting(CaseRecord::getId)
                .contains(unrelated.getId())
                .doesNotContain(own.getId());
    }

    @Test
    void unrelatedAnalystIsForbiddenFromCase() {
        CaseRecord c = openCase(lead, lead.id(), null);
        Principal analyst = principals.create(Role.ANALYST);

        assertThatThrownBy(() -> cases.get(analyst, c.getId())).isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> evidence.listInCase(analyst, c.getId())).isInstanceOf(ForbiddenException.class);
        assertThat(cases.listVisible(analyst)).extracting(CaseRecord::getId).doesNotContain(c.getId());
    }

    @Test
    void leadUploadingEvidenceProducesExactlyOneAuditEntry() {
        CaseRecord c = openCase(admin, lead.id(), null);

        Evidence e = upload(lead, c.getId(), "crowbar", "Front desk");

        assertThat(auditLog.countByResourceAndAction(e.getId(), AuditAction.ADD_EVIDENCE)).isEqualTo(1);
        List<AuditLogEntry> entries = auditTrail.listForResource(admin, ResourceType.EVIDENCE, e.getId(), null);
        assertThat(entries).hasSize(1);
        AuditLogEntry entry = entries.get(0);
        assertThat(entry.action().label()).isEqualTo("AddEvidence");
        assertThat(entry.principalId()).isEqualTo(lead.id());
        assertThat(entry.details()).containsEntry("caseId", c.getId().toString());

        List<CustodyEntry> intake = custody.listFor(lead, e.getId());
        assertThat(intake).singleElement().satisfies(first -> {
            assertThat(first.action()).isEqualTo(CustodyAction.CREATED);
            assertThat(first.toPrincipalId()).isEqualTo(lead.id());
            assertThat(auditLog.countByResourceAndAction(first.id(), AuditAction.APPEND_CUSTODY)).isZero();
        });
    }

    @Test
    void custodyRecipientSeesOnlyTheTransferredItem() {
        CaseRecord c = openCase(admin, lead.id(), null);
        Evidence transferred = upload(lead, c.getId(), "phone", "Front desk");
        Evidence kept = upload(lead, c.getId(), "laptop", "Front desk");
        Principal recipient = principals.create(Role.ANALYST);

        assertThatThrownBy(() -> evidence.get(recipient, transferred.getId())).isInstanceOf(ForbiddenException.class);

        custody.append(lead, new CustodyAppendCommand(transferred.getId(), CustodyAction.TRANSFERRED,
                lead.id(), recipient.id(), "Forensics lab", "For extraction"));

        assertThat(evidence.get(recipient, transferred.getId()).getId()).isEqualTo(transferred.getId());
        assertThatThrownBy(() -> evidence.get(recipient, kept.getId())).isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> cases.get(recipient, c.getId())).isInstanceOf(ForbiddenException.class);
        assertThat(evidence.listInCase(recipient, c.getId()))
                .extracting(Evidence::getId)
                .containsExactly(transferred.getId());
        assertThat(custody.listFor(recipient, transferred.getId())).hasSize(2);
        assertThat(comments.list(recipient, ResourceType.EVIDENCE, transferred.getId())).isEmpty();
        assertThatThrownBy(() -> comments.add(recipient, ResourceType.CASE, c.getId(), "Can I see the rest?"))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void concurrentAppendsAreAllKeptInOrder() throws Exception {
        Principal assignee = principals.create(Role.ANALYST);
        CaseRecord c = openCase(admin, lead.id(), assignee.id());
        Evidence e = upload(lead, c.getId(), "knife", null);

        int perParty = 4;
        CountDownLatch start = new CountDownLatch(1);
        List<Callable<CustodyEntry>> tasks = new ArrayList<>();
        for (int i = 0; i < perParty; i++) {
            for (Principal party : List.of(lead, assignee)) {
                tasks.add(() -> {
                    start.await();
                    return custody.append(party, new CustodyAppendCommand(e.getId(), CustodyAction.ACCESSED,
                            party.id(), null, "Evidence room", null));
                });
            }
        }

        ExecutorService pool = Executors.newFixedThreadPool(tasks.size());
        try {
            List<Future<CustodyEntry>> futures = new ArrayList<>();
            for (Callable<CustodyEntry> task : tasks) {
                futures.add(pool.submit(task));
            }
            start.countDown();
            for (Future<CustodyEntry> f : futures) {
                assertThat(f.get(30, TimeUnit.SECONDS)).isNotNull();
            }
        } finally {
            pool.shutdownNow();
        }

        List<CustodyEntry> newestFirst = custody.listFor(lead, e.getId());
        assertThat(newestFirst).hasSize(tasks.size());
        assertThat(newestFirst).extracting(CustodyEntry::id).doesNotHaveDuplicates();
        for (int i = 1; i < newestFirst.size(); i++) {
            assertThat(newestFirst.get(i - 1).occurredAt()).isAfter(newestFirst.get(i).occurredAt());
            assertThat(newestFirst.get(i - 1).sequenceNo()).isEqualTo(newestFirst.get(i).sequenceNo() + 1);
        }

        CustodyChainVerification verification = custody.verifyChain(admin, e.getId());
        assertThat(verification.status()).isEqualTo(CustodyChainVerification.Status.VALID);
        assertThat(verification.verifiedEntries()).isEqualTo(tasks.size());
    }

    @Test
    void auditEntryCannotBeRecordedOutsideATransaction() {
        assertThatThrownBy(() -> auditTrail.record(admin, AuditAction.CREATE_TAG, ResourceType.TAG,
                UUID.randomUUID(), Map.of()))
                .isInstanceOf(IllegalTransactionStateException.class);
    }

    @Test
    void nonAdminAuditListingContainsOnlyOwnEntries() {
        CaseRecord c = openCase(lead, lead.id(), null);
        openCase(admin, null, null);

        List<AuditLogEntry> mine = auditTrail.listRecent(lead, null, null);

        assertThat(mine).isNotEmpty().allSatisfy(entry -> assertThat(entry.principalId()).isEqualTo(lead.id()));
        assertThat(mine).extracting(AuditLogEntry::resourceId).contains(c.getId());
        for (int i = 1; i < mine.size(); i++) {
            assertThat(mine.get(i - 1).occurredAt()).isAfterOrEqualTo(mine.get(i).occurredAt());
        }
    }
}
