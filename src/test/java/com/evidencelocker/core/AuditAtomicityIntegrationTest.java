package com.evidencelocker.core;

import com.evidencelocker.core.application.CaseService;
import com.evidencelocker.core.application.CustodyAppendCommand;
import com.evidencelocker.core.application.CustodyLedgerService;
import com.evidencelocker.core.application.NewCaseCommand;
import com.evidencelocker.core.application.TagService;
import com.evidencelocker.core.domain.AuditLogEntry;
import com.evidencelocker.core.domain.CasePriority;
import com.evidencelocker.core.domain.CaseRecord;
import com.evidencelocker.core.domain.CaseStatus;
import com.evidencelocker.core.domain.CustodyAction;
import com.evidencelocker.core.domain.Evidence;
import com.evidencelocker.core.domain.EvidenceStatus;
import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.Role;
import com.evidencelocker.core.domain.ports.AuditLogRepository;
import com.evidencelocker.core.domain.ports.CaseRepository;
import com.evidencelocker.core.domain.ports.CustodyLedgerRepository;
import com.evidencelocker.core.domain.ports.EvidenceRepository;
import com.evidencelocker.core.domain.ports.PrincipalDirectory;
import com.evidencelocker.core.domain.ports.TagRepository;
import com.evidencelocker.core.support.TestPrincipals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * A failing audit write must take the mutation down with it.
 */
@SpringBootTest
@ActiveProfiles("test")
class AuditAtomicityIntegrationTest {

    @MockBean
    private AuditLogRepository auditLog;

    @Autowired
    private PrincipalDirectory directory;

    @Autowired
    private CaseService cases;

    @Autowired
    private CaseRepository caseRepository;

    @Autowired
    private EvidenceRepository evidenceRepository;

    @Autowired
    private CustodyLedgerService custody;

    @Autowired
    private CustodyLedgerRepository ledger;

    @Autowired
    private TagService tags;

    @Autowired
    private TagRepository tagRepository;

    private Principal investigator;

    @BeforeEach
    void setUp() {
        investigator = new TestPrincipals(directory).create(Role.INVESTIGATOR);
        when(auditLog.append(any(AuditLogEntry.class))).thenThrow(new IllegalStateException("audit store unavailable"));
    }

    @Test
    void caseIsNotCreatedWhenAuditWriteFails() {
        String caseNumber = TestPrincipals.uniqueCaseNumber();

        assertThatThrownBy(() -> cases.create(investigator, new NewCaseCommand(caseNumber, "Arson", null,
                null, null, investigator.id(), null, null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("audit store unavailable");

        assertThat(caseRepository.existsByCaseNumber(caseNumber)).isFalse();
    }

    @Test
    void custodyEntryIsNotKeptWhenAuditWriteFails() {
        OffsetDateTime now = OffsetDateTime.now().truncatedTo(ChronoUnit.MICROS);
        CaseRecord c = caseRepository.save(new CaseRecord(UUID.randomUUID(), TestPrincipals.uniqueCaseNumber(),
                "Fraud", null, investigator.id(), investigator.id(), null, null, null,
                CaseStatus.ACTIVE, CasePriority.HIGH,
                now, now, 0L));
        Evidence e = evidenceRepository.save(new Evidence(UUID.randomUUID(), c.getId(), "ledger book", null,
                "ledger.pdf", null, 10L, "application/pdf", null, EvidenceStatus.PENDING, null, null, null,
                investigator.id(), now, now, 0L));

        assertThatThrownBy(() -> custody.append(investigator, new CustodyAppendCommand(e.getId(),
                CustodyAction.ACCESSED, investigator.id(), null, "Records room", null)))
                .isInstanceOf(IllegalStateException.class);

        assertThat(ledger.findByEvidenceNewestFirst(e.getId())).isEmpty();
    }

    @Test
    void tagIsNotCreatedWhenAuditWriteFails() {
        String name = "suspect-" + UUID.randomUUID().toString().substring(0, 8);

        assertThatThrownBy(() -> tags.create(investigator, name, "#AA0000"))
                .isInstanceOf(IllegalStateException.class);

        assertThat(tagRepository.findByName(name)).isEmpty();
    }
}
