package com.evidencelocker.core.infrastructure.adapters;

import com.evidencelocker.core.domain.CaseChanges;
import com.evidencelocker.core.domain.CasePriority;
import com.evidencelocker.core.domain.CaseRecord;
import com.evidencelocker.core.domain.CaseStatus;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.ports.CaseRepository;
import com.evidencelocker.core.exception.ConflictException;
import com.evidencelocker.core.exception.ResourceNotFoundException;
import com.evidencelocker.core.infrastructure.jpa.CaseEntity;
import com.evidencelocker.core.infrastructure.jpa.SpringCaseRepository;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaCaseRepositoryAdapter implements CaseRepository {
    private final SpringCaseRepository cases;
    private final Clock clock;

    public JpaCaseRepositoryAdapter(SpringCaseRepository cases, Clock clock) {
        this.cases = cases;
        this.clock = clock;
    }

    @Override
    public CaseRecord save(CaseRecord c) {
        CaseEntity e = new CaseEntity();
        e.setId(c.getId());
        e.setCaseNumber(c.getCaseNumber());
        e.setTitle(c.getTitle());
        e.setDescription(c.getDescription());
        e.setCreatedBy(c.getCreatorId());
        e.setLeadInvestigatorId(c.getLeadInvestigatorId());
        e.setAssignedTo(c.getAssignedToId());
        e.setFindings(c.getFindings());
        e.setDueDate(c.getDueDate());
        e.setStatus(c.getStatus().name());
        e.setPriority(c.getPriority().name());
        e.setCreatedAt(c.getCreatedAt());
        e.setUpdatedAt(c.getUpdatedAt());
        return toDomain(cases.saveAndFlush(e));
    }

    @Override
    public Optional<CaseRecord> findById(UUID caseId) {
        return cases.findById(caseId).map(JpaCaseRepositoryAdapter::toDomain);
    }

    @Override
    public List<CaseRecord> findAllNewestFirst() {
        return cases.findAllByOrderByCreatedAtDesc().stream().map(JpaCaseRepositoryAdapter::toDomain).toList();
    }

    @Override
    public boolean existsByCaseNumber(String caseNumber) {
        return cases.existsByCaseNumber(caseNumber);
    }

    @Override
    public CaseRecord update(UUID caseId, CaseChanges changes, Long expectedVersion) {
        CaseEntity e = cases.findById(caseId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.CASE, caseId));
        if (expectedVersion != null && !expectedVersion.equals(e.getVersion())) {
            throw new ConflictException("Case " + caseId + " is at version " + e.getVersion()
                    + ", not " + expectedVersion);
        }

        if (changes.title() != null) e.setTitle(changes.title().trim());
        if (changes.description() != null) e.setDescription(changes.description());
        if (changes.findings() != null) e.setFindings(changes.findings());
        if (changes.dueDate() != null) e.setDueDate(changes.dueDate());
        if (changes.status() != null) e.setStatus(changes.status().name());
        if (changes.priority() != null) e.setPriority(changes.priority().name());
        if (changes.clearLeadInvestigator()) {
            e.setLeadInvestigatorId(null);
        } else if (changes.leadInvestigatorId() != null) {
            e.setLeadInvestigatorId(changes.leadInvestigatorId());
        }
        if (changes.clearAssignee()) {
            e.setAssignedTo(null);
        } else if (changes.assignedToId() != null) {
            e.setAssignedTo(changes.assignedToId());
        }
        e.setUpdatedAt(OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS));

        // flush so the returned record carries the incremented version
        return toDomain(cases.saveAndFlush(e));
    }

    private static CaseRecord toDomain(CaseEntity e) {
        return new CaseRecord(e.getId(), e.getCaseNumber(), e.getTitle(), e.getDescription(), e.getCreatedBy(),
                e.getLeadInvestigatorId(), e.getAssignedTo(), e.getFindings(), e.getDueDate(),
                CaseStatus.valueOf(e.getStatus()), CasePriority.valueOf(e.getPriority()),
                e.getCreatedAt(), e.getUpdatedAt(), e.getVersion() == null ? 0L : e.getVersion());
    }
}
