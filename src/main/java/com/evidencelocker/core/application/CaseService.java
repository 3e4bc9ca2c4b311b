package com.evidencelocker.core.application;

import com.evidencelocker.core.domain.AuditAction;
import com.evidencelocker.core.domain.CaseChanges;
import com.evidencelocker.core.domain.CasePriority;
import com.evidencelocker.core.domain.CaseRecord;
import com.evidencelocker.core.domain.CaseStatus;
import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.policy.PolicyAction;
import com.evidencelocker.core.domain.ports.CaseRepository;
import com.evidencelocker.core.domain.ports.EvidenceRepository;
import com.evidencelocker.core.domain.ports.PrincipalDirectory;
import com.evidencelocker.core.exception.ConflictException;
import com.evidencelocker.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class CaseService {

    private static final Logger log = LoggerFactory.getLogger(CaseService.class);

    private final CaseRepository cases;
    private final EvidenceRepository evidence;
    private final PrincipalDirectory principals;
    private final AccessGuard guard;
    private final AuditTrailService auditTrail;
    private final Clock clock;

    public CaseService(CaseRepository cases, EvidenceRepository evidence, PrincipalDirectory principals,
                       AccessGuard guard, AuditTrailService auditTrail, Clock clock) {
        this.cases = cases;
        this.evidence = evidence;
        this.principals = principals;
        this.guard = guard;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    @Transactional
    public CaseRecord create(Principal creator, NewCaseCommand cmd) {
        log.info("Creating case - number: {}, creator: {}", cmd.caseNumber, creator.id());
        guard.requireCreation(creator, ResourceType.CASE);

        if (isBlank(cmd.caseNumber) || isBlank(cmd.title)) {
            throw new ValidationException("caseNumber and title are required");
        }
        requireKnownPrincipal(cmd.leadInvestigatorId, "leadInvestigator");
        requireKnownPrincipal(cmd.assignedToId, "assignedTo");
        if (cases.existsByCaseNumber(cmd.caseNumber.trim())) {
            throw new ConflictException("Case number already in use: " + cmd.caseNumber.trim());
        }

        OffsetDateTime now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        CaseRecord saved = cases.save(new CaseRecord(
                UUID.randomUUID(),
                cmd.caseNumber.trim(),
                cmd.title.trim(),
                cmd.description,
                creator.id(),
                cmd.leadInvestigatorId,
                cmd.assignedToId,
                null,
                cmd.dueDate,
                Optional.ofNullable(cmd.status).orElse(CaseStatus.ACTIVE),
                Optional.ofNullable(cmd.priority).orElse(CasePriority.MEDIUM),
                now,
                now,
                0L
        ));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("caseNumber", saved.getCaseNumber());
        details.put("title", saved.getTitle());
        details.put("leadInvestigator", saved.getLeadInvestigatorId());
        details.put("assignedTo", saved.getAssignedToId());
        auditTrail.record(creator, AuditAction.CREATE_CASE, ResourceType.CASE, saved.getId(), details);

        log.info("Case {} created with number {}", saved.getId(), saved.getCaseNumber());
        return saved;
    }

    @Transactional(readOnly = true)
    public CaseRecord get(Principal requester, UUID caseId) {
        Optional<CaseRecord> found = cases.findById(caseId);
        guard.require(requester, PolicyAction.READ, ResourceType.CASE, caseId, found.map(CaseRecord::relations));
        return found.get();
    }

    /** Cases the requester may read, newest first. Every candidate goes through the policy. */
    @Transactional(readOnly = true)
    public List<CaseRecord> listVisible(Principal requester) {
        List<CaseRecord> visible = cases.findAllNewestFirst().stream()
                .filter(c -> guard.permits(requester, PolicyAction.READ, c.relations()))
                .toList();
        log.debug("Principal {} sees {} cases", requester.id(), visible.size());
        return visible;
    }

    @Transactional(readOnly = true)
    public long evidenceCount(Principal requester, UUID caseId) {
        guard.requireCase(requester, PolicyAction.READ, caseId);
        return evidence.countByCase(caseId);
    }

    @Transactional
    public CaseRecord update(Principal requester, UUID caseId, CaseChanges changes, Long expectedVersion) {
        log.info("Updating case {} - requester: {}, expectedVersion: {}", caseId, requester.id(), expectedVersion);
        guard.requireCase(requester, PolicyAction.UPDATE, caseId);

        if (changes.title() != null && changes.title().isBlank()) {
            throw new ValidationException("title must not be blank");
        }
        requireKnownPrincipal(changes.leadInvestigatorId(), "leadInvestigator");
        requireKnownPrincipal(changes.assignedToId(), "assignedTo");

        CaseRecord updated = cases.update(caseId, changes, expectedVersion);

        Map<String, Object> details = new LinkedHashMap<>();
        putIfPresent(details, "title", changes.title());
        putIfPresent(details, "status", changes.status());
        putIfPresent(details, "priority", changes.priority());
        putIfPresent(details, "dueDate", changes.dueDate());
        if (changes.findings() != null) {
            details.put("findingsUpdated", true);
        }
        if (changes.touchesRelations()) {
            details.put("leadInvestigator", updated.getLeadInvestigatorId());
            details.put("assignedTo", updated.getAssignedToId());
        }
        details.put("version", updated.getVersion());
        auditTrail.record(requester, AuditAction.UPDATE_CASE, ResourceType.CASE, caseId, details);

        log.info("Case {} updated to version {}", caseId, updated.getVersion());
        return updated;
    }

    private void requireKnownPrincipal(UUID principalId, String field) {
        if (principalId != null && !principals.existsById(principalId)) {
            throw new ValidationException(field + " does not name a known principal");
        }
    }

    private static void putIfPresent(Map<String, Object> details, String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
