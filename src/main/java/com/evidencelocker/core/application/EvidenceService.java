package com.evidencelocker.core.application;

import com.evidencelocker.core.domain.AuditAction;
import com.evidencelocker.core.domain.CustodyAction;
import com.evidencelocker.core.domain.CustodyEntry;
import com.evidencelocker.core.domain.Evidence;
import com.evidencelocker.core.domain.EvidenceStatus;
import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.policy.EvidenceRelations;
import com.evidencelocker.core.domain.policy.PolicyAction;
import com.evidencelocker.core.domain.ports.EvidenceRepository;
import com.evidencelocker.core.domain.ports.RelationSnapshotReader;
import com.evidencelocker.core.exception.ResourceNotFoundException;
import com.evidencelocker.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class EvidenceService {

    private static final Logger log = LoggerFactory.getLogger(EvidenceService.class);

    private final EvidenceRepository evidence;
    private final RelationSnapshotReader relations;
    private final AccessGuard guard;
    private final CustodyLedgerService custody;
    private final AuditTrailService auditTrail;
    private final Clock clock;

    public EvidenceService(EvidenceRepository evidence, RelationSnapshotReader relations, AccessGuard guard,
                           CustodyLedgerService custody, AuditTrailService auditTrail, Clock clock) {
        this.evidence = evidence;
        this.relations = relations;
        this.guard = guard;
        this.custody = custody;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    /**
     * Registers uploaded evidence metadata in a case. With an intake location the custody chain is
     * opened by a CREATED entry to the uploader in the same unit of work.
     */
    @Transactional
    public Evidence register(Principal uploader, UUID caseId, NewEvidenceCommand cmd) {
        log.info("Registering evidence - case: {}, uploader: {}, file: {}", caseId, uploader.id(), cmd.fileName);
        guard.requireCase(uploader, PolicyAction.UPDATE, caseId);

        if (cmd.title == null || cmd.title.isBlank()) {
            throw new ValidationException("title is required");
        }
        if (cmd.fileName == null || cmd.fileName.isBlank()) {
            throw new ValidationException("fileName is required");
        }
        if (cmd.fileSize != null && cmd.fileSize < 0) {
            throw new ValidationException("fileSize must not be negative");
        }

        OffsetDateTime now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        Evidence saved = evidence.save(new Evidence(
                UUID.randomUUID(),
                caseId,
                cmd.title.trim(),
                cmd.description,
                cmd.fileName,
                cmd.fileRef,
                cmd.fileSize,
                cmd.fileType,
                cmd.hashValue,
                EvidenceStatus.PENDING,
                cmd.collectedAt,
                cmd.collectedBy,
                cmd.locationFound,
                uploader.id(),
                now,
                now,
                0L
        ));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("caseId", caseId);
        details.put("title", saved.getTitle());
        details.put("fileName", saved.getFileName());
        details.put("hashValue", saved.getHashValue());

        if (cmd.intakeLocation != null && !cmd.intakeLocation.isBlank()) {
            CustodyEntry intake = custody.appendEntry(new CustodyAppendCommand(
                    saved.getId(), CustodyAction.CREATED, null, uploader.id(), cmd.intakeLocation, "Evidence intake"));
            details.put("intakeEntry", intake.id());
        }

        auditTrail.record(uploader, AuditAction.ADD_EVIDENCE, ResourceType.EVIDENCE, saved.getId(), details);
        log.info("Evidence {} registered in case {}", saved.getId(), caseId);
        return saved;
    }

    @Transactional(readOnly = true)
    public Evidence get(Principal requester, UUID evidenceId) {
        guard.requireEvidence(requester, PolicyAction.READ, evidenceId);
        return evidence.findById(evidenceId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.EVIDENCE, evidenceId));
    }

    /**
     * Evidence of a case the requester may read, newest first. Each item is decided on its own, so
     * a custodian who is not on the case sees exactly the items they hold.
     */
    @Transactional(readOnly = true)
    public List<Evidence> listInCase(Principal requester, UUID caseId) {
        List<UUID> visible = relations.evidenceRelationsInCase(caseId).stream()
                .filter(r -> guard.permits(requester, PolicyAction.READ, r))
                .map(EvidenceRelations::evidenceId)
                .toList();
        if (visible.isEmpty()) {
            // nothing visible: the answer is empty only for principals who may read the case itself
            guard.requireCase(requester, PolicyAction.READ, caseId);
            return List.of();
        }
        return evidence.findAllById(visible).stream()
                .sorted(Comparator.comparing(Evidence::getCreatedAt).reversed())
                .toList();
    }

    @Transactional
    public Evidence updateStatus(Principal requester, UUID evidenceId, EvidenceStatus status, Long expectedVersion) {
        log.info("Updating evidence {} status to {} - requester: {}", evidenceId, status, requester.id());
        guard.requireEvidence(requester, PolicyAction.UPDATE, evidenceId);
        if (status == null) {
            throw new ValidationException("status is required");
        }

        EvidenceStatus previous = evidence.findById(evidenceId)
                .map(Evidence::getStatus)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.EVIDENCE, evidenceId));
        Evidence updated = evidence.updateStatus(evidenceId, status, expectedVersion);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", previous);
        details.put("to", status);
        details.put("version", updated.getVersion());
        auditTrail.record(requester, AuditAction.UPDATE_EVIDENCE_STATUS, ResourceType.EVIDENCE, evidenceId, details);
        return updated;
    }

    /**
     * Records that the requester downloaded the file: a DOWNLOADED custody entry from the requester
     * plus one audit entry.
     */
    @Transactional
    public CustodyEntry recordDownload(Principal requester, UUID evidenceId, String location) {
        log.info("Recording download of evidence {} by {}", evidenceId, requester.id());
        guard.requireEvidence(requester, PolicyAction.READ, evidenceId);

        CustodyEntry entry = custody.appendEntry(new CustodyAppendCommand(
                evidenceId, CustodyAction.DOWNLOADED, requester.id(), null, location, "File downloaded"));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("custodyEntry", entry.id());
        details.put("sequenceNo", entry.sequenceNo());
        details.put("location", entry.location());
        auditTrail.record(requester, AuditAction.DOWNLOAD_EVIDENCE, ResourceType.EVIDENCE, evidenceId, details);
        return entry;
    }
}
