package com.evidencelocker.core.application;

import com.evidencelocker.core.domain.AuditAction;
import com.evidencelocker.core.domain.CustodyChain;
import com.evidencelocker.core.domain.CustodyChainVerification;
import com.evidencelocker.core.domain.CustodyEntry;
import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.policy.PolicyAction;
import com.evidencelocker.core.domain.ports.CustodyLedgerRepository;
import com.evidencelocker.core.domain.ports.EvidenceRepository;
import com.evidencelocker.core.domain.ports.PrincipalDirectory;
import com.evidencelocker.core.exception.ForbiddenException;
import com.evidencelocker.core.exception.ResourceNotFoundException;
import com.evidencelocker.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Chain-of-custody ledger. Entries are only ever appended; a recipient named in an entry becomes
 * part of the evidence item's accessor set from the moment the append commits.
 */
@Service
public class CustodyLedgerService {

    private static final Logger log = LoggerFactory.getLogger(CustodyLedgerService.class);
    private static final int MAX_LOCATION_LENGTH = 500;
    private static final int MAX_NOTES_LENGTH = 2000;

    private final CustodyLedgerRepository ledger;
    private final EvidenceRepository evidence;
    private final PrincipalDirectory principals;
    private final AccessGuard guard;
    private final AuditTrailService auditTrail;
    private final Clock clock;

    public CustodyLedgerService(CustodyLedgerRepository ledger, EvidenceRepository evidence,
                                PrincipalDirectory principals, AccessGuard guard,
                                AuditTrailService auditTrail, Clock clock) {
        this.ledger = ledger;
        this.evidence = evidence;
        this.principals = principals;
        this.guard = guard;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    @Transactional
    public CustodyEntry append(Principal requester, CustodyAppendCommand cmd) {
        log.info("Appending custody entry - evidence: {}, action: {}, requester: {}",
                cmd.evidenceId, cmd.action, requester.id());

        guard.requireEvidence(requester, PolicyAction.UPDATE, cmd.evidenceId);
        validate(cmd);

        if (!requester.isAdmin()
                && !requester.id().equals(cmd.fromPrincipalId)
                && !requester.id().equals(cmd.toPrincipalId)) {
            throw new ForbiddenException(ResourceType.EVIDENCE, cmd.evidenceId,
                    "Principal " + requester.id() + " is not a party to this custody entry");
        }

        CustodyEntry entry = write(cmd);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("evidenceId", cmd.evidenceId);
        details.put("custodyAction", cmd.action);
        details.put("sequenceNo", entry.sequenceNo());
        details.put("fromPrincipal", cmd.fromPrincipalId);
        details.put("toPrincipal", cmd.toPrincipalId);
        details.put("location", cmd.location);
        details.put("notes", cmd.notes);
        auditTrail.record(requester, AuditAction.APPEND_CUSTODY, ResourceType.CUSTODY_ENTRY, entry.id(), details);

        return entry;
    }

    /**
     * Writes the next link of the chain. Callers have already enforced access and must run inside
     * a transaction: the evidence row stays locked until it commits, which serialises concurrent
     * appends for the same item.
     */
    CustodyEntry appendEntry(CustodyAppendCommand cmd) {
        validate(cmd);
        return write(cmd);
    }

    private CustodyEntry write(CustodyAppendCommand cmd) {
        if (!evidence.lockForAppend(cmd.evidenceId)) {
            throw new ResourceNotFoundException(ResourceType.EVIDENCE, cmd.evidenceId);
        }

        CustodyEntry previous = ledger.findLatest(cmd.evidenceId).orElse(null);
        CustodyEntry next = CustodyChain.next(previous, UUID.randomUUID(), cmd.evidenceId, cmd.action,
                cmd.fromPrincipalId, cmd.toPrincipalId, cmd.location.trim(), cmd.notes, OffsetDateTime.now(clock));
        CustodyEntry saved = ledger.append(next);

        log.info("Custody entry {} appended - evidence: {}, seq: {}, action: {}, from: {}, to: {}",
                saved.id(), saved.evidenceId(), saved.sequenceNo(), saved.action(),
                saved.fromPrincipalId(), saved.toPrincipalId());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<CustodyEntry> listFor(Principal requester, UUID evidenceId) {
        guard.requireEvidence(requester, PolicyAction.READ, evidenceId);
        return ledger.findByEvidenceNewestFirst(evidenceId);
    }

    @Transactional(readOnly = true)
    public CustodyEntry get(Principal requester, UUID entryId) {
        guard.requireCustodyEntry(requester, PolicyAction.READ, entryId);
        return ledger.findById(entryId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.CUSTODY_ENTRY, entryId));
    }

    @Transactional(readOnly = true)
    public CustodyChainVerification verifyChain(Principal requester, UUID evidenceId) {
        guard.requireEvidence(requester, PolicyAction.READ, evidenceId);
        CustodyChainVerification result = CustodyChain.verify(evidenceId,
                ledger.findByEvidenceOldestFirst(evidenceId), OffsetDateTime.now(clock));
        if (result.status() == CustodyChainVerification.Status.BROKEN) {
            log.error("Custody chain BROKEN for evidence {}: {}", evidenceId, result.brokenLink());
        } else {
            log.info("Custody chain for evidence {} is {} ({} entries)", evidenceId, result.status(), result.totalEntries());
        }
        return result;
    }

    private void validate(CustodyAppendCommand cmd) {
        if (cmd.action == null) {
            throw new ValidationException("Custody action is required");
        }
        if (cmd.location == null || cmd.location.isBlank()) {
            throw new ValidationException("Custody location is required");
        }
        if (cmd.location.trim().length() > MAX_LOCATION_LENGTH) {
            throw new ValidationException("Custody location exceeds " + MAX_LOCATION_LENGTH + " characters");
        }
        if (cmd.notes != null && cmd.notes.length() > MAX_NOTES_LENGTH) {
            throw new ValidationException("Custody notes exceed " + MAX_NOTES_LENGTH + " characters");
        }
        if (cmd.fromPrincipalId == null && cmd.toPrincipalId == null) {
            throw new ValidationException("At least one of fromPrincipal or toPrincipal is required");
        }
        requireKnownPrincipal(cmd.fromPrincipalId, "fromPrincipal");
        requireKnownPrincipal(cmd.toPrincipalId, "toPrincipal");
    }

    private void requireKnownPrincipal(UUID principalId, String field) {
        if (principalId != null && !principals.existsById(principalId)) {
            throw new ValidationException(field + " does not name a known principal");
        }
    }
}
