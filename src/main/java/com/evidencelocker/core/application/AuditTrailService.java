package com.evidencelocker.core.application;

import com.evidencelocker.core.config.AppProperties;
import com.evidencelocker.core.domain.AuditAction;
import com.evidencelocker.core.domain.AuditLogEntry;
import com.evidencelocker.core.domain.AuditQuery;
import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.policy.AuditEntryRelations;
import com.evidencelocker.core.domain.policy.AuditScope;
import com.evidencelocker.core.domain.policy.PolicyAction;
import com.evidencelocker.core.domain.ports.AuditLogRepository;
import com.evidencelocker.core.exception.ForbiddenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only record of every state-changing action.
 *
 * <p>{@link #record} joins the caller's transaction and refuses to run without one, so an audit
 * entry can never commit apart from the mutation it describes. A failed audit write propagates and
 * rolls the mutation back.
 */
@Service
public class AuditTrailService {

    private static final Logger log = LoggerFactory.getLogger(AuditTrailService.class);
    private static final int MAX_KEY_LENGTH = 64;

    private final AuditLogRepository auditLog;
    private final AccessGuard guard;
    private final Clock clock;
    private final int detailMaxLength;
    private final int maxDetailEntries;
    private final int maxListLimit;

    public AuditTrailService(AuditLogRepository auditLog, AccessGuard guard, Clock clock, AppProperties properties) {
        this.auditLog = auditLog;
        this.guard = guard;
        this.clock = clock;
        this.detailMaxLength = properties.getAudit().getDetailMaxLength();
        this.maxDetailEntries = properties.getAudit().getMaxDetailEntries();
        this.maxListLimit = properties.getAudit().getMaxListLimit();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public AuditLogEntry record(Principal principal, AuditAction action, ResourceType resourceType,
                                UUID resourceId, Map<String, ?> details) {
        AuditLogEntry entry = new AuditLogEntry(
                UUID.randomUUID(),
                principal.id(),
                action,
                resourceType,
                resourceId,
                bound(details),
                OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS)
        );
        AuditLogEntry saved = auditLog.append(entry);
        log.info("Audit recorded - action: {}, principal: {}, {} {}", action.label(), principal.id(), resourceType, resourceId);
        return saved;
    }

    /**
     * Newest entries first. Non-admins only ever see their own entries; asking for someone else's
     * is refused rather than answered with an empty list.
     */
    @Transactional(readOnly = true)
    public List<AuditLogEntry> listRecent(Principal requester, AuditQuery filters, Integer limit) {
        AuditQuery query = filters == null ? AuditQuery.all() : filters;
        AuditScope scope = guard.auditScope(requester);

        if (query.principalId() != null && !scope.permits(query.principalId())) {
            throw new ForbiddenException(ResourceType.AUDIT_ENTRY, null,
                    "Principal " + requester.id() + " may not list audit entries of " + query.principalId());
        }
        if (!scope.isUnrestricted()) {
            query = query.withPrincipal(scope.ownerId());
        }

        int effectiveLimit = clampLimit(limit);
        log.debug("Listing audit entries - requester: {}, query: {}, limit: {}", requester.id(), query, effectiveLimit);
        return auditLog.findNewestFirst(query, effectiveLimit);
    }

    @Transactional(readOnly = true)
    public List<AuditLogEntry> listForResource(Principal requester, ResourceType resourceType, UUID resourceId, Integer limit) {
        return listRecent(requester, new AuditQuery(resourceType, null, resourceId, null), limit);
    }

    @Transactional(readOnly = true)
    public AuditLogEntry get(Principal requester, UUID entryId) {
        Optional<AuditLogEntry> entry = auditLog.findById(entryId);
        guard.require(requester, PolicyAction.READ, ResourceType.AUDIT_ENTRY, entryId,
                entry.map(e -> new AuditEntryRelations(e.id(), e.principalId())));
        return entry.get();
    }

    int clampLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return maxListLimit;
        }
        return Math.min(limit, maxListLimit);
    }

    /**
     * Bounds a details payload: at most {@code maxDetailEntries} keys, scalars kept as they are,
     * everything else stringified and cut to {@code detailMaxLength} characters.
     */
    Map<String, Object> bound(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> bounded = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : details.entrySet()) {
            if (bounded.size() >= maxDetailEntries) {
                log.debug("Audit details truncated to {} entries", maxDetailEntries);
                break;
            }
            bounded.put(truncate(e.getKey(), MAX_KEY_LENGTH), boundValue(e.getValue()));
        }
        return Collections.unmodifiableMap(bounded);
    }

    private Object boundValue(Object value) {
        if (value == null || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        return truncate(String.valueOf(value), detailMaxLength);
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
