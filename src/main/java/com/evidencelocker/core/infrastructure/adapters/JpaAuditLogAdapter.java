package com.evidencelocker.core.infrastructure.adapters;

import com.evidencelocker.core.domain.AuditAction;
import com.evidencelocker.core.domain.AuditLogEntry;
import com.evidencelocker.core.domain.AuditQuery;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.ports.AuditLogRepository;
import com.evidencelocker.core.infrastructure.jpa.AuditLogEntity;
import com.evidencelocker.core.infrastructure.jpa.SpringAuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.criteria.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaAuditLogAdapter implements AuditLogRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaAuditLogAdapter.class);
    private static final TypeReference<Map<String, Object>> DETAILS = new TypeReference<>() {};

    private final SpringAuditLogRepository auditLog;
    private final ObjectMapper objectMapper;

    public JpaAuditLogAdapter(SpringAuditLogRepository auditLog, ObjectMapper objectMapper) {
        this.auditLog = auditLog;
        this.objectMapper = objectMapper;
    }

    @Override
    public AuditLogEntry append(AuditLogEntry entry) {
        AuditLogEntity e = new AuditLogEntity();
        e.setId(entry.id());
        e.setPrincipalId(entry.principalId());
        e.setAction(entry.action().name());
        e.setResourceType(entry.resourceType().name());
        e.setResourceId(entry.resourceId());
        e.setDetailsJson(writeDetails(entry.details()));
        e.setOccurredAt(entry.occurredAt());
        auditLog.saveAndFlush(e);
        return entry;
    }

    @Override
    public Optional<AuditLogEntry> findById(UUID entryId) {
        return auditLog.findById(entryId).map(this::toDomain);
    }

    @Override
    public List<AuditLogEntry> findNewestFirst(AuditQuery query, int limit) {
        PageRequest page = PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "occurredAt", "id"));
        return auditLog.findAll(matching(query), page).stream().map(this::toDomain).toList();
    }

    @Override
    public long countByResourceAndAction(UUID resourceId, AuditAction action) {
        return auditLog.countByResourceIdAndAction(resourceId, action.name());
    }

    private static Specification<AuditLogEntity> matching(AuditQuery query) {
        return (root, cq, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (query.resourceType() != null) {
                predicates.add(cb.equal(root.get("resourceType"), query.resourceType().name()));
            }
            if (query.action() != null) {
                predicates.add(cb.equal(root.get("action"), query.action().name()));
            }
            if (query.resourceId() != null) {
                predicates.add(cb.equal(root.get("resourceId"), query.resourceId()));
            }
            if (query.principalId() != null) {
                predicates.add(cb.equal(root.get("principalId"), query.principalId()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private String writeDetails(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            // fails the surrounding transaction along with the mutation being audited
            throw new IllegalStateException("Audit details could not be serialised", e);
        }
    }

    private AuditLogEntry toDomain(AuditLogEntity e) {
        return new AuditLogEntry(e.getId(), e.getPrincipalId(), AuditAction.valueOf(e.getAction()),
                ResourceType.valueOf(e.getResourceType()), e.getResourceId(), readDetails(e), e.getOccurredAt());
    }

    private Map<String, Object> readDetails(AuditLogEntity e) {
        if (e.getDetailsJson() == null) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(e.getDetailsJson(), DETAILS);
        } catch (JsonProcessingException ex) {
            log.error("Unreadable details on audit entry {}: {}", e.getId(), ex.getMessage());
            return Map.of("unreadable", e.getDetailsJson());
        }
    }
}
