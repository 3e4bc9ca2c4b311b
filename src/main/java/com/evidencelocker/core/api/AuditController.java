package com.evidencelocker.core.api;

import com.evidencelocker.core.application.AuditTrailService;
import com.evidencelocker.core.config.IdentityContext;
import com.evidencelocker.core.domain.AuditAction;
import com.evidencelocker.core.domain.AuditLogEntry;
import com.evidencelocker.core.domain.AuditQuery;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.exception.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/audit")
@Tag(name = "Audit", description = "Append-only audit trail")
public class AuditController {

    private final AuditTrailService auditTrail;
    private final IdentityContext identity;

    public AuditController(AuditTrailService auditTrail, IdentityContext identity) {
        this.auditTrail = auditTrail;
        this.identity = identity;
    }

    @GetMapping
    @Operation(summary = "Newest audit entries first; non-administrators only see their own")
    public List<AuditLogEntry> list(
            @RequestParam(name = "resourceType", required = false) ResourceType resourceType,
            @RequestParam(name = "action", required = false) String action,
            @RequestParam(name = "resourceId", required = false) UUID resourceId,
            @RequestParam(name = "principalId", required = false) UUID principalId,
            @RequestParam(name = "limit", required = false) Integer limit) {
        AuditQuery query = new AuditQuery(resourceType, parseAction(action), resourceId, principalId);
        return auditTrail.listRecent(identity.currentPrincipal(), query, limit);
    }

    @GetMapping("/{id}")
    public AuditLogEntry get(@PathVariable("id") UUID entryId) {
        return auditTrail.get(identity.currentPrincipal(), entryId);
    }

    /** Accepts either the label ("AddEvidence") or the constant name ("ADD_EVIDENCE"). */
    private static AuditAction parseAction(String action) {
        if (action == null || action.isBlank()) {
            return null;
        }
        try {
            return AuditAction.fromLabel(action);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }
}
