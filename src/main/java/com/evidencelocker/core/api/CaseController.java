package com.evidencelocker.core.api;

import com.evidencelocker.core.api.dto.CaseView;
import com.evidencelocker.core.api.dto.CreateCaseRequest;
import com.evidencelocker.core.api.dto.UpdateCaseRequest;
import com.evidencelocker.core.application.CaseService;
import com.evidencelocker.core.application.NewCaseCommand;
import com.evidencelocker.core.config.IdentityContext;
import com.evidencelocker.core.domain.CaseChanges;
import com.evidencelocker.core.domain.CaseRecord;
import com.evidencelocker.core.domain.Principal;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/cases")
@Tag(name = "Cases", description = "Investigative cases")
public class CaseController {

    private static final Logger log = LoggerFactory.getLogger(CaseController.class);

    private final CaseService cases;
    private final IdentityContext identity;

    public CaseController(CaseService cases, IdentityContext identity) {
        this.cases = cases;
        this.identity = identity;
    }

    @GetMapping
    @Operation(summary = "Cases the caller is related to (all cases for administrators)")
    public List<CaseView> list() {
        return cases.listVisible(identity.currentPrincipal()).stream().map(CaseView::of).toList();
    }

    @PostMapping
    @Operation(summary = "Open a case (administrators and investigators)")
    public ResponseEntity<CaseView> create(@Valid @RequestBody CreateCaseRequest r) {
        Principal principal = identity.currentPrincipal();
        log.info("Create case request - principal: {}, number: {}", principal.id(), r.caseNumber);
        CaseRecord created = cases.create(principal, new NewCaseCommand(
                r.caseNumber, r.title, r.description, r.status, r.priority, r.leadInvestigatorId,
                r.assignedToId, r.dueDate));
        return ResponseEntity.status(HttpStatus.CREATED).body(CaseView.of(created));
    }

    @GetMapping("/{id}")
    public CaseView get(@PathVariable("id") UUID id) {
        Principal principal = identity.currentPrincipal();
        CaseRecord found = cases.get(principal, id);
        return CaseView.of(found, cases.evidenceCount(principal, id));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update case fields; send expectedVersion to reject stale writes")
    public CaseView update(@PathVariable("id") UUID id, @Valid @RequestBody UpdateCaseRequest r) {
        CaseChanges changes = new CaseChanges(r.title, r.description, r.findings, r.dueDate, r.status,
                r.priority, r.leadInvestigatorId, r.clearLeadInvestigator, r.assignedToId, r.clearAssignee);
        return CaseView.of(cases.update(identity.currentPrincipal(), id, changes, r.expectedVersion));
    }
}
