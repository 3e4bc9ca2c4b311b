package com.evidencelocker.core.api;

import com.evidencelocker.core.api.dto.DownloadRequest;
import com.evidencelocker.core.api.dto.RegisterEvidenceRequest;
import com.evidencelocker.core.api.dto.UpdateEvidenceStatusRequest;
import com.evidencelocker.core.application.EvidenceService;
import com.evidencelocker.core.application.NewEvidenceCommand;
import com.evidencelocker.core.config.IdentityContext;
import com.evidencelocker.core.domain.CustodyEntry;
import com.evidencelocker.core.domain.Evidence;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@Tag(name = "Evidence", description = "Evidence items and their metadata")
public class EvidenceController {

    private final EvidenceService evidence;
    private final IdentityContext identity;

    public EvidenceController(EvidenceService evidence, IdentityContext identity) {
        this.evidence = evidence;
        this.identity = identity;
    }

    @GetMapping("/cases/{caseId}/evidence")
    @Operation(summary = "Evidence of a case the caller may read")
    public List<Evidence> listInCase(@PathVariable("caseId") UUID caseId) {
        return evidence.listInCase(identity.currentPrincipal(), caseId);
    }

    @PostMapping("/cases/{caseId}/evidence")
    @Operation(summary = "Register uploaded evidence; intakeLocation opens the custody chain")
    public ResponseEntity<Evidence> register(@PathVariable("caseId") UUID caseId,
                                             @Valid @RequestBody RegisterEvidenceRequest r) {
        Evidence created = evidence.register(identity.currentPrincipal(), caseId, new NewEvidenceCommand(
                r.title, r.description, r.fileName, r.fileRef, r.fileSize, r.fileType, r.hashValue,
                r.collectedAt, r.collectedBy, r.locationFound, r.intakeLocation));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/evidence/{id}")
    public Evidence get(@PathVariable("id") UUID id) {
        return evidence.get(identity.currentPrincipal(), id);
    }

    @PatchMapping("/evidence/{id}/status")
    public Evidence updateStatus(@PathVariable("id") UUID id, @Valid @RequestBody UpdateEvidenceStatusRequest r) {
        return evidence.updateStatus(identity.currentPrincipal(), id, r.status, r.expectedVersion);
    }

    @PostMapping("/evidence/{id}/download")
    @Operation(summary = "Record a download in the custody chain")
    public ResponseEntity<CustodyEntry> download(@PathVariable("id") UUID id, @Valid @RequestBody DownloadRequest r) {
        CustodyEntry entry = evidence.recordDownload(identity.currentPrincipal(), id, r.location);
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }
}
