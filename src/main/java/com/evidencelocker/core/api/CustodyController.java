package com.evidencelocker.core.api;

import com.evidencelocker.core.api.dto.AppendCustodyRequest;
import com.evidencelocker.core.application.CustodyAppendCommand;
import com.evidencelocker.core.application.CustodyLedgerService;
import com.evidencelocker.core.config.IdentityContext;
import com.evidencelocker.core.domain.CustodyChainVerification;
import com.evidencelocker.core.domain.CustodyEntry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@Tag(name = "Chain of custody", description = "Append-only custody ledger per evidence item")
public class CustodyController {

    private final CustodyLedgerService ledger;
    private final IdentityContext identity;

    public CustodyController(CustodyLedgerService ledger, IdentityContext identity) {
        this.ledger = ledger;
        this.identity = identity;
    }

    @GetMapping("/evidence/{id}/custody")
    @Operation(summary = "Custody entries, newest first")
    public List<CustodyEntry> list(@PathVariable("id") UUID evidenceId) {
        return ledger.listFor(identity.currentPrincipal(), evidenceId);
    }

    @PostMapping("/evidence/{id}/custody")
    @Operation(summary = "Append a custody entry; a recipient gains read access to the item")
    public ResponseEntity<CustodyEntry> append(@PathVariable("id") UUID evidenceId,
                                               @Valid @RequestBody AppendCustodyRequest r) {
        CustodyEntry entry = ledger.append(identity.currentPrincipal(), new CustodyAppendCommand(
                evidenceId, r.action, r.fromPrincipalId, r.toPrincipalId, r.location, r.notes));
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @GetMapping("/custody/{entryId}")
    public CustodyEntry get(@PathVariable("entryId") UUID entryId) {
        return ledger.get(identity.currentPrincipal(), entryId);
    }

    @GetMapping("/evidence/{id}/custody/verification")
    @Operation(summary = "Recompute the hash chain of an item's custody entries")
    public CustodyChainVerification verify(@PathVariable("id") UUID evidenceId) {
        return ledger.verifyChain(identity.currentPrincipal(), evidenceId);
    }
}
