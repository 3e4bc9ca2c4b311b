package com.evidencelocker.core.api;

import com.evidencelocker.core.api.dto.ChangeRoleRequest;
import com.evidencelocker.core.api.dto.CreatePrincipalRequest;
import com.evidencelocker.core.api.dto.PrincipalView;
import com.evidencelocker.core.api.dto.UpdateProfileRequest;
import com.evidencelocker.core.application.NewPrincipalCommand;
import com.evidencelocker.core.application.PrincipalService;
import com.evidencelocker.core.config.IdentityContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/principals")
@Tag(name = "Principals", description = "Principal directory")
public class PrincipalController {

    private final PrincipalService principals;
    private final IdentityContext identity;

    public PrincipalController(PrincipalService principals, IdentityContext identity) {
        this.principals = principals;
        this.identity = identity;
    }

    @GetMapping
    public List<PrincipalView> list() {
        return principals.list(identity.currentPrincipal()).stream().map(PrincipalView::of).toList();
    }

    @GetMapping("/{id}")
    public PrincipalView get(@PathVariable("id") UUID id) {
        return PrincipalView.of(principals.get(identity.currentPrincipal(), id));
    }

    @PostMapping
    @Operation(summary = "Register a principal (administrators only)")
    public ResponseEntity<PrincipalView> create(@Valid @RequestBody CreatePrincipalRequest r) {
        var created = principals.register(identity.currentPrincipal(), new NewPrincipalCommand(
                r.username, r.fullName, r.email, r.password, r.role, r.badgeNumber, r.department));
        return ResponseEntity.status(HttpStatus.CREATED).body(PrincipalView.of(created));
    }

    @PutMapping("/{id}/role")
    @Operation(summary = "Change a principal's role (administrators only)")
    public PrincipalView changeRole(@PathVariable("id") UUID id, @Valid @RequestBody ChangeRoleRequest r) {
        return PrincipalView.of(principals.changeRole(identity.currentPrincipal(), id, r.role));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update profile fields of oneself")
    public PrincipalView updateProfile(@PathVariable("id") UUID id, @Valid @RequestBody UpdateProfileRequest r) {
        return PrincipalView.of(principals.updateProfile(identity.currentPrincipal(), id,
                r.fullName, r.badgeNumber, r.department));
    }
}
