package com.evidencelocker.core.api;

import com.evidencelocker.core.api.dto.LoginRequest;
import com.evidencelocker.core.api.dto.PrincipalView;
import com.evidencelocker.core.application.PrincipalService;
import com.evidencelocker.core.config.IdentityContext;
import com.evidencelocker.core.config.JwtService;
import com.evidencelocker.core.domain.PrincipalAccount;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication", description = "Bearer token issue and identity")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final PrincipalService principals;
    private final JwtService jwt;
    private final IdentityContext identity;

    public AuthController(PrincipalService principals, JwtService jwt, IdentityContext identity) {
        this.principals = principals;
        this.jwt = jwt;
        this.identity = identity;
    }

    @PostMapping("/login")
    @Operation(summary = "Exchange email and password for a bearer token")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request) {
        log.info("Login attempt for: {}", request.email);

        Optional<PrincipalAccount> account = principals.authenticate(request.email, request.password);
        if (account.isEmpty()) {
            log.warn("Login failed for: {}", request.email);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("error", "Invalid credentials", "message", "Email or password is incorrect"));
        }

        PrincipalAccount a = account.get();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accessToken", jwt.generateToken(a.id(), a.username(), a.role().name()));
        body.put("tokenType", "Bearer");
        body.put("expiresInSeconds", jwt.getTtlSeconds());
        body.put("principal", PrincipalView.of(a));
        log.info("Login successful for principal {}", a.id());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/whoami")
    @Operation(summary = "The principal behind the presented token, with its current role")
    public PrincipalView whoami() {
        return PrincipalView.of(identity.currentAccount());
    }
}
