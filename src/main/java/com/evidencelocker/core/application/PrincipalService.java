package com.evidencelocker.core.application;

import com.evidencelocker.core.domain.AuditAction;
import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.PrincipalAccount;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.Role;
import com.evidencelocker.core.domain.policy.PolicyAction;
import com.evidencelocker.core.domain.policy.PrincipalRelations;
import com.evidencelocker.core.domain.ports.PrincipalDirectory;
import com.evidencelocker.core.exception.ConflictException;
import com.evidencelocker.core.exception.ResourceNotFoundException;
import com.evidencelocker.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Principal directory operations. Roles live here and are re-read on every request, so a role
 * change applies to the very next call.
 */
@Service
public class PrincipalService {

    private static final Logger log = LoggerFactory.getLogger(PrincipalService.class);
    private static final int MIN_PASSWORD_LENGTH = 8;

    private final PrincipalDirectory directory;
    private final PasswordEncoder encoder;
    private final AccessGuard guard;
    private final AuditTrailService auditTrail;
    private final Clock clock;

    public PrincipalService(PrincipalDirectory directory, PasswordEncoder encoder, AccessGuard guard,
                            AuditTrailService auditTrail, Clock clock) {
        this.directory = directory;
        this.encoder = encoder;
        this.guard = guard;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    @Transactional
    public PrincipalAccount register(Principal requester, NewPrincipalCommand cmd) {
        log.info("Registering principal - username: {}, role: {}, requester: {}", cmd.username, cmd.role, requester.id());
        guard.requireCreation(requester, ResourceType.PRINCIPAL);

        PrincipalAccount saved = save(UUID.randomUUID(), cmd);
        auditTrail.record(requester, AuditAction.CREATE_PRINCIPAL, ResourceType.PRINCIPAL, saved.id(), creationDetails(saved));
        return saved;
    }

    /**
     * Seeds the first administrator. The new admin is recorded as the actor of its own creation.
     */
    @Transactional
    public Optional<PrincipalAccount> bootstrapAdmin(String email, String password) {
        if (directory.existsByEmail(email.trim().toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        String username = email.trim().toLowerCase(Locale.ROOT).split("@")[0];
        PrincipalAccount admin = save(UUID.randomUUID(),
                new NewPrincipalCommand(username, "Administrator", email, password, Role.ADMIN, null, null));
        auditTrail.record(admin.toPrincipal(), AuditAction.CREATE_PRINCIPAL, ResourceType.PRINCIPAL, admin.id(),
                creationDetails(admin));
        return Optional.of(admin);
    }

    @Transactional(readOnly = true)
    public List<PrincipalAccount> list(Principal requester) {
        log.debug("Listing principals for {}", requester.id());
        return directory.findAllByName();
    }

    @Transactional(readOnly = true)
    public PrincipalAccount get(Principal requester, UUID principalId) {
        Optional<PrincipalAccount> account = directory.findById(principalId);
        guard.require(requester, PolicyAction.READ, ResourceType.PRINCIPAL, principalId,
                account.map(a -> new PrincipalRelations(a.id())));
        return account.get();
    }

    @Transactional
    public PrincipalAccount changeRole(Principal requester, UUID principalId, Role role) {
        log.info("Changing role of {} to {} - requester: {}", principalId, role, requester.id());
        guard.requireCreation(requester, ResourceType.PRINCIPAL);
        if (role == null) {
            throw new ValidationException("role is required");
        }
        PrincipalAccount existing = directory.findById(principalId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.PRINCIPAL, principalId));
        if (existing.role() == Role.ADMIN && role != Role.ADMIN && directory.countByRole(Role.ADMIN) <= 1) {
            throw new ConflictException("Cannot demote the last administrator " + principalId);
        }

        PrincipalAccount updated = directory.updateRole(principalId, role);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", existing.role());
        details.put("to", role);
        auditTrail.record(requester, AuditAction.CHANGE_ROLE, ResourceType.PRINCIPAL, principalId, details);
        return updated;
    }

    @Transactional
    public PrincipalAccount updateProfile(Principal requester, UUID principalId, String fullName,
                                          String badgeNumber, String department) {
        Optional<PrincipalAccount> account = directory.findById(principalId);
        guard.require(requester, PolicyAction.UPDATE, ResourceType.PRINCIPAL, principalId,
                account.map(a -> new PrincipalRelations(a.id())));
        if (fullName != null && fullName.isBlank()) {
            throw new ValidationException("fullName must not be blank");
        }

        PrincipalAccount updated = directory.updateProfile(principalId, fullName, badgeNumber, department);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fullName", updated.fullName());
        details.put("badgeNumber", updated.badgeNumber());
        details.put("department", updated.department());
        auditTrail.record(requester, AuditAction.UPDATE_PRINCIPAL, ResourceType.PRINCIPAL, principalId, details);
        return updated;
    }

    /** Password check for login; empty when the email is unknown or the password does not match. */
    @Transactional(readOnly = true)
    public Optional<PrincipalAccount> authenticate(String email, String password) {
        if (email == null || password == null) {
            return Optional.empty();
        }
        return directory.findByEmail(email.trim().toLowerCase(Locale.ROOT))
                .filter(a -> encoder.matches(password, a.passwordHash()));
    }

    private PrincipalAccount save(UUID id, NewPrincipalCommand cmd) {
        if (isBlank(cmd.username) || isBlank(cmd.fullName) || isBlank(cmd.email) || cmd.role == null) {
            throw new ValidationException("username, fullName, email and role are required");
        }
        if (cmd.password == null || cmd.password.length() < MIN_PASSWORD_LENGTH) {
            throw new ValidationException("password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        String username = cmd.username.trim();
        String email = cmd.email.trim().toLowerCase(Locale.ROOT);
        if (directory.existsByUsername(username)) {
            throw new ConflictException("Username already in use: " + username);
        }
        if (directory.existsByEmail(email)) {
            throw new ConflictException("Email already in use: " + email);
        }

        PrincipalAccount saved = directory.save(new PrincipalAccount(
                id,
                username,
                cmd.fullName.trim(),
                email,
                encoder.encode(cmd.password),
                cmd.role,
                cmd.badgeNumber,
                cmd.department,
                OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS)
        ));
        log.info("Principal {} created - username: {}, role: {}", saved.id(), saved.username(), saved.role());
        return saved;
    }

    private static Map<String, Object> creationDetails(PrincipalAccount account) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("username", account.username());
        details.put("email", account.email());
        details.put("role", account.role());
        return details;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
