package com.evidencelocker.core.config;

import com.evidencelocker.core.domain.Principal;
import com.evidencelocker.core.domain.PrincipalAccount;
import com.evidencelocker.core.domain.ports.PrincipalDirectory;
import com.evidencelocker.core.exception.UnauthenticatedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Resolves the caller of the current request to a {@link Principal}. The role comes from the
 * principal directory, not from the token, so role changes apply to the next request.
 */
@Component
public class IdentityContext {

    private static final Logger log = LoggerFactory.getLogger(IdentityContext.class);

    private final PrincipalDirectory directory;

    public IdentityContext(PrincipalDirectory directory) {
        this.directory = directory;
    }

    public Principal currentPrincipal() {
        return currentAccount().toPrincipal();
    }

    public PrincipalAccount currentAccount() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated() || auth instanceof AnonymousAuthenticationToken) {
            throw new UnauthenticatedException("No authenticated principal");
        }

        UUID principalId;
        try {
            principalId = UUID.fromString(auth.getName());
        } catch (IllegalArgumentException e) {
            throw new UnauthenticatedException("Token subject is not a principal id");
        }

        return directory.findById(principalId).orElseThrow(() -> {
            log.warn("Token subject {} does not name a known principal", principalId);
            return new UnauthenticatedException("Unknown principal " + principalId);
        });
    }
}
