package com.evidencelocker.core.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import com.evidencelocker.core.domain.PrincipalAccount;
import com.evidencelocker.core.domain.ports.PrincipalDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Authenticates bearer tokens. The authentication name is the principal id from the token subject;
 * {@link IdentityContext} turns it into a domain principal. Granted authorities come from the
 * directory's current role, not from the token's role claim, so a demotion applies to URL rules
 * on the next request.
 */
public class JwtAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);
    private final JwtService jwt;
    private final PrincipalDirectory directory;

    public JwtAuthFilter(JwtService jwt, PrincipalDirectory directory) {
        this.jwt = jwt;
        this.directory = directory;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest req) {
        String path = req.getRequestURI();

        if ("OPTIONS".equalsIgnoreCase(req.getMethod())) {
            return true;
        }
        if (path.equals("/auth/login")) {
            return true;
        }
        if (path.startsWith("/v3/api-docs") || path.startsWith("/swagger-ui") || path.equals("/swagger-ui.html")) {
            return true;
        }
        return path.equals("/actuator/health") || path.equals("/actuator/info");
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain chain) throws IOException, ServletException {

        final String path = request.getRequestURI();
        final String method = request.getMethod();

        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authHeader) || !authHeader.startsWith("Bearer ")) {
            log.debug("JwtAuthFilter: No bearer token for {} {}", method, path);
            // let Spring Security answer 401
            chain.doFilter(request, response);
            return;
        }

        String token = authHeader.substring(7).trim();
        Optional<String> subject = StringUtils.hasText(token) ? jwt.getSubject(token) : Optional.empty();
        if (subject.isEmpty()) {
            log.warn("JwtAuthFilter: Invalid or expired token for {} {}", method, path);
            SecurityContextHolder.clearContext();
            chain.doFilter(request, response);
            return;
        }

        Optional<PrincipalAccount> account = lookup(subject.get());
        List<SimpleGrantedAuthority> authorities = account
                .map(a -> List.of(new SimpleGrantedAuthority("ROLE_" + a.role().name())))
                .orElse(List.of());
        if (account.isPresent() && !jwt.getRole(token).map(account.get().role().name()::equals).orElse(false)) {
            log.info("JwtAuthFilter: Token role of {} is stale, using directory role {}", subject.get(), account.get().role());
        }
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(subject.get(), null, authorities);
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.debug("JwtAuthFilter: Authenticated principal {} for {} {}", subject.get(), method, path);

        chain.doFilter(request, response);
    }

    private Optional<PrincipalAccount> lookup(String subject) {
        try {
            return directory.findById(UUID.fromString(subject));
        } catch (IllegalArgumentException e) {
            log.warn("JwtAuthFilter: Token subject is not a principal id: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
