package com.evidencelocker.core.config;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

@Component
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    private final Key key;
    private final long ttlSeconds;

    public JwtService(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.ttl-seconds:3600}") long ttlSeconds) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttlSeconds = ttlSeconds;
        log.info("JWT service initialized with TTL: {} seconds", ttlSeconds);
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    /* ------------------------ token creation ------------------------ */

    /**
     * Subject is the principal id. The role claim is informational only: every request re-reads the
     * current role from the principal directory.
     */
    public String generateToken(UUID principalId, String username, String role) {
        Instant now = Instant.now();
        log.debug("Generating JWT token for principal: {}, role: {}", principalId, role);

        return Jwts.builder()
                .setSubject(principalId.toString())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(ttlSeconds)))
                .claim("username", username)
                .claim("role", role)
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /* ------------------------ token parsing ------------------------ */

    public Jws<Claims> parse(String token) {
        try {
            return Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token);
        } catch (Exception e) {
            log.debug("Failed to parse JWT token: {}", e.getMessage());
            throw e;
        }
    }

    public Optional<String> getSubject(String token) {
        try {
            String subject = parse(token).getBody().getSubject();
            log.debug("Extracted subject from token: {}", subject);
            return Optional.ofNullable(subject);
        } catch (Exception e) {
            log.warn("Failed to extract subject from token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<String> getRole(String token) {
        try {
            Object role = parse(token).getBody().get("role");
            return Optional.ofNullable(role == null ? null : String.valueOf(role));
        } catch (Exception e) {
            log.warn("Failed to extract role from token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
