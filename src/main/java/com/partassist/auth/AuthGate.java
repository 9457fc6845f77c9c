package com.partassist.auth;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.partassist.runtime.AppConfig;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

/**
 * Issues and verifies HS256-signed session tokens. Everything behind the gate trusts the
 * {@link CallerIdentity} it returns.
 */
public class AuthGate {
    private static final Logger log = LoggerFactory.getLogger(AuthGate.class);
    private static final int MIN_SECRET_BYTES = 32;
    private static final String BEARER_PREFIX = "Bearer ";

    private final Key signingKey;
    private final long tokenTtlSeconds;
    private final Clock clock;

    public AuthGate(String secret, long tokenTtlSeconds, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("Token signing secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (tokenTtlSeconds <= 0) {
            throw new IllegalArgumentException("Token TTL must be positive: " + tokenTtlSeconds);
        }
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenTtlSeconds = tokenTtlSeconds;
        this.clock = clock;
    }

    public static AuthGate fromConfig(AppConfig.AuthConfig config, Map<String, String> environment, Clock clock) {
        String secret = config.getSecretEnv() == null ? null : environment.get(config.getSecretEnv());
        if (secret == null || secret.isBlank()) {
            secret = config.getSecret();
        }
        return new AuthGate(secret, config.getTokenTtlSeconds(), clock);
    }

    public String issueToken(String username) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username must not be blank");
        }
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(username)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(tokenTtlSeconds)))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    public CallerIdentity verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthorizationException("Missing token");
        }
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            if (claims.getSubject() == null || claims.getSubject().isBlank()) {
                throw new AuthorizationException("Token has no subject");
            }
            Instant expiresAt = claims.getExpiration() == null ? null : claims.getExpiration().toInstant();
            return new CallerIdentity(claims.getSubject(), expiresAt);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw new AuthorizationException("Invalid or expired token", e);
        }
    }

    /**
     * Verifies an {@code Authorization} header value of the form {@code Bearer <token>}.
     */
    public CallerIdentity verifyBearer(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new AuthorizationException("Missing bearer token");
        }
        return verify(authorizationHeader.substring(BEARER_PREFIX.length()).trim());
    }
}
