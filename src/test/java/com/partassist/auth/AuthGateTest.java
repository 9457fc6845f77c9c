package com.partassist.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.partassist.runtime.AppConfig;
import com.partassist.session.MutableClock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AuthGateTest {
    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
    private final AuthGate gate = new AuthGate(SECRET, 3600, clock);

    @Test
    void shouldVerifyIssuedToken() {
        String token = gate.issueToken("alice");

        CallerIdentity caller = gate.verify(token);

        assertEquals("alice", caller.subject());
        assertEquals(Instant.parse("2026-03-01T09:00:00Z"), caller.expiresAt());
    }

    @Test
    void shouldRejectTamperedToken() {
        String token = gate.issueToken("alice");
        String tampered = token.substring(0, token.length() - 2) + (token.endsWith("AA") ? "BB" : "AA");

        assertThrows(AuthorizationException.class, () -> gate.verify(tampered));
    }

    @Test
    void shouldRejectTokenSignedWithAnotherSecret() {
        String token = new AuthGate("another-secret-that-is-long-enough!!", 3600, clock).issueToken("alice");

        assertThrows(AuthorizationException.class, () -> gate.verify(token));
    }

    @Test
    void shouldRejectExpiredToken() {
        String token = gate.issueToken("alice");
        clock.advance(Duration.ofHours(2));

        assertThrows(AuthorizationException.class, () -> gate.verify(token));
    }

    @Test
    void shouldRejectMissingOrGarbageTokens() {
        assertThrows(AuthorizationException.class, () -> gate.verify(null));
        assertThrows(AuthorizationException.class, () -> gate.verify(""));
        assertThrows(AuthorizationException.class, () -> gate.verify("not.a.jwt"));
    }

    @Test
    void shouldParseBearerHeader() {
        String token = gate.issueToken("bob");

        assertEquals("bob", gate.verifyBearer("Bearer " + token).subject());
        assertThrows(AuthorizationException.class, () -> gate.verifyBearer(token));
        assertThrows(AuthorizationException.class, () -> gate.verifyBearer(null));
    }

    @Test
    void shouldRequireStrongSecretAndPositiveTtl() {
        assertThrows(IllegalArgumentException.class, () -> new AuthGate("short", 3600, clock));
        assertThrows(IllegalArgumentException.class, () -> new AuthGate(SECRET, 0, clock));
        assertThrows(IllegalArgumentException.class, () -> gate.issueToken(" "));
    }

    @Test
    void shouldPreferSecretFromEnvironment() {
        AppConfig.AuthConfig config = new AppConfig.AuthConfig();
        config.setSecretEnv("TEST_JWT_SECRET");
        config.setSecret(SECRET);
        AuthGate fromEnv = AuthGate.fromConfig(config, Map.of("TEST_JWT_SECRET", "environment-secret-0123456789abcdef"), clock);
        AuthGate fromFile = AuthGate.fromConfig(config, Map.of(), clock);

        String envToken = fromEnv.issueToken("carol");

        assertEquals("carol", fromEnv.verify(envToken).subject());
        assertThrows(AuthorizationException.class, () -> fromFile.verify(envToken));
        assertEquals("carol", gate.verify(fromFile.issueToken("carol")).subject());
    }
}
