package com.partassist.auth;

import java.time.Instant;

public record CallerIdentity(String subject, Instant expiresAt) {

    public CallerIdentity {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Caller subject must not be blank");
        }
    }
}
