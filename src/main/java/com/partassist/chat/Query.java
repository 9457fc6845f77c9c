package com.partassist.chat;

import java.time.Instant;

public record Query(String text, String sessionId, Instant timestamp) {
}
