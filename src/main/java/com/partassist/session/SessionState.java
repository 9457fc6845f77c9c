package com.partassist.session;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time copy of a session. Callers never see the store's live history.
 */
public record SessionState(
        String sessionId,
        List<Turn> history,
        String lastTopic,
        Instant createdAt,
        Instant lastActiveAt) {

    public SessionState {
        history = List.copyOf(history);
    }

    public Optional<String> topic() {
        return Optional.ofNullable(lastTopic);
    }

    public List<Turn> recentTurns(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return history.subList(Math.max(0, history.size() - limit), history.size());
    }
}
